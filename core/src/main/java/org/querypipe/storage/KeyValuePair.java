/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.storage;

import java.util.Map;

/**
 * A document key and, except for deletes, the document to write.
 *
 * @param key document key
 * @param value document, null for DELETE
 */
public record KeyValuePair(String key, Map<String, Object> value) {}
