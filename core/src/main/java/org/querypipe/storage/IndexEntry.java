/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.storage;

/** One primary index entry. */
public record IndexEntry(String primaryKey) {}
