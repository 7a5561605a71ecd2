/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.storage;

import java.util.List;
import org.querypipe.common.exception.QueryEngineException;

/**
 * Outcome of a mutation batch.
 *
 * @param mutated the pairs that were applied
 * @param errors failures of the other pairs
 */
public record MutationResult(List<KeyValuePair> mutated, List<QueryEngineException> errors) {

  public MutationResult {
    mutated = List.copyOf(mutated);
    errors = List.copyOf(errors);
  }
}
