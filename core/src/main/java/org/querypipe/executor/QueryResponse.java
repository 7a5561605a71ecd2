/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.executor;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.querypipe.common.exception.QueryEngineException;

/** The outcome of one request. */
@Getter
@Builder
public class QueryResponse {

  private final String requestId;

  /** Rows in delivery order, empty when the request failed. */
  @Singular private final List<Map<String, Object>> rows;

  @Singular private final List<QueryEngineException> errors;

  @Singular private final List<QueryEngineException> warnings;

  private final long mutationCount;

  /** Operator profile of the request, null when the plan could not be built. */
  private final Map<String, Object> profile;

  /** Request wide counters and phase times. */
  private final Map<String, Object> metrics;

  /** Advisory notes about the execution. */
  @Singular private final List<String> notes;

  /** False when a fatal error was recorded. */
  public boolean isSuccess() {
    return errors.stream().noneMatch(QueryEngineException::isFatal);
  }

  /** Errors that did not abort the request, and the fatal one if it did. */
  public List<QueryEngineException> getErrorsAndWarnings() {
    return ImmutableList.<QueryEngineException>builder().addAll(errors).addAll(warnings).build();
  }
}
