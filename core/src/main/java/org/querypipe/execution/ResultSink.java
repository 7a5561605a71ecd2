/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution;

import org.querypipe.data.Tuple;

/** Receives the results of a request. */
public interface ResultSink {

  /**
   * Delivers one result.
   *
   * @return false if no more results are wanted
   */
  boolean result(Tuple item);

  /** Called once when the result stream ends, normally or not. */
  void close();
}
