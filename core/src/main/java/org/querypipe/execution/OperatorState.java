/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution;

/**
 * Lifecycle state of an execution operator.
 *
 * <p>An operator is created, runs and completes, but it may also be stopped half way, start only
 * after its request has finished, or never start at all. {@link BaseOperator#done()} never waits
 * for an operator that has not started: such an operator is {@link #KILLED} and cleans up after
 * itself if it ever runs.
 */
public enum OperatorState {
  /** Not yet active. */
  CREATED,
  /** Never runs, never changes state while the request executes. */
  DORMANT,

  RUNNING,
  /** Running, a stop has been requested. */
  STOPPING,

  PANICKED,
  COMPLETED,
  STOPPED,

  /** Stopped before it started, eligible for reopen. */
  PAUSED,

  DONE,
  ENDED,
  KILLED;

  /** True for the states in which the operator's worker sends a completion signal. */
  public boolean signalsCompletion() {
    return this == RUNNING || this == STOPPING || this == COMPLETED || this == STOPPED;
  }
}
