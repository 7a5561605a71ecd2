/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution;

/** An action sent to an operator by its consumer or by the request. */
public enum OperatorAction {
  /** Stop for good. */
  STOP,
  /** Stop after a normal termination, the operator may be reopened. */
  PAUSE
}
