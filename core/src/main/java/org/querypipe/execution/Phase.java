/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** The time phase an operator worker is in, used to accrue execution, queueing and service time. */
@Getter
@RequiredArgsConstructor
public enum Phase {
  NOTIME(""),
  /** Executing operator code. */
  EXEC("running"),
  /** Blocked on a queue. */
  CHAN("kernel"),
  /** Blocked on a datastore call. */
  SERV("services");

  private final String displayName;
}
