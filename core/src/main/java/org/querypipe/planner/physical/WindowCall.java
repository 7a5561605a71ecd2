/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.planner.physical;

import org.querypipe.expression.window.WindowFunction;

/**
 * One window function call; its result is stored under {@code name} in the item's aggregates.
 *
 * @param name result name
 * @param function the function
 * @param term the OVER clause
 */
public record WindowCall(String name, WindowFunction function, WindowTerm term) {

  public WindowCall(WindowFunction function, WindowTerm term) {
    this(function.toString(), function, term);
  }
}
