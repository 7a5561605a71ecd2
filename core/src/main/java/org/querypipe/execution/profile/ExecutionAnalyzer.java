/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.profile;

import java.util.List;
import java.util.TreeSet;
import org.querypipe.execution.BaseOperator;
import org.querypipe.execution.Operator;
import org.querypipe.execution.operator.Collect;
import org.querypipe.execution.operator.Fetch;
import org.querypipe.execution.operator.Filter;
import org.querypipe.execution.operator.HashJoin;
import org.querypipe.execution.operator.Order;
import org.querypipe.execution.operator.PrimaryScan;

/**
 * Derives advisory notes from the statistics of a finished operator tree: where time went and
 * which operators handled unusually many items. Notes are distinct and sorted.
 */
public class ExecutionAnalyzer {

  static final long LARGE_COUNT = 10_000;
  static final long WAIT_THRESHOLD = 10;
  static final long IO_THRESHOLD = 2;
  static final double ELIMINATION_RATIO = 0.1;

  private final TreeSet<String> notes = new TreeSet<>();
  private long execTime;
  private long servTime;
  private long chanTime;

  private ExecutionAnalyzer() {}

  public static List<String> analyze(Operator root) {
    ExecutionAnalyzer analyzer = new ExecutionAnalyzer();
    analyzer.visit(root);
    if (analyzer.servTime > analyzer.execTime * IO_THRESHOLD) {
      analyzer.notes.add("High IO time");
    }
    if (analyzer.chanTime > (analyzer.execTime + analyzer.servTime) * WAIT_THRESHOLD) {
      analyzer.notes.add("High wait time");
    }
    return List.copyOf(analyzer.notes);
  }

  private void visit(Operator operator) {
    if (operator instanceof BaseOperator) {
      BaseOperator base = (BaseOperator) operator;
      execTime += base.getExecTime();
      servTime += base.getServTime();
      chanTime += base.getChanTime();
      check(base);
    }
    for (Operator child : operator.getChildren()) {
      visit(child);
    }
  }

  private void check(BaseOperator operator) {
    if (operator instanceof PrimaryScan && operator.getOutDocs() > LARGE_COUNT) {
      notes.add("High primary scan count");
    } else if (operator instanceof Fetch && operator.getOutDocs() > LARGE_COUNT) {
      notes.add("High fetch count");
    } else if (operator instanceof Filter && eliminatesMost(operator)) {
      notes.add("Filter eliminating over 90%");
    } else if (operator instanceof HashJoin && eliminatesMost(operator)) {
      notes.add("Hash join eliminating over 90%");
    } else if (operator instanceof Order && operator.getInDocs() > LARGE_COUNT) {
      notes.add("Large sort");
    } else if (operator instanceof Collect && operator.getInDocs() > LARGE_COUNT) {
      notes.add("Large sub-query result");
    }
  }

  private static boolean eliminatesMost(BaseOperator operator) {
    long in = operator.getInDocs();
    return in > LARGE_COUNT && (double) operator.getOutDocs() / in < ELIMINATION_RATIO;
  }
}
