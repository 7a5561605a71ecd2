/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.operator;

import org.querypipe.common.exception.QueryEngineException;
import org.querypipe.data.Tuple;
import org.querypipe.execution.ExecutionContext;
import org.querypipe.execution.Operator;
import org.querypipe.planner.physical.GroupPhysicalOperator;

/** Merges partial groups that share a key. Can be applied any number of times. */
public class IntermediateGroup extends GroupOperator {

  public IntermediateGroup(GroupPhysicalOperator plan, ExecutionContext context) {
    super(plan, context);
  }

  private IntermediateGroup(IntermediateGroup other) {
    super(other);
  }

  @Override
  protected boolean processItem(Tuple item, ExecutionContext context) {
    String key;
    try {
      key = groupKey(item, context);
      aggregatesOf(item);
    } catch (QueryEngineException e) {
      context.fatal(e);
      item.recycle();
      return false;
    }

    Tuple target = groups.get(key);
    if (target == null) {
      try {
        groups.put(key, item);
      } catch (QueryEngineException e) {
        context.fatal(e);
        return false;
      }
      return true;
    }
    try {
      cumulateIntermediate(item, target);
    } catch (RuntimeException e) {
      context.fatal(groupUpdateError("Error updating intermediate GROUP value.", e));
      return false;
    } finally {
      item.recycle();
    }
    return true;
  }

  @Override
  protected void afterItems(ExecutionContext context) {
    sendGroups(context);
  }

  @Override
  public Operator copy() {
    return new IntermediateGroup(this);
  }
}
