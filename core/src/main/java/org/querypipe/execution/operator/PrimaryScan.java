/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.operator;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.querypipe.common.exception.QueryEngineException;
import org.querypipe.data.Tuple;
import org.querypipe.execution.BaseOperator;
import org.querypipe.execution.ExecutionContext;
import org.querypipe.execution.ExecutionPhase;
import org.querypipe.execution.Operator;
import org.querypipe.execution.Phase;
import org.querypipe.planner.physical.ScanPhysicalOperator;
import org.querypipe.storage.IndexEntry;
import org.querypipe.storage.Keyspace;

/**
 * Emits one item per primary key of a keyspace, in key order. Keys are read from the datastore
 * in chunks of the scan cap; the items carry only their document id.
 */
public class PrimaryScan extends BaseOperator {

  private final ScanPhysicalOperator scan;

  public PrimaryScan(ScanPhysicalOperator plan, ExecutionContext context) {
    super(plan, context);
    this.scan = plan;
  }

  private PrimaryScan(PrimaryScan other) {
    super(other);
    this.scan = other.scan;
  }

  @Override
  protected ExecutionPhase executionPhase() {
    return ExecutionPhase.PRIMARY_SCAN;
  }

  @Override
  protected void runItems(ExecutionContext context, Tuple parent) {
    int chunkSize = Math.max(1, context.getScanCap());
    List<IndexEntry> chunk = new ArrayList<>(chunkSize);
    long count = 0;
    switchPhase(Phase.SERV);
    try {
      Keyspace keyspace = context.getDatastore().keyspace(scan.getKeyspace());
      Iterator<IndexEntry> entries = keyspace.scan(scan.getSpan(), scan.getLimit());
      while (!isStopped()) {
        chunk.clear();
        while (chunk.size() < chunkSize && entries.hasNext()) {
          chunk.add(entries.next());
        }
        if (chunk.isEmpty()) {
          break;
        }
        switchPhase(Phase.EXEC);
        for (IndexEntry entry : chunk) {
          Tuple item = new Tuple();
          item.setId(entry.primaryKey());
          item.setParent(parent);
          count++;
          if (!sendItem(item)) {
            return;
          }
        }
        switchPhase(Phase.SERV);
      }
    } catch (QueryEngineException e) {
      context.fatal(e);
    } finally {
      switchPhase(Phase.EXEC);
      context.addPhaseCount(ExecutionPhase.PRIMARY_SCAN, count);
    }
  }

  @Override
  public Operator copy() {
    return new PrimaryScan(this);
  }
}
