/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import org.querypipe.data.Tuple;

/** The object pools of one request: batch buffers and scratch maps. */
@Getter
public class ExecutionPools {

  private static final int MAX_IDLE = 64;

  private final ObjectPool<List<Tuple>> batchPool;
  private final ObjectPool<Map<String, Tuple>> mapPool;

  public ExecutionPools(int batchSize, int mapSize) {
    this.batchPool =
        new ObjectPool<>(batchSize, MAX_IDLE, () -> new ArrayList<>(batchSize), List::clear);
    this.mapPool = new ObjectPool<>(mapSize, MAX_IDLE, () -> new HashMap<>(mapSize), Map::clear);
  }

  public int batchSize() {
    return batchPool.size();
  }
}
