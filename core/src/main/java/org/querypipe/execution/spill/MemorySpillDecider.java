/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.spill;

import com.google.common.annotations.VisibleForTesting;
import java.util.function.LongSupplier;
import lombok.extern.log4j.Log4j2;
import org.querypipe.execution.ExecutionContext;

/**
 * Spill decision based on memory pressure. With a request memory quota, an operator spills once
 * its buffer exceeds the producer throttle quota and the request has used more than a given share
 * of its quota. Without one, an operator spills once its buffer exceeds a share of the free heap
 * per processor.
 */
@Log4j2
public class MemorySpillDecider implements SpillDecider {

  /** Share of the request quota in use above which operators spill. */
  public static final double QUOTA_THRESHOLD = 0.75;

  /** Share of free heap per processor an operator may buffer. */
  public static final double AVAILABLE_MEMORY_THRESHOLD = 0.15;

  static final long MIN_SIZE = 20L * 1024 * 1024;

  private final ExecutionContext context;
  private final String operatorName;
  private final long maxSize;
  private boolean spilled;

  public MemorySpillDecider(ExecutionContext context, String operatorName) {
    this(context, operatorName, MemorySpillDecider::availableMemory);
  }

  @VisibleForTesting
  MemorySpillDecider(ExecutionContext context, String operatorName, LongSupplier freeMemory) {
    this.context = context;
    this.operatorName = operatorName;
    long size =
        (long)
            ((double) freeMemory.getAsLong()
                / Runtime.getRuntime().availableProcessors()
                * AVAILABLE_MEMORY_THRESHOLD);
    this.maxSize = Math.max(size, MIN_SIZE);
  }

  @Override
  public boolean shouldSpill(long currentSize, long additionalSize) {
    boolean spill;
    if (context.useRequestQuota()) {
      spill =
          currentSize + additionalSize > context.producerThrottleQuota()
              && context.currentQuotaUsage() > QUOTA_THRESHOLD;
    } else {
      spill = currentSize + additionalSize > maxSize;
    }
    if (spill && !spilled) {
      spilled = true;
      log.debug("{} spilling at {} bytes buffered", operatorName, currentSize);
    }
    return spill;
  }

  static long availableMemory() {
    Runtime runtime = Runtime.getRuntime();
    return runtime.maxMemory() - (runtime.totalMemory() - runtime.freeMemory());
  }
}
