/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.operator;

import com.google.common.math.LongMath;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import lombok.extern.log4j.Log4j2;
import org.querypipe.common.exception.EvaluationException;
import org.querypipe.common.exception.MemoryQuotaExceededException;
import org.querypipe.common.exception.QueryEngineException;
import org.querypipe.data.Tuple;
import org.querypipe.execution.BaseOperator;
import org.querypipe.execution.ExecutionContext;
import org.querypipe.execution.ExecutionPhase;
import org.querypipe.execution.Operator;
import org.querypipe.execution.spill.SpillDecider;
import org.querypipe.execution.spill.SpillFile;
import org.querypipe.planner.physical.OrderPhysicalOperator;
import org.querypipe.planner.physical.SortKey;

/**
 * Sorts its input.
 *
 * <p>With a known limit no larger than the fallback threshold the operator keeps only the best
 * {@code offset + limit} items in a max heap. Otherwise it buffers everything, spilling sorted runs
 * when the spill decider asks for room, and sorts or merges at the end of input. Items that
 * compare equal keep their arrival order, so both ways produce the same sequence.
 */
@Log4j2
public class Order extends BaseOperator {

  static final String SORT_VALUES = "#sortValues";
  static final String SEQUENCE = "#sequence";

  private final OrderPhysicalOperator order;
  private final Comparator<Tuple> comparator;
  private final SpillDecider spillDecider;

  private PriorityQueue<Tuple> heap;
  private List<Tuple> buffer = new ArrayList<>();
  private final List<SpillFile> runs = new ArrayList<>();
  private long heapCapacity;
  private long sequence;
  private long bufferedSize;

  public Order(OrderPhysicalOperator plan, ExecutionContext context) {
    super(plan, context);
    this.order = plan;
    this.comparator = comparator(plan.getTerms());
    this.spillDecider = context.spillDecider(plan.getOperatorType().getDisplayName());
  }

  private Order(Order other) {
    super(other);
    this.order = other.order;
    this.comparator = other.comparator;
    this.spillDecider = context.spillDecider(order.getOperatorType().getDisplayName());
  }

  /** Orders items by their precomputed sort values, then by arrival. */
  static Comparator<Tuple> comparator(List<SortKey> terms) {
    return (left, right) -> {
      List<?> leftValues = sortValues(left);
      List<?> rightValues = sortValues(right);
      for (int i = 0; i < terms.size(); i++) {
        int result = terms.get(i).compare(leftValues.get(i), rightValues.get(i));
        if (result != 0) {
          return result;
        }
      }
      return Long.compare(sequenceOf(left), sequenceOf(right));
    };
  }

  private static List<?> sortValues(Tuple item) {
    return (List<?>) item.getAttachment(SORT_VALUES);
  }

  private static long sequenceOf(Tuple item) {
    return ((Number) item.getAttachment(SEQUENCE)).longValue();
  }

  @Override
  protected ExecutionPhase executionPhase() {
    return ExecutionPhase.SORT;
  }

  @Override
  protected boolean beforeItems(ExecutionContext context, Tuple parent) {
    long bound = LongMath.saturatedAdd(order.getOffset(), order.getLimit());
    if (order.hasLimit() && bound <= context.getOrderFallbackNum()) {
      heapCapacity = bound;
      heap = new PriorityQueue<>((int) Math.max(1, Math.min(bound, 1024)), comparator.reversed());
    }
    return true;
  }

  @Override
  protected boolean processItem(Tuple item, ExecutionContext context) {
    List<Object> values = new ArrayList<>(order.getTerms().size());
    try {
      for (SortKey term : order.getTerms()) {
        values.add(term.expression().evaluate(item, context));
      }
    } catch (EvaluationException e) {
      context.error(e);
      item.recycle();
      return false;
    }
    item.setAttachment(SORT_VALUES, values);
    item.setAttachment(SEQUENCE, sequence++);
    if (!order.getClipFields().isEmpty()) {
      item.retainFields(order.getClipFields());
    }
    try {
      return heap != null ? offerHeap(item) : offerBuffer(item);
    } catch (QueryEngineException e) {
      context.fatal(e);
      return false;
    }
  }

  private boolean offerHeap(Tuple item) {
    if (heapCapacity == 0) {
      item.recycle();
      return true;
    }
    if (heap.size() >= heapCapacity) {
      // a max heap: the head is the worst item kept so far
      if (comparator.compare(item, heap.peek()) >= 0) {
        item.recycle();
        return true;
      }
      Tuple evicted = heap.poll();
      release(evicted.estimatedSize());
      evicted.recycle();
    }
    heap.add(item);
    return track(item.estimatedSize());
  }

  private boolean offerBuffer(Tuple item) {
    long size = item.estimatedSize();
    if (!buffer.isEmpty() && spillDecider.shouldSpill(bufferedSize, size)) {
      spill();
    }
    buffer.add(item);
    return track(size);
  }

  private boolean track(long size) {
    bufferedSize += size;
    if (context.useRequestQuota() && context.trackValueSize(size)) {
      throw new MemoryQuotaExceededException(context.getMemoryQuota(), context.getUsedMemory());
    }
    return true;
  }

  private void release(long size) {
    bufferedSize -= size;
    if (context.useRequestQuota()) {
      context.releaseValueSize(size);
    }
  }

  private void spill() {
    buffer.sort(comparator);
    SpillFile run = SpillFile.create("order");
    runs.add(run);
    for (Tuple item : buffer) {
      run.write(item);
      item.recycle();
    }
    run.finish();
    log.debug("Order spilled {} items, {} bytes, run {}", buffer.size(), bufferedSize, runs.size());
    buffer.clear();
    release(bufferedSize);
  }

  @Override
  protected void afterItems(ExecutionContext context) {
    try {
      if (!isStopped()) {
        emitSorted();
      }
    } catch (QueryEngineException e) {
      context.fatal(e);
    } finally {
      context.addPhaseCount(ExecutionPhase.SORT, sequence);
      releaseBuffers();
    }
  }

  private void emitSorted() {
    if (heap != null) {
      buffer = new ArrayList<>(heap);
      heap.clear();
    }
    if (runs.isEmpty()) {
      List<Tuple> sorted = buffer;
      buffer = new ArrayList<>();
      sorted.sort(comparator);
      Emitter emitter = new Emitter();
      for (int i = 0; i < sorted.size(); i++) {
        if (!emitter.emit(sorted.get(i))) {
          sorted.subList(i + 1, sorted.size()).forEach(Tuple::recycle);
          return;
        }
      }
      return;
    }
    spill();
    mergeRuns(new Emitter());
  }

  private void mergeRuns(Emitter emitter) {
    PriorityQueue<RunCursor> heads =
        new PriorityQueue<>((left, right) -> comparator.compare(left.head, right.head));
    List<RunCursor> cursors = new ArrayList<>(runs.size());
    try {
      for (SpillFile run : runs) {
        RunCursor cursor = new RunCursor(run.read());
        cursors.add(cursor);
        if (cursor.advance()) {
          heads.add(cursor);
        }
      }
      while (!heads.isEmpty()) {
        RunCursor cursor = heads.poll();
        Tuple item = cursor.head;
        if (cursor.advance()) {
          heads.add(cursor);
        }
        if (!emitter.emit(item)) {
          return;
        }
      }
    } finally {
      cursors.forEach(cursor -> cursor.reader.close());
    }
  }

  private void releaseBuffers() {
    if (heap != null) {
      heap.forEach(Tuple::recycle);
      heap.clear();
    }
    buffer.forEach(Tuple::recycle);
    buffer.clear();
    release(bufferedSize);
    runs.forEach(SpillFile::close);
    runs.clear();
  }

  @Override
  protected long usedMemory() {
    return bufferedSize;
  }

  @Override
  protected void resetState() {
    releaseBuffers();
    heap = null;
    sequence = 0;
  }

  @Override
  public void done() {
    super.done();
    releaseBuffers();
  }

  @Override
  public Operator copy() {
    return new Order(this);
  }

  /** Applies offset and limit to the sorted sequence. */
  private class Emitter {
    private long skipped;
    private long sent;

    boolean emit(Tuple item) {
      if (skipped < order.getOffset()) {
        skipped++;
        item.recycle();
        return true;
      }
      if (order.hasLimit() && sent >= order.getLimit()) {
        item.recycle();
        return false;
      }
      sent++;
      item.removeAttachment(SORT_VALUES);
      item.removeAttachment(SEQUENCE);
      return sendItem(item);
    }
  }

  private static class RunCursor {
    private final SpillFile.TupleReader reader;
    private Tuple head;

    RunCursor(SpillFile.TupleReader reader) {
      this.reader = reader;
    }

    boolean advance() {
      head = reader.hasNext() ? reader.next() : null;
      return head != null;
    }
  }
}
