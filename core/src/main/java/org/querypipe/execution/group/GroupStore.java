/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.group;

import com.google.common.annotations.VisibleForTesting;
import java.io.Closeable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.function.BinaryOperator;
import java.util.function.Predicate;
import lombok.extern.log4j.Log4j2;
import org.querypipe.common.exception.MemoryQuotaExceededException;
import org.querypipe.data.Tuple;
import org.querypipe.execution.ExecutionContext;
import org.querypipe.execution.spill.SpillDecider;
import org.querypipe.execution.spill.SpillFile;

/**
 * Groups of an aggregating operator, by group key.
 *
 * <p>Groups live in memory until the spill decider asks for room; the in-memory groups are then
 * written, sorted by key, to a spill run and dropped from memory. Iteration merges the runs and
 * the remaining in-memory groups by key, combining the parts of a group with the merge function.
 * With {@link SpillDecider#NEVER} the store is a plain map.
 *
 * <p>A store belongs to one operator and is not thread safe, except for {@link #stop}.
 */
@Log4j2
public class GroupStore implements Closeable {

  static final String KEY_ATTACHMENT = "#groupKey";
  static final String PARENT_ATTACHMENT = "#parent";

  private final String name;
  private final ExecutionContext context;
  private final SpillDecider spillDecider;
  private final BinaryOperator<Tuple> merger;

  private final Map<String, Tuple> groups = new HashMap<>();
  private final List<SpillFile> runs = new ArrayList<>();
  private long memorySize;

  private final Map<String, Tuple> parents = new HashMap<>();
  private final Map<Tuple, String> parentKeys = new IdentityHashMap<>();

  private volatile boolean stopped;

  /**
   * @param merger combines two parts of the same group into the first and returns it
   */
  public GroupStore(
      String name,
      ExecutionContext context,
      SpillDecider spillDecider,
      BinaryOperator<Tuple> merger) {
    this.name = name;
    this.context = context;
    this.spillDecider = spillDecider;
    this.merger = merger;
  }

  /** The in-memory group under {@code key}, or null. */
  public Tuple get(String key) {
    return groups.get(key);
  }

  /**
   * Adds a group that {@link #get} did not find. Spills the groups in memory first if the spill
   * decider asks for it.
   *
   * @throws MemoryQuotaExceededException if the request quota is exhausted
   */
  public void put(String key, Tuple group) {
    long size = group.estimatedSize();
    if (!groups.isEmpty() && spillDecider.shouldSpill(memorySize, size)) {
      spill();
    }
    groups.put(key, group);
    memorySize += size;
    if (context.useRequestQuota() && context.trackValueSize(size)) {
      throw new MemoryQuotaExceededException(context.getMemoryQuota(), context.getUsedMemory());
    }
  }

  /** Number of groups held in memory. */
  public int size() {
    return groups.size();
  }

  public boolean isEmpty() {
    return groups.isEmpty() && runs.isEmpty();
  }

  public long getMemorySize() {
    return memorySize;
  }

  public int getSpillCount() {
    return runs.size();
  }

  /** Ends a running {@link #forEach} early. */
  public void stop() {
    stopped = true;
  }

  /**
   * Visits every group once, in no particular order when nothing was spilled and in key order
   * otherwise. Stops when the visitor returns false.
   *
   * @return false if the visit was stopped
   */
  public boolean forEach(Predicate<Tuple> visitor) {
    if (runs.isEmpty()) {
      for (Tuple group : groups.values()) {
        if (stopped || !visitor.test(group)) {
          return false;
        }
      }
      return true;
    }
    spill();
    return mergeRuns(visitor);
  }

  @VisibleForTesting
  void spill() {
    if (groups.isEmpty()) {
      return;
    }
    List<Map.Entry<String, Tuple>> entries = new ArrayList<>(groups.entrySet());
    entries.sort(Map.Entry.comparingByKey());
    SpillFile run = SpillFile.create(name);
    runs.add(run);
    for (Map.Entry<String, Tuple> entry : entries) {
      Tuple group = entry.getValue();
      group.setAttachment(KEY_ATTACHMENT, entry.getKey());
      beforeSpill(group);
      run.write(group);
      group.recycle();
    }
    run.finish();
    log.debug(
        "{} spilled {} groups, {} bytes, run {}", name, entries.size(), memorySize, runs.size());
    groups.clear();
    releaseMemory();
  }

  private boolean mergeRuns(Predicate<Tuple> visitor) {
    PriorityQueue<RunCursor> heads =
        new PriorityQueue<>(Comparator.comparing((RunCursor cursor) -> cursor.key));
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
        if (stopped) {
          return false;
        }
        RunCursor first = heads.poll();
        String key = first.key;
        Tuple group = first.take();
        if (first.advance()) {
          heads.add(first);
        }
        while (!heads.isEmpty() && heads.peek().key.equals(key)) {
          RunCursor next = heads.poll();
          group = merger.apply(group, next.take());
          if (next.advance()) {
            heads.add(next);
          }
        }
        afterRead(group);
        if (!visitor.test(group)) {
          return false;
        }
      }
      return true;
    } finally {
      cursors.forEach(cursor -> cursor.reader.close());
    }
  }

  private void beforeSpill(Tuple group) {
    Tuple parent = group.getParent();
    if (parent == null) {
      return;
    }
    String key = parentKeys.computeIfAbsent(parent, p -> Integer.toString(parentKeys.size()));
    parents.put(key, parent);
    group.setAttachment(PARENT_ATTACHMENT, key);
    group.setParent(null);
  }

  private void afterRead(Tuple group) {
    group.removeAttachment(KEY_ATTACHMENT);
    Object key = group.getAttachment(PARENT_ATTACHMENT);
    if (key != null) {
      group.setParent(parents.get(key.toString()));
      group.removeAttachment(PARENT_ATTACHMENT);
    }
  }

  private void releaseMemory() {
    if (context.useRequestQuota()) {
      context.releaseValueSize(memorySize);
    }
    memorySize = 0;
  }

  /** Drops every group and deletes the spill runs. The store can be used again. */
  public void release() {
    groups.clear();
    releaseMemory();
    runs.forEach(SpillFile::close);
    runs.clear();
    parents.clear();
    parentKeys.clear();
    stopped = false;
  }

  @Override
  public void close() {
    release();
  }

  private static final class RunCursor {
    private final SpillFile.TupleReader reader;
    private Tuple head;
    private String key;

    private RunCursor(SpillFile.TupleReader reader) {
      this.reader = reader;
    }

    private boolean advance() {
      if (!reader.hasNext()) {
        head = null;
        key = null;
        return false;
      }
      head = reader.next();
      key = (String) head.getAttachment(KEY_ATTACHMENT);
      return true;
    }

    private Tuple take() {
      return head;
    }
  }
}
