/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.data;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.Getter;
import lombok.Setter;

/**
 * One document flowing through the pipeline. A tuple carries its fields, an optional document key
 * and a side table of named attachments (running aggregates, cached values).
 *
 * <p>Tuples are immutable by convention once handed to another operator: only the holder of the
 * sole reference may mutate one. {@link #track()} adds a reference, {@link #recycle()} drops one
 * and clears the tuple when the last reference goes away.
 */
public class Tuple {

  /** Attachment holding the per aggregate accumulator values of a group. */
  public static final String AGGREGATES = "aggregates";

  private final Map<String, Object> fields;
  private final Map<String, Object> attachments;
  private final AtomicInteger refCount = new AtomicInteger(1);

  @Getter @Setter private String id;

  /** Identifies the producer of this tuple when several producers share one queue. */
  @Getter @Setter private int bit;

  /** Enclosing scope, consulted for fields this tuple does not have. */
  @Getter @Setter private Tuple parent;

  public Tuple() {
    this(new LinkedHashMap<>());
  }

  public Tuple(Map<String, Object> fields) {
    this.fields = fields;
    this.attachments = new LinkedHashMap<>(4);
  }

  public static Tuple of(Map<String, ?> fields) {
    return new Tuple(new LinkedHashMap<>(fields));
  }

  public static Tuple of(String id, Map<String, ?> fields) {
    Tuple tuple = of(fields);
    tuple.setId(id);
    return tuple;
  }

  /**
   * Returns the value at a dotted path, or {@link Values#MISSING} if any step of the path does not
   * exist. A path whose first step is not a field of this tuple is looked up in the parent scope.
   */
  public Object getField(String path) {
    int dot = path.indexOf('.');
    String first = dot < 0 ? path : path.substring(0, dot);
    if (!fields.containsKey(first)) {
      return parent == null ? Values.MISSING : parent.getField(path);
    }
    if (dot < 0) {
      return fields.get(path);
    }
    Object current = fields;
    int start = 0;
    while (start <= path.length()) {
      int end = path.indexOf('.', start);
      String step = end < 0 ? path.substring(start) : path.substring(start, end);
      if (!(current instanceof Map)) {
        return Values.MISSING;
      }
      Map<?, ?> map = (Map<?, ?>) current;
      if (!map.containsKey(step)) {
        return Values.MISSING;
      }
      current = map.get(step);
      if (end < 0) {
        return current;
      }
      start = end + 1;
    }
    return Values.MISSING;
  }

  public void setField(String name, Object value) {
    if (value == Values.MISSING) {
      fields.remove(name);
    } else {
      fields.put(name, value);
    }
  }

  public Object removeField(String name) {
    return fields.remove(name);
  }

  /** Read only view of the top level fields. */
  public Map<String, Object> getFields() {
    return Collections.unmodifiableMap(fields);
  }

  /** Keeps only the named top level fields. */
  public void retainFields(Collection<String> names) {
    fields.keySet().retainAll(names);
  }

  public Object getAttachment(String name) {
    return attachments.get(name);
  }

  public void setAttachment(String name, Object value) {
    attachments.put(name, value);
  }

  public void removeAttachment(String name) {
    attachments.remove(name);
  }

  public Map<String, Object> getAttachments() {
    return Collections.unmodifiableMap(attachments);
  }

  /** Returns the aggregates attachment, or null if this tuple carries none. */
  @SuppressWarnings("unchecked")
  public Map<String, Object> getAggregates() {
    return (Map<String, Object>) attachments.get(AGGREGATES);
  }

  /** Adds a reference. */
  public Tuple track() {
    refCount.incrementAndGet();
    return this;
  }

  /**
   * Drops a reference. The last reference clears fields and attachments.
   *
   * @return true if this call released the tuple
   */
  public boolean recycle() {
    int count = refCount.decrementAndGet();
    if (count == 0) {
      fields.clear();
      attachments.clear();
      parent = null;
      return true;
    }
    return false;
  }

  public int refCount() {
    return refCount.get();
  }

  /** Copies fields and attachments into a new tuple with its own reference count. */
  public Tuple copy() {
    Tuple copy = new Tuple(Values.deepCopyMap(fields));
    copy.attachments.putAll(attachments);
    Map<String, Object> aggregates = getAggregates();
    if (aggregates != null) {
      copy.attachments.put(AGGREGATES, new LinkedHashMap<>(aggregates));
    }
    copy.id = id;
    copy.bit = bit;
    copy.parent = parent;
    return copy;
  }

  /** Rough heap footprint used for memory quota accounting. */
  public long estimatedSize() {
    long size = 48 + Values.estimateSize(fields);
    if (!attachments.isEmpty()) {
      size += Values.estimateSize(attachments);
    }
    if (id != null) {
      size += 40 + 2L * id.length();
    }
    return size;
  }

  /** Field names in insertion order. */
  public List<String> fieldNames() {
    return new ArrayList<>(fields.keySet());
  }

  @Override
  public String toString() {
    return id == null ? fields.toString() : id + "=" + fields;
  }
}
