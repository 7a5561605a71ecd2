/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.storage;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import lombok.Getter;
import org.querypipe.common.exception.DatastoreException;
import org.querypipe.common.exception.ErrorCode;
import org.querypipe.common.exception.QueryEngineException;

/** Keyspace backed by a sorted concurrent map. Documents are copied in and out. */
public class InMemoryKeyspace implements Keyspace {

  @Getter private final String name;

  private final ConcurrentSkipListMap<String, Map<String, Object>> documents =
      new ConcurrentSkipListMap<>();

  public InMemoryKeyspace(String name) {
    this.name = name;
  }

  /** Stores a document, replacing any existing one. */
  public InMemoryKeyspace put(String key, Map<String, Object> document) {
    documents.put(key, new LinkedHashMap<>(document));
    return this;
  }

  public Map<String, Object> get(String key) {
    return documents.get(key);
  }

  @Override
  public Map<String, Map<String, Object>> fetch(
      Collection<String> keys, List<QueryEngineException> errors) {
    Map<String, Map<String, Object>> result = new LinkedHashMap<>(keys.size() * 2);
    for (String key : keys) {
      Map<String, Object> document = documents.get(key);
      if (document != null) {
        result.put(key, new LinkedHashMap<>(document));
      }
    }
    return result;
  }

  @Override
  public Iterator<IndexEntry> scan(ScanSpan span, long limit) {
    NavigableMap<String, Map<String, Object>> range = documents;
    if (span.low() != null) {
      range = range.tailMap(span.low(), true);
    }
    if (span.high() != null) {
      range = range.headMap(span.high(), span.inclusive());
    }
    Iterator<String> keys = range.keySet().iterator();
    return new Iterator<>() {
      private long returned;

      @Override
      public boolean hasNext() {
        return (limit <= 0 || returned < limit) && keys.hasNext();
      }

      @Override
      public IndexEntry next() {
        returned++;
        return new IndexEntry(keys.next());
      }
    };
  }

  @Override
  public MutationResult mutate(MutationKind kind, List<KeyValuePair> pairs) {
    List<KeyValuePair> mutated = new ArrayList<>(pairs.size());
    List<QueryEngineException> errors = new ArrayList<>();
    for (KeyValuePair pair : pairs) {
      boolean applied;
      switch (kind) {
        case INSERT:
          applied = documents.putIfAbsent(pair.key(), new LinkedHashMap<>(pair.value())) == null;
          break;
        case UPSERT:
          documents.put(pair.key(), new LinkedHashMap<>(pair.value()));
          applied = true;
          break;
        case UPDATE:
          applied = documents.replace(pair.key(), new LinkedHashMap<>(pair.value())) != null;
          break;
        default:
          applied = documents.remove(pair.key()) != null;
          break;
      }
      if (applied) {
        mutated.add(pair);
      } else {
        errors.add(
            new DatastoreException(
                ErrorCode.DATASTORE_MUTATION,
                String.format(
                    "%s failed for key %s: document %s",
                    kind, pair.key(), kind == MutationKind.INSERT ? "exists" : "not found")));
      }
    }
    return new MutationResult(mutated, errors);
  }

  @Override
  public long count() {
    return documents.size();
  }
}
