/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.storage;

import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.querypipe.common.exception.QueryEngineException;

/**
 * A named collection of JSON documents addressed by string keys. All calls are blocking service
 * calls.
 */
public interface Keyspace {

  String getName();

  /**
   * Fetches documents by key. Keys that do not exist are absent from the result.
   *
   * @param keys keys to fetch
   * @param errors receives per key failures, the fetch continues past them
   * @return documents by key
   */
  Map<String, Map<String, Object>> fetch(
      Collection<String> keys, List<QueryEngineException> errors);

  /**
   * Scans the primary index.
   *
   * @param span key range
   * @param limit maximum number of entries, 0 for no limit
   */
  Iterator<IndexEntry> scan(ScanSpan span, long limit);

  /**
   * Applies a batch of mutations. Per pair failures are reported in the result and do not stop
   * the batch.
   */
  MutationResult mutate(MutationKind kind, List<KeyValuePair> pairs);

  long count();
}
