/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.storage;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.querypipe.common.exception.DatastoreException;

/** Datastore holding its keyspaces in memory. */
public class InMemoryDatastore implements Datastore {

  private final Map<String, InMemoryKeyspace> keyspaces = new ConcurrentHashMap<>();

  @Override
  public Keyspace keyspace(String name) {
    Keyspace keyspace = keyspaces.get(name);
    if (keyspace == null) {
      throw DatastoreException.keyspaceNotFound(name);
    }
    return keyspace;
  }

  /** Creates a keyspace, or returns the existing one. */
  public InMemoryKeyspace createKeyspace(String name) {
    return keyspaces.computeIfAbsent(name, InMemoryKeyspace::new);
  }
}
