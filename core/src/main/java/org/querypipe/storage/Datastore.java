/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.storage;

/** Datastore the engine reads documents from and sends mutations to. */
public interface Datastore {

  /**
   * Get {@link Keyspace} by name.
   *
   * @throws org.querypipe.common.exception.DatastoreException if the keyspace does not exist
   */
  Keyspace keyspace(String name);
}
