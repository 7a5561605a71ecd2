/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.storage;

/** Kinds of document mutation. */
public enum MutationKind {
  /** Fails for keys that exist. */
  INSERT,
  /** Writes whether or not the key exists. */
  UPSERT,
  /** Fails for keys that do not exist. */
  UPDATE,
  /** Fails for keys that do not exist. */
  DELETE
}
