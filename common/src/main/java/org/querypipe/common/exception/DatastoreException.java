/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.common.exception;

/** A datastore service call failed, either for a single key or as a whole. */
public class DatastoreException extends QueryEngineException {

  public DatastoreException(ErrorCode code, String message) {
    super(code, Severity.ERROR, message);
  }

  public DatastoreException(ErrorCode code, Severity severity, String message, Throwable cause) {
    super(code, severity, message, cause);
  }

  public static DatastoreException documentNotFound(String key) {
    return new DatastoreException(ErrorCode.DOCUMENT_NOT_FOUND, "Document not found: " + key);
  }

  public static DatastoreException keyspaceNotFound(String keyspace) {
    return new DatastoreException(
        ErrorCode.KEYSPACE_NOT_FOUND, Severity.FATAL, "Keyspace not found: " + keyspace, null);
  }
}
