package org.mailpulse.alert.engine.datamodel;

/** Thrown by storage collaborators when events or counts cannot be read. */
public class StorageUnavailableException extends RuntimeException {
  public StorageUnavailableException(String message) {
    super(message);
  }

  public StorageUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
