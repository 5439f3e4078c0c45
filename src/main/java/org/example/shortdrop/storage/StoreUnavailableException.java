package org.example.shortdrop.storage;

/**
 * Signals that the mapping store's backing file cannot be read or written.
 *
 * <p>This is the only fatal error of the storage layer. No store operation can proceed safely
 * after it, so it is propagated to the process boundary instead of being absorbed. A scheduled
 * reaper stops on it; startup aborts on it.
 */
public class StoreUnavailableException extends RuntimeException {

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

  public StoreUnavailableException(String message) {
    super(message);
  }
}
