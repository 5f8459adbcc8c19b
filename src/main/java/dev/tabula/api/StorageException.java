/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.api;

/** Indicates that a storage operation could not be completed. */
public final class StorageException extends RuntimeException {
  private final ErrorCode errorCode;

  public StorageException(ErrorCode errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  public StorageException(ErrorCode errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  public ErrorCode errorCode() {
    return errorCode;
  }
}
