package io.intellixity.nativa.docstore.error;

import java.util.Objects;

/**
 * Raised by every storage component.
 * <p>
 * The {@link ErrorKind} tells callers whether retrying can help (IO_ERROR) or not (everything else).
 */
public class StorageException extends RuntimeException {
  private final ErrorKind kind;

  public StorageException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public StorageException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public ErrorKind kind() {
    return kind;
  }

  public static StorageException notReady(String message) {
    return new StorageException(ErrorKind.NOT_READY, message);
  }

  public static StorageException malformed(String message) {
    return new StorageException(ErrorKind.MALFORMED_INPUT, message);
  }

  public static StorageException schema(String message, Throwable cause) {
    return new StorageException(ErrorKind.SCHEMA_ERROR, message, cause);
  }

  public static StorageException io(String message, Throwable cause) {
    return new StorageException(ErrorKind.IO_ERROR, message, cause);
  }

  public static StorageException encryption(String message, Throwable cause) {
    return new StorageException(ErrorKind.ENCRYPTION_ERROR, message, cause);
  }

  /** Re-raise storage failures untouched; wrap anything else as {@code fallback}. */
  public static StorageException wrap(Throwable t, ErrorKind fallback, String message) {
    if (t instanceof StorageException se) return se;
    return new StorageException(fallback, message + ": " + t.getMessage(), t);
  }
}
