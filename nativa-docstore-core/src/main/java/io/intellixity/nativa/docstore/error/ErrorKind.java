package io.intellixity.nativa.docstore.error;

/** Failure categories surfaced by storage operations. */
public enum ErrorKind {
  /** Operation attempted before {@code initialize()} or after {@code close()}. */
  NOT_READY,

  /** Caller input that can never succeed (missing collection tag, unknown inventory operation, bad names). */
  MALFORMED_INPUT,

  /** DDL failure while creating or validating schema objects. */
  SCHEMA_ERROR,

  /** Statement execution, connection creation/validation, or acquisition failure. */
  IO_ERROR,

  /** Cipher callback failed or produced ciphertext that does not decode. */
  ENCRYPTION_ERROR
}
