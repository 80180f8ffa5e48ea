package io.intellixity.nativa.docstore.crypto;

/**
 * Caller-supplied string cipher.
 * <p>
 * {@code decrypt(encrypt(s))} must equal {@code s}. Any exception thrown here surfaces as
 * {@code ENCRYPTION_ERROR}.
 */
public interface RecordCipher {
  String encrypt(String plaintext);

  String decrypt(String ciphertext);
}
