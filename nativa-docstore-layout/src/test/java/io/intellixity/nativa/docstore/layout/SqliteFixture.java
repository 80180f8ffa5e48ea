package io.intellixity.nativa.docstore.layout;

import io.intellixity.nativa.docstore.crypto.RecordCipher;
import io.intellixity.nativa.docstore.jdbc.JdbcDatabaseOperations;
import io.intellixity.nativa.docstore.jdbc.SqliteConnectionFactory;
import io.intellixity.nativa.docstore.model.StorageRecord;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/** Helpers for strategy tests running against a real SQLite file. */
public final class SqliteFixture {
  private SqliteFixture() {}

  public static JdbcDatabaseOperations open(Path dir) {
    try {
      return new SqliteConnectionFactory(dir.resolve("layout.db")).create();
    } catch (Exception e) {
      throw new IllegalStateException(e);
    }
  }

  public static StorageRecord doc(String collection, String id, Object... kv) {
    Map<String, Object> p = new LinkedHashMap<>();
    p.put("collection", collection);
    p.put("id", id);
    for (int i = 0; i + 1 < kv.length; i += 2) p.put((String) kv[i], kv[i + 1]);
    return new StorageRecord(id, p);
  }

  /** Reversible XOR-then-base64 cipher. */
  public static final class XorCipher implements RecordCipher {
    private final byte[] key = "test-key".getBytes(StandardCharsets.UTF_8);

    @Override public String encrypt(String plaintext) {
      return Base64.getEncoder().encodeToString(xor(plaintext.getBytes(StandardCharsets.UTF_8)));
    }

    @Override public String decrypt(String ciphertext) {
      return new String(xor(Base64.getDecoder().decode(ciphertext)), StandardCharsets.UTF_8);
    }

    private byte[] xor(byte[] in) {
      byte[] out = new byte[in.length];
      for (int i = 0; i < in.length; i++) out[i] = (byte) (in[i] ^ key[i % key.length]);
      return out;
    }
  }
}
