package io.intellixity.nativa.docstore.storage;

import io.intellixity.nativa.docstore.crypto.RecordCipher;
import io.intellixity.nativa.docstore.layout.LayoutOptions;
import io.intellixity.nativa.docstore.model.CollectionConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class StorageSettingsTest {
  @Test
  void defaults_use_shared_table_without_encryption() {
    StorageSettings s = StorageSettings.defaults();
    assertEquals("shared-table", s.layout());
    assertFalse(s.encryption());
    assertTrue(s.collections().isEmpty());
    assertEquals("", s.schemaPrefix());
    assertTrue(s.crossDbQueries());
  }

  @Test
  void parses_collection_properties_including_dotted_names() {
    Properties p = new Properties();
    p.setProperty("docstore.layout", " table-per-collection ");
    p.setProperty("docstore.encryption", "TRUE");
    p.setProperty("docstore.collections.users.indexes", "name, address.city,");
    p.setProperty("docstore.collections.users.encryptedFields", "ssn");
    p.setProperty("docstore.collections.app.events.indexes", "at");
    p.setProperty("docstore.schemaPrefix", " userdata ");
    p.setProperty("docstore.crossDbQueries", "false");

    StorageSettings s = StorageSettings.fromProperties(p);
    assertEquals("table-per-collection", s.layout());
    assertTrue(s.encryption());
    assertEquals(List.of("name", "address.city"), List.copyOf(s.collections().get("users").indexes()));
    assertEquals(Set.of("ssn"), s.collections().get("users").encryptedFields());
    assertEquals(CollectionConfig.indexed("at"), s.collections().get("app.events"));
    assertEquals("userdata", s.schemaPrefix());
    assertFalse(s.crossDbQueries());
  }

  @Test
  void unknown_collection_property_is_rejected() {
    Properties p = new Properties();
    p.setProperty("docstore.collections.users.unique", "email");
    assertThrows(IllegalArgumentException.class, () -> StorageSettings.fromProperties(p));
  }

  @Test
  void encryption_needs_a_cipher_to_take_effect() {
    StorageSettings s = new StorageSettings(null, true, Map.of());
    LayoutOptions withoutCipher = s.layoutOptions(null, null);
    assertFalse(withoutCipher.encryption().enabled());

    LayoutOptions withCipher = s.layoutOptions(new RecordCipher() {
      @Override public String encrypt(String plaintext) { return plaintext; }
      @Override public String decrypt(String ciphertext) { return ciphertext; }
    }, null);
    assertTrue(withCipher.encryption().enabled());
  }
}
