package io.intellixity.nativa.docstore.model;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Per-collection layout options.
 * <p>
 * {@code indexes}: payload field paths to index, in declaration order.
 * {@code encryptedFields}: top-level payload fields encrypted one by one; when empty and encryption is on,
 * the whole payload is encrypted instead.
 */
public record CollectionConfig(Set<String> indexes, Set<String> encryptedFields) {
  public static final CollectionConfig EMPTY = new CollectionConfig(Set.of(), Set.of());

  public CollectionConfig {
    indexes = copyOrdered(indexes);
    encryptedFields = copyOrdered(encryptedFields);
  }

  public static CollectionConfig indexed(String... indexes) {
    return new CollectionConfig(new LinkedHashSet<>(java.util.Arrays.asList(indexes)), Set.of());
  }

  public CollectionConfig withEncryptedFields(String... fields) {
    return new CollectionConfig(indexes, new LinkedHashSet<>(java.util.Arrays.asList(fields)));
  }

  private static Set<String> copyOrdered(Collection<String> in) {
    if (in == null || in.isEmpty()) return Set.of();
    LinkedHashSet<String> out = new LinkedHashSet<>();
    for (String s : in) {
      if (s == null) continue;
      String t = s.trim();
      if (!t.isEmpty()) out.add(t);
    }
    return java.util.Collections.unmodifiableSet(out);
  }
}
