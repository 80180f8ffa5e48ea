package io.intellixity.nativa.docstore.layout;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Layout strategies by id, discovered from {@code META-INF/docstore.factories} resources.
 * <p>
 * Each resource is a properties file whose {@code io.intellixity.nativa.docstore.layout.LayoutStrategyProvider}
 * entry lists provider classes, comma-separated:
 * <pre>
 * io.intellixity.nativa.docstore.layout.LayoutStrategyProvider=com.acme.ShardedLayoutProvider
 * </pre>
 * A class listed by several resources is loaded once. Two providers claiming the same id fail discovery.
 */
public final class LayoutStrategies {
  public static final String DEFAULT_ID = "shared-table";
  public static final String RESOURCE = "META-INF/docstore.factories";

  private static final String KEY = LayoutStrategyProvider.class.getName();

  private final Map<String, LayoutStrategyProvider> providers;

  public LayoutStrategies() {
    this(Thread.currentThread().getContextClassLoader());
  }

  public LayoutStrategies(ClassLoader cl) {
    this(discover((cl == null) ? LayoutStrategies.class.getClassLoader() : cl));
  }

  LayoutStrategies(List<LayoutStrategyProvider> discovered) {
    Map<String, LayoutStrategyProvider> m = new LinkedHashMap<>();
    for (LayoutStrategyProvider p : discovered) {
      String id = (p.id() == null) ? "" : p.id().trim();
      if (id.isEmpty()) throw new IllegalStateException("Layout strategy provider " + p.getClass().getName() + " has no id");
      LayoutStrategyProvider prev = m.putIfAbsent(id, p);
      if (prev != null) {
        throw new IllegalStateException("Layout strategy id '" + id + "' is registered by both "
            + prev.getClass().getName() + " and " + p.getClass().getName());
      }
    }
    this.providers = Collections.unmodifiableMap(m);
  }

  public Set<String> ids() { return providers.keySet(); }

  public LayoutStrategy create(String id, LayoutOptions options) {
    String key = (id == null || id.isBlank()) ? DEFAULT_ID : id.trim();
    LayoutStrategyProvider p = providers.get(key);
    if (p == null) throw new IllegalArgumentException("Unknown layout strategy: " + key + " (known: " + providers.keySet() + ")");
    return p.create(options == null ? LayoutOptions.defaults() : options);
  }

  static List<LayoutStrategyProvider> discover(ClassLoader cl) {
    Set<String> classNames = new LinkedHashSet<>();
    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }
    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new IllegalStateException("Failed to load " + url, e);
      }
      for (String part : p.getProperty(KEY, "").split(",")) {
        if (!part.isBlank()) classNames.add(part.trim());
      }
    }

    List<LayoutStrategyProvider> out = new ArrayList<>(classNames.size());
    for (String name : classNames) out.add(instantiate(name, cl));
    return out;
  }

  private static LayoutStrategyProvider instantiate(String className, ClassLoader cl) {
    try {
      Class<?> raw = Class.forName(className, true, cl);
      if (!LayoutStrategyProvider.class.isAssignableFrom(raw)) {
        throw new IllegalStateException(className + " does not implement " + KEY);
      }
      return (LayoutStrategyProvider) raw.getDeclaredConstructor().newInstance();
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Cannot load layout strategy provider " + className, e);
    }
  }
}
