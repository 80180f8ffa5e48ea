package io.intellixity.nativa.docstore.layout;

/** Discovers {@link LayoutStrategy} implementations (META-INF/docstore.factories), keyed by strategy id. */
public interface LayoutStrategyProvider {
  String id();

  LayoutStrategy create(LayoutOptions options);
}
