package io.intellixity.nativa.docstore.layout.shared;

import io.intellixity.nativa.docstore.layout.LayoutOptions;
import io.intellixity.nativa.docstore.layout.LayoutStrategy;
import io.intellixity.nativa.docstore.layout.LayoutStrategyProvider;

public final class SharedTableStrategyProvider implements LayoutStrategyProvider {
  @Override public String id() { return SharedTableStrategy.ID; }

  @Override public LayoutStrategy create(LayoutOptions options) { return new SharedTableStrategy(options); }
}
