package io.intellixity.nativa.docstore.layout.percollection;

import io.intellixity.nativa.docstore.layout.LayoutOptions;
import io.intellixity.nativa.docstore.layout.LayoutStrategy;
import io.intellixity.nativa.docstore.layout.LayoutStrategyProvider;

public final class TablePerCollectionStrategyProvider implements LayoutStrategyProvider {
  @Override public String id() { return TablePerCollectionStrategy.ID; }

  @Override public LayoutStrategy create(LayoutOptions options) { return new TablePerCollectionStrategy(options); }
}
