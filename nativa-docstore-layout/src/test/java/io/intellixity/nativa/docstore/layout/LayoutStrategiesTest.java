package io.intellixity.nativa.docstore.layout;

import io.intellixity.nativa.docstore.layout.percollection.TablePerCollectionStrategy;
import io.intellixity.nativa.docstore.layout.percollection.TablePerCollectionStrategyProvider;
import io.intellixity.nativa.docstore.layout.shared.SharedTableStrategy;
import io.intellixity.nativa.docstore.layout.shared.SharedTableStrategyProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class LayoutStrategiesTest {
  @TempDir Path dir;

  /** Claims the shared-table id a second time. */
  public static final class SecondSharedTable implements LayoutStrategyProvider {
    @Override public String id() { return SharedTableStrategy.ID; }
    @Override public LayoutStrategy create(LayoutOptions options) { return new SharedTableStrategy(options); }
  }

  private ClassLoader withFactories(String providers) throws Exception {
    Path file = dir.resolve(LayoutStrategies.RESOURCE);
    Files.createDirectories(file.getParent());
    Files.writeString(file, LayoutStrategyProvider.class.getName() + "=" + providers + "\n");
    return new URLClassLoader(new URL[] { dir.toUri().toURL() }, getClass().getClassLoader());
  }

  @Test
  void both_strategies_are_discovered() {
    LayoutStrategies strategies = new LayoutStrategies();
    assertEquals(Set.of(SharedTableStrategy.ID, TablePerCollectionStrategy.ID), strategies.ids());

    assertInstanceOf(SharedTableStrategy.class, strategies.create("shared-table", LayoutOptions.defaults()));
    assertInstanceOf(TablePerCollectionStrategy.class,
        strategies.create("table-per-collection", LayoutOptions.defaults()));
    assertInstanceOf(SharedTableStrategy.class, strategies.create(" ", null));
  }

  @Test
  void unknown_id_is_rejected() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> new LayoutStrategies().create("sharded", LayoutOptions.defaults()));
    assertTrue(e.getMessage().contains("sharded"));
  }

  @Test
  void provider_listed_in_several_resources_is_loaded_once() throws Exception {
    ClassLoader cl = withFactories(SharedTableStrategyProvider.class.getName() + ", "
        + TablePerCollectionStrategyProvider.class.getName());
    assertEquals(2, LayoutStrategies.discover(cl).size());
    assertEquals(Set.of(SharedTableStrategy.ID, TablePerCollectionStrategy.ID), new LayoutStrategies(cl).ids());
  }

  @Test
  void two_providers_with_one_id_fail_discovery() throws Exception {
    ClassLoader cl = withFactories(SecondSharedTable.class.getName());
    IllegalStateException e = assertThrows(IllegalStateException.class, () -> new LayoutStrategies(cl));
    assertTrue(e.getMessage().contains(SharedTableStrategy.ID));
    assertTrue(e.getMessage().contains(SecondSharedTable.class.getName()));
  }

  @Test
  void listed_class_must_be_a_provider() throws Exception {
    ClassLoader cl = withFactories(String.class.getName());
    assertThrows(IllegalStateException.class, () -> LayoutStrategies.discover(cl));
  }

  @Test
  void provider_without_id_is_rejected() {
    LayoutStrategyProvider blank = new LayoutStrategyProvider() {
      @Override public String id() { return " "; }
      @Override public LayoutStrategy create(LayoutOptions options) { return null; }
    };
    assertThrows(IllegalStateException.class, () -> new LayoutStrategies(List.of(blank)));
  }
}
