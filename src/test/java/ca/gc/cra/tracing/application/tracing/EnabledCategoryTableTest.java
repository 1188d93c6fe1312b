package ca.gc.cra.tracing.application.tracing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tracing.domain.category.CategoryFlags;
import ca.gc.cra.tracing.domain.category.CategoryGroup;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EnabledCategoryTableTest {

  @Test
  void unknownCategoryHasNoFlags() {
    EnabledCategoryTable table = new EnabledCategoryTable();

    assertEquals(CategoryFlags.NONE, table.flags("app"));
    assertFalse(table.isEnabled("app"));
    assertFalse(table.isEnabled(CategoryGroup.of("app", "db")));
    assertFalse(table.isEnabled(CategoryGroup.empty()));
  }

  @Test
  void flagsCombineAndClearIndependently() {
    EnabledCategoryTable table = new EnabledCategoryTable();

    assertTrue(table.setFlags(CategoryGroup.of("app"), CategoryFlags.RECORDING, true));
    assertTrue(table.setFlags(CategoryGroup.of("app"), CategoryFlags.LISTENING, true));
    assertEquals(CategoryFlags.RECORDING | CategoryFlags.LISTENING, table.flags("app"));

    assertTrue(table.setFlags(CategoryGroup.of("app"), CategoryFlags.RECORDING, false));
    assertEquals(CategoryFlags.LISTENING, table.flags("app"));
    assertTrue(table.isEnabled("app"));

    assertTrue(table.setFlags(CategoryGroup.of("app"), CategoryFlags.LISTENING, false));
    assertFalse(table.isEnabled("app"));
    assertEquals(Map.of(), table.snapshot());
  }

  @Test
  void groupIsEnabledWhenAnyCategoryIs() {
    EnabledCategoryTable table = new EnabledCategoryTable();
    table.setFlags(CategoryGroup.of("db"), CategoryFlags.RECORDING, true);

    assertTrue(table.isEnabled(CategoryGroup.of("app", "db")));
    assertFalse(table.isEnabled(CategoryGroup.of("app", "net")));
  }

  @Test
  void listenersFireOnlyOnRealChange() {
    EnabledCategoryTable table = new EnabledCategoryTable();
    List<Map<String, Integer>> snapshots = new ArrayList<>();
    table.addListener(snapshots::add);

    table.setFlags(CategoryGroup.of("app", "db"), CategoryFlags.RECORDING, true);
    assertFalse(table.setFlags(CategoryGroup.of("app"), CategoryFlags.RECORDING, true));
    assertFalse(table.setFlags(CategoryGroup.of("net"), CategoryFlags.LISTENING, false));

    assertEquals(1, snapshots.size());
    assertEquals(Map.of("app", CategoryFlags.RECORDING, "db", CategoryFlags.RECORDING), snapshots.get(0));
  }

  @Test
  void categoriesWithReportsEnableOrder() {
    EnabledCategoryTable table = new EnabledCategoryTable();
    table.setFlags(CategoryGroup.of("b"), CategoryFlags.LISTENING, true);
    table.setFlags(CategoryGroup.of("a"), CategoryFlags.RECORDING, true);
    table.setFlags(CategoryGroup.of("c"), CategoryFlags.RECORDING | CategoryFlags.LISTENING, true);

    assertEquals(List.of("a", "c"), table.categoriesWith(CategoryFlags.RECORDING));
    assertEquals(List.of("b", "c"), table.categoriesWith(CategoryFlags.LISTENING));
    assertEquals(List.of("b", "a", "c"), table.enabledCategories());
  }

  @Test
  void removedListenerStopsReceivingChanges() {
    EnabledCategoryTable table = new EnabledCategoryTable();
    List<Map<String, Integer>> snapshots = new ArrayList<>();
    CategoryTableListener listener = snapshots::add;
    table.addListener(listener);
    table.removeListener(listener);

    table.setFlags(CategoryGroup.of("app"), CategoryFlags.RECORDING, true);

    assertTrue(snapshots.isEmpty());
  }

  @Test
  void zeroMaskIsRejected() {
    EnabledCategoryTable table = new EnabledCategoryTable();

    assertThrows(IllegalArgumentException.class,
        () -> table.setFlags(CategoryGroup.of("app"), CategoryFlags.NONE, true));
    assertThrows(IllegalArgumentException.class, () -> table.setFlags(null, CategoryFlags.RECORDING, true));
  }
}
