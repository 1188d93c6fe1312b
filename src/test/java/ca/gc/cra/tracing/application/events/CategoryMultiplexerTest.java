package ca.gc.cra.tracing.application.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tracing.domain.category.CategoryGroup;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CategoryMultiplexerTest {
  private CategoryMultiplexer<String> multiplexer;
  private List<String> notifications;

  @BeforeEach
  void setUp() {
    multiplexer = new CategoryMultiplexer<>();
    notifications = new ArrayList<>();
    multiplexer.addObserver(new MultiplexerObserver<>() {
      @Override
      public void listenerAdded(CategoryListener<String> listener) {
        notifications.add("listenerAdded:" + listener);
      }

      @Override
      public void listenerRemoved(CategoryListener<String> listener) {
        notifications.add("listenerRemoved:" + listener);
      }

      @Override
      public void categoryAdded(String category) {
        notifications.add("categoryAdded:" + category);
      }

      @Override
      public void categoryRemoved(String category) {
        notifications.add("categoryRemoved:" + category);
      }
    });
  }

  @Test
  void emitReachesOnlyListenersOfMatchingCategories() {
    NamedListener first = new NamedListener("L");
    NamedListener second = new NamedListener("L2");
    multiplexer.on("one", first);
    multiplexer.on(List.of("one", "two"), second);

    assertTrue(multiplexer.emit(List.of("two"), "X"));
    assertEquals(List.of(), first.received);
    assertEquals(List.of("X"), second.received);

    assertTrue(multiplexer.emit("one", "Y"));
    assertEquals(List.of("Y"), first.received);
    assertEquals(List.of("X", "Y"), second.received);
  }

  @Test
  void listenerMatchingSeveralCategoriesIsInvokedOnce() {
    NamedListener listener = new NamedListener("L");
    multiplexer.on(List.of("a", "b", "c"), listener);

    assertTrue(multiplexer.emit(List.of("a", "b", "c"), "payload"));

    assertEquals(List.of("payload"), listener.received);
  }

  @Test
  void emitWithoutMatchingListenerReturnsFalse() {
    multiplexer.on("a", new NamedListener("L"));

    assertFalse(multiplexer.emit("b", "payload"));
    assertFalse(multiplexer.emit(CategoryGroup.empty(), "payload"));
  }

  @Test
  void emptyGroupRegistrationIsNoOp() {
    multiplexer.on(CategoryGroup.empty(), new NamedListener("L"));
    multiplexer.on("", new NamedListener("L2"));

    assertEquals(0, multiplexer.listenerCount());
    assertEquals(List.of(), notifications);
  }

  @Test
  void listenerCountOfEmptyGroupIsZeroWhileTotalCountsAll() {
    multiplexer.on("a", new NamedListener("L"));
    multiplexer.on("b", new NamedListener("L2"));

    assertEquals(0, multiplexer.listenerCount(CategoryGroup.empty()));
    assertEquals(2, multiplexer.listenerCount());
    assertEquals(1, multiplexer.listenerCount(CategoryGroup.of("a", "missing")));
    assertEquals(2, multiplexer.listenerCount(CategoryGroup.of("a", "b")));
  }

  @Test
  void registeringSameListenerAgainExtendsItsCategories() {
    NamedListener listener = new NamedListener("L");
    multiplexer.on("a", listener);
    multiplexer.on(List.of("a", "b"), listener);

    assertEquals(1, multiplexer.listenerCount());
    assertEquals(List.of(listener), multiplexer.listeners());
    assertEquals(List.of(listener), multiplexer.listeners(CategoryGroup.of("b")));
    assertEquals(Set.of("a", "b"), multiplexer.listenerCategories());
  }

  @Test
  void registrationNotifiesNewCategoriesBeforeNewListener() {
    NamedListener listener = new NamedListener("L");
    multiplexer.on(List.of("a", "b"), listener);
    multiplexer.on(List.of("b", "c"), listener);
    multiplexer.on("c", new NamedListener("L2"));

    assertEquals(
        List.of(
            "categoryAdded:a",
            "categoryAdded:b",
            "listenerAdded:L",
            "categoryAdded:c",
            "listenerAdded:L2"),
        notifications);
  }

  @Test
  void partialRemovalKeepsListenerAndReportsEmptiedCategory() {
    NamedListener listener = new NamedListener("L");
    multiplexer.on(List.of("a", "b"), listener);
    notifications.clear();

    multiplexer.removeListener("a", listener);

    assertEquals(List.of("categoryRemoved:a"), notifications);
    assertEquals(1, multiplexer.listenerCount());
    assertFalse(multiplexer.emit("a", "payload"));
    assertTrue(multiplexer.emit("b", "payload"));
  }

  @Test
  void removingLastCategoryRemovesListenerBeforeCategories() {
    NamedListener listener = new NamedListener("L");
    NamedListener other = new NamedListener("L2");
    multiplexer.on(List.of("a", "b"), listener);
    multiplexer.on("b", other);
    notifications.clear();

    multiplexer.removeListener(List.of("a", "b"), listener);

    assertEquals(List.of("listenerRemoved:L", "categoryRemoved:a"), notifications);
    assertEquals(List.of(other), multiplexer.listeners());
  }

  @Test
  void removingUnregisteredPairChangesNothing() {
    NamedListener listener = new NamedListener("L");
    multiplexer.on("a", listener);
    notifications.clear();

    multiplexer.removeListener("b", listener);
    multiplexer.removeListener("a", new NamedListener("stranger"));

    assertEquals(List.of(), notifications);
    assertEquals(1, multiplexer.listenerCount());
  }

  @Test
  void reservedNamesDoNotRaiseCategoryNotifications() {
    NamedListener listener = new NamedListener("L");
    multiplexer.on(List.of("newListener", "removeListenerCategory", "app"), listener);
    multiplexer.removeListener(List.of("newListener", "removeListenerCategory", "app"), listener);

    assertEquals(
        List.of("categoryAdded:app", "listenerAdded:L", "listenerRemoved:L", "categoryRemoved:app"),
        notifications);
    assertTrue(CategoryMultiplexer.isMetaCategoryName("newListenerCategory"));
    assertFalse(CategoryMultiplexer.isMetaCategoryName("app"));
  }

  @Test
  void reservedNamesStillDeliverEvents() {
    NamedListener listener = new NamedListener("L");
    multiplexer.on("removeListener", listener);

    assertTrue(multiplexer.emit("removeListener", "payload"));
    assertEquals(List.of("payload"), listener.received);
  }

  @Test
  void removeAllListenersRemovesNewestFirstThenCategories() {
    multiplexer.on(List.of("a", "b"), new NamedListener("L1"));
    multiplexer.on("c", new NamedListener("L2"));
    notifications.clear();

    multiplexer.removeAllListeners();

    assertEquals(
        List.of(
            "listenerRemoved:L2",
            "listenerRemoved:L1",
            "categoryRemoved:a",
            "categoryRemoved:b",
            "categoryRemoved:c"),
        notifications);
    assertEquals(0, multiplexer.listenerCount());
    assertTrue(multiplexer.listenerCategories().isEmpty());
  }

  @Test
  void removeAllListenersForGroupOnlyClearsThoseCategories() {
    NamedListener first = new NamedListener("L1");
    NamedListener second = new NamedListener("L2");
    multiplexer.on(List.of("a", "b"), first);
    multiplexer.on("a", second);
    notifications.clear();

    multiplexer.removeAllListeners(CategoryGroup.of("a"));

    assertEquals(List.of("listenerRemoved:L2", "categoryRemoved:a"), notifications);
    assertEquals(List.of(first), multiplexer.listeners());
    assertEquals(Set.of("b"), multiplexer.listenerCategories());
  }

  @Test
  void listenerRemovingItselfDuringEmitDoesNotBreakDispatch() {
    NamedListener tail = new NamedListener("tail");
    CategoryListener<String> selfRemoving = new CategoryListener<>() {
      @Override
      public void onEvent(String payload) {
        multiplexer.removeListener("a", this);
      }
    };
    multiplexer.on("a", selfRemoving);
    multiplexer.on("a", tail);

    assertTrue(multiplexer.emit("a", "first"));
    assertTrue(multiplexer.emit("a", "second"));

    assertEquals(List.of("first", "second"), tail.received);
    assertEquals(List.of(tail), multiplexer.listeners());
  }

  @Test
  void listenerAddedDuringEmitIsNotInvokedForThatEmit() {
    NamedListener late = new NamedListener("late");
    multiplexer.on("a", payload -> multiplexer.on("a", late));

    multiplexer.emit("a", "first");
    assertEquals(List.of(), late.received);

    multiplexer.emit("a", "second");
    assertEquals(List.of("second"), late.received);
  }

  @Test
  void listenerFailureIsRethrownByDefault() {
    IllegalStateException failure = new IllegalStateException("boom");
    multiplexer.on("a", payload -> {
      throw failure;
    });

    IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> multiplexer.emit("a", "x"));
    assertSame(failure, thrown);
  }

  @Test
  void errorHandlerCanContinueDispatch() {
    List<RuntimeException> errors = new ArrayList<>();
    NamedListener tail = new NamedListener("tail");
    multiplexer.setErrorHandler((listener, payload, error) -> errors.add(error));
    multiplexer.on("a", payload -> {
      throw new IllegalStateException("boom");
    });
    multiplexer.on("a", tail);

    assertTrue(multiplexer.emit("a", "x"));

    assertEquals(1, errors.size());
    assertEquals(List.of("x"), tail.received);
  }

  @Test
  void nonStringCategoriesAreRejected() {
    List<Object> mixed = Arrays.asList("a", 42);

    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class, () -> multiplexer.on(CategoryGroup.from(mixed), new NamedListener("L")));
    assertEquals("category must be a string or collection of strings", ex.getMessage());
    assertThrows(IllegalArgumentException.class, () -> multiplexer.emit((CategoryGroup) null, "x"));
  }

  private static final class NamedListener implements CategoryListener<String> {
    private final String name;
    private final List<String> received = new ArrayList<>();

    private NamedListener(String name) {
      this.name = name;
    }

    @Override
    public void onEvent(String payload) {
      received.add(payload);
    }

    @Override
    public String toString() {
      return name;
    }
  }
}
