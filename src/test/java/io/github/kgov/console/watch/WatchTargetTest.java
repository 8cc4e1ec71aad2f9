package io.github.kgov.console.watch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for WatchTarget parsing.
 */
public class WatchTargetTest {

  @Test
  void parseList_emptyValues() {
    assertTrue(WatchTarget.parseList(null).isEmpty());
    assertTrue(WatchTarget.parseList(" ").isEmpty());
  }

  @Test
  void parseList_entriesAndDuplicates() {
    List<WatchTarget> targets = WatchTarget.parseList("local:orders, local:billing,,local:orders");

    assertEquals(List.of(new WatchTarget("local", "orders"), new WatchTarget("local", "billing")), targets);
  }

  @Test
  void parseList_groupMayContainColon() {
    List<WatchTarget> targets = WatchTarget.parseList("prod:app:v2");

    assertEquals("prod", targets.get(0).clusterId());
    assertEquals("app:v2", targets.get(0).groupId());
    assertEquals("prod:app:v2", targets.get(0).toString());
  }

  @Test
  void parseList_invalidEntry() {
    assertThrows(IllegalArgumentException.class, () -> WatchTarget.parseList("orders"));
    assertThrows(IllegalArgumentException.class, () -> WatchTarget.parseList(":orders"));
    assertThrows(IllegalArgumentException.class, () -> WatchTarget.parseList("local:"));
  }
}
