package io.github.kgov.console.watch;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A consumer group watched by the console service.
 */
public record WatchTarget(String clusterId, String groupId) {

  public WatchTarget {
    if (clusterId == null || clusterId.isBlank() || groupId == null || groupId.isBlank()) {
      throw new IllegalArgumentException("clusterId and groupId are required");
    }
  }

  /**
   * Parses {@code cluster:group} entries separated by commas. Duplicates are dropped.
   * Group ids may contain colons, the cluster id may not.
   *
   * @throws IllegalArgumentException if an entry has no cluster or group
   */
  public static List<WatchTarget> parseList(String value) {
    if (value == null || value.isBlank()) {
      return List.of();
    }
    Set<WatchTarget> targets = new LinkedHashSet<>();
    for (String entry : value.split(",")) {
      String trimmed = entry.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      int colon = trimmed.indexOf(':');
      if (colon <= 0 || colon == trimmed.length() - 1) {
        throw new IllegalArgumentException("Expected cluster:group but got: " + trimmed);
      }
      targets.add(new WatchTarget(trimmed.substring(0, colon), trimmed.substring(colon + 1)));
    }
    return new ArrayList<>(targets);
  }

  @Override
  public String toString() {
    return clusterId + ":" + groupId;
  }
}
