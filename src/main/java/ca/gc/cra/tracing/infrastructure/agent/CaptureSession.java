package ca.gc.cra.tracing.infrastructure.agent;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One started capture session: its sequence number and the category allow-list it filters on.
 *
 * <p>Decisions are cached per canonical group key, so each distinct key is split once per session.</p>
 */
final class CaptureSession {
  private static final int MAX_CACHED_DECISIONS = 4096;

  private final long id;
  private final List<String> categories;
  private final Set<String> allowed;
  private final Map<String, Boolean> decisions = new ConcurrentHashMap<>();

  CaptureSession(long id, List<String> categories) {
    this.id = id;
    this.categories = List.copyOf(categories);
    this.allowed = Set.copyOf(categories);
  }

  long id() {
    return id;
  }

  List<String> categories() {
    return categories;
  }

  boolean accepts(String groupKey) {
    Boolean cached = decisions.get(groupKey);
    if (cached != null) {
      return cached;
    }
    boolean accepted = matches(groupKey);
    if (decisions.size() < MAX_CACHED_DECISIONS) {
      decisions.putIfAbsent(groupKey, accepted);
    }
    return accepted;
  }

  private boolean matches(String groupKey) {
    int start = 0;
    while (start <= groupKey.length()) {
      int comma = groupKey.indexOf(',', start);
      int end = comma < 0 ? groupKey.length() : comma;
      if (end > start && allowed.contains(groupKey.substring(start, end))) {
        return true;
      }
      if (comma < 0) {
        return false;
      }
      start = comma + 1;
    }
    return false;
  }
}
