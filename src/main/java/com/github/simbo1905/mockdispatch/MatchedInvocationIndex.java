package com.github.simbo1905.mockdispatch;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Which invocations were matched by which setup, and when.
///
/// Entries are grouped by setup id. Within a group versions only ever increase, so a
/// point-in-time lookup is a hash lookup followed by a binary search for the newest entry at or
/// before the queried version.
///
/// Not thread safe. The owning [InvocationLog] guards it with its lock and swaps in a fresh
/// instance on clear, leaving this one intact for any [VerificationContext] still holding it.
final class MatchedInvocationIndex {

  record Entry(VersionedKey key, Invocation invocation) {}

  private final Map<Integer, List<Entry>> bySetup = new HashMap<>();
  private int size;

  void put(VersionedKey key, Invocation invocation) {
    List<Entry> entries = bySetup.computeIfAbsent(key.setupId(), id -> new ArrayList<>(2));
    assert entries.isEmpty() || entries.get(entries.size() - 1).key().version() < key.version()
        : String.format("version %d recorded out of order for setup %d", key.version(), key.setupId());
    entries.add(new Entry(key, invocation));
    size++;
  }

  /// Newest invocation recorded for `query.setupId()` at or before `query.version()`.
  Optional<Invocation> newestAtOrBefore(VersionedKey query) {
    List<Entry> entries = bySetup.get(query.setupId());
    if (entries == null) {
      return Optional.empty();
    }
    int low = 0;
    int high = entries.size() - 1;
    int found = -1;
    while (low <= high) {
      int mid = (low + high) >>> 1;
      if (entries.get(mid).key().isRecordedAtOrBefore(query)) {
        found = mid;
        low = mid + 1;
      } else {
        high = mid - 1;
      }
    }
    return found < 0 ? Optional.empty() : Optional.of(entries.get(found).invocation());
  }

  int size() {
    return size;
  }
}
