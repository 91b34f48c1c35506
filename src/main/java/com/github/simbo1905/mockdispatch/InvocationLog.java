package com.github.simbo1905.mockdispatch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/// Thread safe, growable log of observed calls plus the index of which setup matched which
/// call.
///
/// The backing array and the matched invocation index are never truncated in place. Growth
/// copies into a new array and [#clear()] swaps in fresh instances, so an iteration or a
/// [VerificationContext] that captured the previous references keeps seeing consistent data.
///
/// The match version counter is issued from this log and is never reset, not even by a clear.
public final class InvocationLog implements InvocationList {

  private static final Logger logger = Logger.getLogger(InvocationLog.class.getName());

  private static final Invocation[] EMPTY = new Invocation[0];

  public static final int DEFAULT_INITIAL_CAPACITY = 4;

  public static final String INITIAL_CAPACITY_PROPERTY = "INITIAL_CAPACITY";

  private final GuardedReentrantReadWriteLock lock = new GuardedReentrantReadWriteLock();

  // capacity of the first allocation, doubled on every growth after that
  private final int initialCapacity;

  private Invocation[] invocations = EMPTY;
  private MatchedInvocationIndex matchedInvocations = new MatchedInvocationIndex();
  private int capacity = 0;
  private int count = 0;
  private long version = 0;

  // registry whose setup ids the match records refer to, fixed by the first dispatcher
  private SetupRegistry registry;

  public InvocationLog() {
    this(getInitialCapacityOrDefault());
  }

  public InvocationLog(int initialCapacity) {
    if (initialCapacity < 1) {
      throw new IllegalArgumentException(
          String.format("initialCapacity must be at least 1, got %d", initialCapacity));
    }
    this.initialCapacity = initialCapacity;
  }

  /// Reads the first growth capacity from the environment or a system property named
  /// `com.github.simbo1905.mockdispatch.InvocationLog.INITIAL_CAPACITY`. The system property
  /// wins over the environment.
  static int getInitialCapacityOrDefault() {
    final String key =
        String.format("%s.%s", InvocationLog.class.getName(), INITIAL_CAPACITY_PROPERTY);
    String capacity =
        System.getenv(key) == null
            ? Integer.valueOf(DEFAULT_INITIAL_CAPACITY).toString()
            : System.getenv(key);
    capacity = System.getProperty(key, capacity);
    try {
      return Integer.parseInt(capacity.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("%s must be an integer, got '%s'", key, capacity), e);
    }
  }

  @Override
  public int size() {
    try (var ignored = lock.readLock()) {
      return count;
    }
  }

  @Override
  public Invocation get(int index) {
    try (var ignored = lock.readLock()) {
      if (index < 0 || index >= count) {
        throw new IndexOutOfBoundsException(
            String.format("Index %d out of bounds for invocation log of size %d", index, count));
      }
      return invocations[index];
    }
  }

  public void add(Invocation invocation) {
    Objects.requireNonNull(invocation, "invocation");
    try (var ignored = lock.writeLock()) {
      ensureCapacity();
      invocations[count] = invocation;
      count++;
    }
    logger.log(Level.FINEST, () -> String.format("add %s", invocation));
  }

  /// Records that the setup with the given id governed `invocation`.
  ///
  /// @return the key the match was stored under, carrying the freshly issued version
  public VersionedKey recordMatchedInvocation(SetupId setupId, Invocation invocation) {
    if (!setupId.isRegistered()) {
      throw new IllegalArgumentException("Cannot record a match for " + setupId);
    }
    Objects.requireNonNull(invocation, "invocation");
    final VersionedKey key;
    try (var ignored = lock.writeLock()) {
      key = new VersionedKey(setupId.value(), ++version);
      matchedInvocations.put(key, invocation);
    }
    logger.log(Level.FINEST, () -> String.format("recordMatchedInvocation %s -> %s", key, invocation));
    return key;
  }

  /// Discards every invocation and match record. Readers holding the previous array or index
  /// are not affected.
  public void clear() {
    final int discarded;
    try (var ignored = lock.writeLock()) {
      discarded = count;
      invocations = EMPTY;
      matchedInvocations = new MatchedInvocationIndex();
      count = 0;
      capacity = 0;
    }
    logger.log(Level.FINE, () -> String.format("clear %d invocations", discarded));
  }

  /// Owned copy of the current invocations.
  public Invocation[] toArray() {
    try (var ignored = lock.readLock()) {
      return count == 0 ? EMPTY : Arrays.copyOf(invocations, count);
    }
  }

  public List<Invocation> toList() {
    return Arrays.asList(toArray());
  }

  /// Owned copy of the current invocations accepted by `predicate`.
  public List<Invocation> toList(Predicate<? super Invocation> predicate) {
    try (var ignored = lock.readLock()) {
      List<Invocation> result = new ArrayList<>(count);
      for (int i = 0; i < count; i++) {
        if (predicate.test(invocations[i])) {
          result.add(invocations[i]);
        }
      }
      return result;
    }
  }

  /// Iterates the invocations present when this method was called. Later appends and clears
  /// are not observed and do not block the iteration.
  @Override
  public Iterator<Invocation> iterator() {
    final Invocation[] snapshot;
    final int snapshotCount;
    try (var ignored = lock.readLock()) {
      snapshot = invocations;
      snapshotCount = count;
    }
    return new Iterator<>() {
      private int next = 0;

      @Override
      public boolean hasNext() {
        return next < snapshotCount;
      }

      @Override
      public Invocation next() {
        if (next >= snapshotCount) {
          throw new NoSuchElementException();
        }
        return snapshot[next++];
      }
    };
  }

  @Override
  public Stream<Invocation> stream() {
    final Invocation[] snapshot;
    final int snapshotCount;
    try (var ignored = lock.readLock()) {
      snapshot = invocations;
      snapshotCount = count;
    }
    return Arrays.stream(snapshot, 0, snapshotCount);
  }

  /// Opens a point-in-time view over the matched invocation index. Matches recorded after
  /// this call, and a clear after this call, are invisible to the returned context.
  public VerificationContext asInvocationContext() {
    try (var ignored = lock.readLock()) {
      final VerificationContext context =
          new VerificationContext(matchedInvocations, version, lock);
      logger.log(Level.FINE, () -> String.format("open %s", context));
      return context;
    }
  }

  /// Ties this log to the registry that issues the setup ids it records. Ids are unique only
  /// within one registry, so a log shared by two registries would let a match for one setup
  /// satisfy an unrelated setup with the same id.
  ///
  /// @throws IllegalStateException if the log is already bound to another registry
  void bindTo(SetupRegistry setups) {
    Objects.requireNonNull(setups, "setups");
    try (var ignored = lock.writeLock()) {
      if (registry != null && registry != setups) {
        throw new IllegalStateException(
            String.format("%s already records matches for another setup registry", this));
      }
      registry = setups;
    }
  }

  /// The last version issued, or zero if no match was ever recorded.
  public long currentVersion() {
    try (var ignored = lock.readLock()) {
      return version;
    }
  }

  int capacity() {
    try (var ignored = lock.readLock()) {
      return capacity;
    }
  }

  int matchedInvocationCount() {
    try (var ignored = lock.readLock()) {
      return matchedInvocations.size();
    }
  }

  private void ensureCapacity() {
    assert lock.isWriteLockedByCurrentThread();
    if (count == capacity) {
      final int targetCapacity = capacity == 0 ? initialCapacity : capacity * 2;
      invocations = Arrays.copyOf(invocations, targetCapacity);
      capacity = targetCapacity;
      logger.log(Level.FINEST, () -> String.format("grow to %d", targetCapacity));
    }
  }

  @Override
  public String toString() {
    try (var ignored = lock.readLock()) {
      return String.format(
          "InvocationLog[count=%d, capacity=%d, version=%d]", count, capacity, version);
    }
  }
}
