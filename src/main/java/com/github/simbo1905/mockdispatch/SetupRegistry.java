package com.github.simbo1905.mockdispatch;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.Synchronized;
import lombok.val;

/// Ordered, append-only collection of setups for one intercepted target.
///
/// Newer setups are more relevant than older ones: lookups always walk from the most recently
/// registered entry back to the first. An older setup whose expectation equals that of a newer
/// unguarded setup is overridden; once [#toArrayLive(Predicate)] has discovered that it is
/// flagged so later scans skip it without repeating the identity check.
///
/// All operations are mutually exclusive except the empty check at the start of
/// [#findMatchFor(Invocation)].
public final class SetupRegistry {

  private static final Logger logger = Logger.getLogger(SetupRegistry.class.getName());

  private final List<RegisteredSetup> setups = new ArrayList<>();

  // list positions of setups known to be overridden
  private final BitSet overridden = new BitSet();

  // next id to issue, never reset so that ids are not reused after a clear
  private int nextId;

  // id of the setup at list position 0
  private int firstId;

  // mirrors setups.size() for the unsynchronized fast path
  private volatile int registeredCount;

  /// Registers a setup under the next id.
  ///
  /// @param setup the setup to append
  /// @return the registered wrapper carrying the assigned id
  @Synchronized
  public RegisteredSetup add(Setup setup) {
    Objects.requireNonNull(setup, "setup");
    val registered = RegisteredSetup.of(nextId++, setup);
    setups.add(registered);
    registeredCount = setups.size();
    logger.log(Level.FINE, () -> String.format("add %s", registered));
    return registered;
  }

  /// True if any registered setup, overridden or not, satisfies the predicate.
  @Synchronized
  public boolean any(Predicate<? super Setup> predicate) {
    for (RegisteredSetup registered : setups) {
      if (predicate.test(registered.setup())) {
        return true;
      }
    }
    return false;
  }

  /// Removes every setup. Ids already issued are not issued again, so match records kept by an
  /// [InvocationLog] for the removed setups never satisfy setups registered afterwards.
  @Synchronized
  public void clear() {
    logger.log(Level.FINE, () -> String.format("clear %d setups", setups.size()));
    setups.clear();
    overridden.clear();
    firstId = nextId;
    registeredCount = 0;
  }

  /// Resolves the setup that governs a call.
  ///
  /// Walks non-overridden setups from newest to oldest. The first setup whose predicate matches
  /// becomes the candidate. After that only older setups declared against the exact method of
  /// the call are considered, as only those can outrank a candidate declared against a less
  /// specific method. A match on the exact method ends the scan.
  ///
  /// @param invocation the observed call
  /// @return the governing setup, or empty if no setup matches
  public Optional<RegisteredSetup> findMatchFor(Invocation invocation) {
    // a stale read here can only miss setups being added concurrently
    if (registeredCount == 0) {
      return Optional.empty();
    }
    return findMatchForLocked(invocation);
  }

  @Synchronized
  private Optional<RegisteredSetup> findMatchForLocked(Invocation invocation) {
    RegisteredSetup matching = null;
    for (int i = setups.size() - 1; i >= 0; --i) {
      if (overridden.get(i)) continue;

      val registered = setups.get(i);
      val setup = registered.setup();
      val exactMethod = setup.getMethod().equals(invocation.getMethod());

      // cheap tests first so that matches() only runs when the result can change the outcome
      if (matching == null) {
        if (setup.matches(invocation)) {
          matching = registered;
          if (exactMethod) break;
        }
      } else if (exactMethod && setup.matches(invocation)) {
        matching = registered;
        break;
      }
    }
    val result = matching;
    logger.log(
        Level.FINEST,
        () -> String.format("findMatchFor %s -> %s", invocation, result == null ? "none" : result));
    return Optional.ofNullable(result);
  }

  /// Live inner mock setups, newest first.
  public List<RegisteredSetup> getInnerMockSetups() {
    return toArrayLive(setup -> setup.returnsInnerMock().isPresent());
  }

  /// Returns the live setups accepted by the predicate, newest first.
  ///
  /// A setup is live unless a newer unguarded setup has the same expectation. Guarded setups
  /// take no part in that test: they are never overridden and never override.
  ///
  /// @param predicate filter applied to each live setup
  /// @return an owned list, newest first
  @Synchronized
  public List<RegisteredSetup> toArrayLive(Predicate<? super Setup> predicate) {
    val live = new ArrayList<RegisteredSetup>();
    Set<Expectation> visited = new HashSet<>();

    for (int i = setups.size() - 1; i >= 0; --i) {
      if (overridden.get(i)) continue;

      val registered = setups.get(i);
      val setup = registered.setup();

      if (setup.getCondition().isEmpty() && !visited.add(setup.getExpectation())) {
        // a newer setup with the same expectation has been seen already
        overridden.set(i);
        logger.log(Level.FINEST, () -> String.format("overridden %s", registered));
        continue;
      }

      if (predicate.test(setup)) {
        live.add(registered);
      }
    }
    return live;
  }

  /// All registered setups in registration order, including overridden ones.
  @Synchronized
  public List<RegisteredSetup> toList() {
    return new ArrayList<>(setups);
  }

  /// True once a scan has found the setup to be overridden by a newer one.
  @Synchronized
  public boolean isOverridden(SetupId id) {
    return id.value() >= firstId && overridden.get(id.value() - firstId);
  }

  public int size() {
    return registeredCount;
  }

  public boolean isEmpty() {
    return registeredCount == 0;
  }
}
