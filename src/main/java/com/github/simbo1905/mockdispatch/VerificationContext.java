package com.github.simbo1905.mockdispatch;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Point-in-time view over the matched invocations of an [InvocationLog], opened with
/// [InvocationLog#asInvocationContext()] for one verification pass and closed afterwards.
///
/// A context answers "was this setup matched at or before the version I captured". Matches
/// recorded later and clears of the log are invisible to it.
///
/// <pre>
/// try (VerificationContext context = log.asInvocationContext()) {
///   for (RegisteredSetup setup : registry.toArrayLive(s -> true)) {
///     if (!context.isMatchedByInvocation(setup, RegisteredSetup::canVerify)) {
///       // report
///     }
///   }
/// }
/// </pre>
public final class VerificationContext implements AutoCloseable {

  private static final Logger logger = Logger.getLogger(VerificationContext.class.getName());

  private volatile MatchedInvocationIndex lookup;
  private final long version;
  private final GuardedReentrantReadWriteLock lock;

  VerificationContext(MatchedInvocationIndex lookup, long version, GuardedReentrantReadWriteLock lock) {
    this.lookup = lookup;
    this.version = version;
    this.lock = lock;
  }

  /// Checks whether `setup` was matched by a call recorded no later than this context's
  /// version. The matched call is marked verified.
  ///
  /// @param setup      the setup to check
  /// @param dontVerify setups it accepts are treated as satisfied without a lookup
  /// @return true if the setup is satisfied or excluded
  /// @throws IllegalStateException if the context has been closed
  public boolean isMatchedByInvocation(
      RegisteredSetup setup, Predicate<? super RegisteredSetup> dontVerify) {
    Objects.requireNonNull(setup, "setup");
    final MatchedInvocationIndex index = ensureOpen();

    if (dontVerify.test(setup)) {
      return true;
    }

    final Optional<Invocation> invocation;
    try (var ignored = lock.readLock()) {
      invocation = index.newestAtOrBefore(new VersionedKey(setup.id().value(), version));
    }
    invocation.ifPresent(Invocation::markAsVerified);
    logger.log(
        Level.FINEST,
        () -> String.format("isMatchedByInvocation %s @%d -> %s", setup, version, invocation));
    return invocation.isPresent();
  }

  /// The log version this context was captured at.
  public long version() {
    return version;
  }

  public boolean isClosed() {
    return lookup == null;
  }

  /// Releases the captured index. Closing twice is harmless.
  @Override
  public void close() {
    if (lookup != null) {
      lookup = null;
      logger.log(Level.FINE, () -> String.format("closed context @%d", version));
    }
  }

  private MatchedInvocationIndex ensureOpen() {
    final MatchedInvocationIndex index = lookup;
    if (index == null) {
      throw new IllegalStateException("Verification context @" + version + " is closed");
    }
    return index;
  }

  @Override
  public String toString() {
    return String.format("VerificationContext[version=%d, closed=%s]", version, isClosed());
  }
}
