package com.github.simbo1905.mockdispatch;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import lombok.Getter;

/// Routes observed calls of one mocked target through its [SetupRegistry] and
/// [InvocationLog], and answers verification queries over them.
///
/// Each call is resolved to its governing setup, appended to the log, and, when a setup
/// governed it, recorded as a match under a fresh version. Reporting failures is left to the
/// caller.
///
/// The three steps of [#dispatch(Invocation)] take the registry and log locks one after the
/// other, so a [#reset()] running concurrently can let a match for a setup resolved before the
/// reset land in the index created by it. That record is inert: the registry never issues the
/// id again, so no setup registered after the reset can be satisfied by it.
///
/// A log records ids issued by exactly one registry. Building a second dispatcher over a
/// shared log is only allowed together with the same registry.
///
/// Example usage:
/// <pre>
/// CallDispatcher dispatcher = new CallDispatcher.Builder().initialCapacity(16).build();
/// dispatcher.setup(setup);
/// dispatcher.dispatch(invocation).ifPresent(governing -> ...);
/// List&lt;RegisteredSetup&gt; missing = dispatcher.findUnverifiedSetups();
/// </pre>
public final class CallDispatcher {

  private static final Logger logger = Logger.getLogger(CallDispatcher.class.getName());

  @Getter private final SetupRegistry setups;
  @Getter private final InvocationLog invocations;

  private CallDispatcher(SetupRegistry setups, InvocationLog invocations) {
    this.setups = setups;
    this.invocations = invocations;
    invocations.bindTo(setups);
  }

  public RegisteredSetup setup(Setup setup) {
    return setups.add(setup);
  }

  /// Resolves the setup governing `invocation` and records the call.
  ///
  /// @return the governing setup, or empty if none matched; the call is logged either way
  public Optional<RegisteredSetup> dispatch(Invocation invocation) {
    Objects.requireNonNull(invocation, "invocation");
    final Optional<RegisteredSetup> governing = setups.findMatchFor(invocation);
    invocations.add(invocation);
    governing.ifPresent(setup -> invocations.recordMatchedInvocation(setup.id(), invocation));
    logger.log(
        Level.FINE,
        () ->
            String.format(
                "dispatch %s -> %s",
                invocation, governing.map(RegisteredSetup::toString).orElse("not registered")));
    return governing;
  }

  /// Live setups that no recorded call has satisfied yet, newest first.
  ///
  /// @param dontVerify setups it accepts are skipped
  public List<RegisteredSetup> findUnverifiedSetups(Predicate<? super RegisteredSetup> dontVerify) {
    final List<RegisteredSetup> live = setups.toArrayLive(setup -> true);
    try (VerificationContext context = invocations.asInvocationContext()) {
      final List<RegisteredSetup> unverified =
          live.stream()
              .filter(setup -> !context.isMatchedByInvocation(setup, dontVerify))
              .collect(Collectors.toList());
      logger.log(
          Level.FINE,
          () ->
              String.format(
                  "%d of %d live setups unverified at version %d",
                  unverified.size(), live.size(), context.version()));
      return unverified;
    }
  }

  /// Live setups not yet satisfied. Setups owning a nested mock are skipped as their nested
  /// mock is verified on its own.
  public List<RegisteredSetup> findUnverifiedSetups() {
    return findUnverifiedSetups(RegisteredSetup::canVerify);
  }

  /// Recorded calls that no verification has accounted for.
  public List<Invocation> unverifiedInvocations() {
    return invocations.toList(invocation -> !invocation.isVerified());
  }

  /// Nested mocks handed out by live setups, newest first.
  public List<Object> innerMocks() {
    return setups.getInnerMockSetups().stream()
        .map(setup -> setup.setup().returnsInnerMock())
        .flatMap(Optional::stream)
        .collect(Collectors.toList());
  }

  /// Forgets all setups and all recorded calls.
  public void reset() {
    setups.clear();
    invocations.clear();
  }

  /// Builder for [CallDispatcher]. Components may be supplied to share them between
  /// dispatchers; missing components are created fresh. A supplied log must always be paired
  /// with the registry it was first used with.
  public static final class Builder {
    private SetupRegistry setups;
    private InvocationLog invocations;
    private Integer initialCapacity;

    public Builder setupRegistry(SetupRegistry setups) {
      this.setups = Objects.requireNonNull(setups, "setups");
      return this;
    }

    public Builder invocationLog(InvocationLog invocations) {
      this.invocations = Objects.requireNonNull(invocations, "invocations");
      return this;
    }

    /// Capacity of the first allocation of a newly created invocation log.
    ///
    /// @param initialCapacity at least 1
    public Builder initialCapacity(int initialCapacity) {
      if (initialCapacity < 1) {
        throw new IllegalArgumentException(
            String.format("initialCapacity must be at least 1, got %d", initialCapacity));
      }
      this.initialCapacity = initialCapacity;
      return this;
    }

    /// @throws IllegalStateException if the supplied log already belongs to another registry
    public CallDispatcher build() {
      if (invocations != null && initialCapacity != null) {
        throw new IllegalStateException(
            "initialCapacity only applies when the builder creates the invocation log");
      }
      final SetupRegistry registry = setups != null ? setups : new SetupRegistry();
      final InvocationLog log;
      if (invocations != null) {
        log = invocations;
      } else if (initialCapacity != null) {
        log = new InvocationLog(initialCapacity);
      } else {
        log = new InvocationLog();
      }
      return new CallDispatcher(registry, log);
    }
  }
}
