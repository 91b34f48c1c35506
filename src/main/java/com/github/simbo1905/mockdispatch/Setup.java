package com.github.simbo1905.mockdispatch;

import java.lang.reflect.Method;
import java.util.Optional;

/// A registered behaviour specification for an intercepted call site. Setups are created by
/// the mocking front end; this library only reads them.
public interface Setup {

  /// Full match predicate. May be expensive as it evaluates argument matchers.
  boolean matches(Invocation invocation);

  /// The call-site signature this setup was declared against. Comparing it with
  /// [Invocation#getMethod()] is the cheap test run before [#matches(Invocation)].
  Method getMethod();

  /// The expectation identity used to detect overriding duplicates.
  Expectation getExpectation();

  default Optional<Condition> getCondition() {
    return Optional.empty();
  }

  /// The nested mock this setup hands out, if any.
  default Optional<Object> returnsInnerMock() {
    return Optional.empty();
  }

  default SetupKind getKind() {
    return SetupKind.STANDARD;
  }
}
