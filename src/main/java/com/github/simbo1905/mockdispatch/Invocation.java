package com.github.simbo1905.mockdispatch;

import java.lang.reflect.Method;

/// One observed call to an intercepted call site. Created by the interception layer and
/// owned by an [InvocationLog] once appended. The only mutation the log allows is
/// [#markAsVerified()].
public interface Invocation {

  Method getMethod();

  Object[] getArguments();

  /// Flags this call as accounted for by a verification. Must be idempotent and safe to call
  /// from any thread.
  void markAsVerified();

  boolean isVerified();
}
