package com.github.simbo1905.mockdispatch;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Objects;
import lombok.Getter;

/// Default [Invocation]: method, a copy of the arguments and the value the call returned.
public final class RecordedInvocation implements Invocation {

  @Getter private final Method method;
  private final Object[] arguments;
  @Getter private final Object returnValue;
  private volatile boolean verified;

  public RecordedInvocation(Method method, Object[] arguments, Object returnValue) {
    this.method = Objects.requireNonNull(method, "method");
    this.arguments = arguments == null ? new Object[0] : arguments.clone();
    this.returnValue = returnValue;
  }

  public RecordedInvocation(Method method, Object... arguments) {
    this(method, arguments, null);
  }

  @Override
  public Object[] getArguments() {
    return arguments.clone();
  }

  @Override
  public void markAsVerified() {
    verified = true;
  }

  @Override
  public boolean isVerified() {
    return verified;
  }

  @Override
  public String toString() {
    return String.format(
        "%s.%s(%s)%s",
        method.getDeclaringClass().getSimpleName(),
        method.getName(),
        Arrays.toString(arguments),
        verified ? " [verified]" : "");
  }
}
