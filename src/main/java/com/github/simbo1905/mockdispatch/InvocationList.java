package com.github.simbo1905.mockdispatch;

import java.util.stream.Stream;

/// Read-only view over recorded invocations in the order they were observed.
public interface InvocationList extends Iterable<Invocation> {

  int size();

  default boolean isEmpty() {
    return size() == 0;
  }

  /// @throws IndexOutOfBoundsException if `index < 0 || index >= size()`
  Invocation get(int index);

  /// A stream over the invocations present when the stream was created.
  Stream<Invocation> stream();
}
