package com.github.simbo1905.mockdispatch;

/// Extra guard attached to a setup, evaluated by the interception layer at call time.
/// A setup that has one never shadows, and is never shadowed by, another setup.
@FunctionalInterface
public interface Condition {
  boolean isTrue();
}
