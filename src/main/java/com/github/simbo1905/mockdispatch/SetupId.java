package com.github.simbo1905.mockdispatch;

/// Registration order identifier of a setup within one [SetupRegistry]. Dense, zero based and
/// never reused. The value `-1` is reserved for "no governing setup".
public record SetupId(int value) {

  public static final SetupId NOT_REGISTERED = new SetupId(-1);

  public SetupId {
    if (value < -1) {
      throw new IllegalArgumentException("Setup id must be >= -1, got " + value);
    }
  }

  public boolean isRegistered() {
    return value >= 0;
  }
}
