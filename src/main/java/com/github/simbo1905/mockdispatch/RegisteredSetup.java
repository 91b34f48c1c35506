package com.github.simbo1905.mockdispatch;

import java.util.Objects;

/// A [Setup] as held by a [SetupRegistry]: the setup plus the id it was registered under.
///
/// @param id          registration order identifier
/// @param setup       the wrapped setup
/// @param canVerify   true if the setup owns a nested mock; must agree with the setup kind
/// @see SetupRegistry#add(Setup)
public record RegisteredSetup(SetupId id, Setup setup, boolean canVerify) {

  public RegisteredSetup {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(setup, "setup");
    if (!id.isRegistered()) {
      throw new IllegalArgumentException("A registered setup needs a registered id, got " + id);
    }
    if (canVerify != setup.getKind().ownsInnerMock()) {
      throw new IllegalArgumentException(
          String.format("canVerify=%s does not match setup kind %s", canVerify, setup.getKind()));
    }
  }

  static RegisteredSetup of(int id, Setup setup) {
    return new RegisteredSetup(new SetupId(id), setup, setup.getKind().ownsInnerMock());
  }

  @Override
  public String toString() {
    return String.format(
        "RegisteredSetup[id=%d, expectation=%s, canVerify=%s]",
        id.value(), setup.getExpectation().describe(), canVerify);
  }
}
