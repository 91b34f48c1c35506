package com.github.simbo1905.mockdispatch;

/// The kind of behaviour a [Setup] describes. Only the kinds that materialise a nested mock
/// can carry a further verification chain, see [RegisteredSetup#canVerify()].
///
/// @see RegisteredSetup
public enum SetupKind {
  /// Plain return value, callback or throw behaviour.
  STANDARD(false),

  /// Returns a nested mock created on demand for a recursive setup.
  INNER_MOCK(true),

  /// Getter half of an auto-implemented property that tracks its value in a nested mock.
  AUTO_PROPERTY_GETTER(true),

  /// Setter half of an auto-implemented property.
  AUTO_PROPERTY_SETTER(true);

  private final boolean ownsInnerMock;

  SetupKind(boolean ownsInnerMock) {
    this.ownsInnerMock = ownsInnerMock;
  }

  public boolean ownsInnerMock() {
    return ownsInnerMock;
  }
}
