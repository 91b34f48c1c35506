package com.github.simbo1905.mockdispatch;

/// Identity of the call pattern a setup was declared with. Two setups whose expectations are
/// equal describe the same call, so the newer one overrides the older one.
///
/// Implementations must provide value based `equals` and `hashCode`; a `record` does.
public interface Expectation {
  /// Human readable form of the call pattern, used in log output.
  String describe();
}
