package com.github.simbo1905.mockdispatch;

/// A matched invocation record key: which setup matched, and the log version at which the
/// match was recorded.
///
/// Equality is the ordinary value equality of a record. Point-in-time lookups use the
/// one-directional [#isRecordedAtOrBefore(VersionedKey)] test instead.
///
/// @param setupId  [SetupId#value()] of the matching setup
/// @param version  version issued by [InvocationLog#recordMatchedInvocation(SetupId, Invocation)]
public record VersionedKey(int setupId, long version) {

  /// True if this stored key is for the same setup as `query` and was recorded no later than
  /// the version `query` asks about. Only ever called on a stored key with a query argument.
  public boolean isRecordedAtOrBefore(VersionedKey query) {
    return setupId == query.setupId && version <= query.version;
  }
}
