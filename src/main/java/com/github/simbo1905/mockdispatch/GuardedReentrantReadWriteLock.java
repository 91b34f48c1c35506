package com.github.simbo1905.mockdispatch;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/// Read/write lock handing out AutoCloseable guards so every acquisition is released by a
/// try-with-resources block:
/// <pre>
/// try (var ignored = lock.writeLock()) {
///   // mutate
/// }
/// </pre>
/// An [InvocationLog] and every [VerificationContext] it opens share one instance. Appends,
/// match recording and clears take the write side; size reads, snapshot capture and
/// verification lookups take the read side.
final class GuardedReentrantReadWriteLock {
  private final ReentrantReadWriteLock lock;

  GuardedReentrantReadWriteLock(boolean fair) {
    this.lock = new ReentrantReadWriteLock(fair);
  }

  GuardedReentrantReadWriteLock() {
    this(false);
  }

  Guard readLock() {
    return new Guard(lock.readLock());
  }

  Guard writeLock() {
    return new Guard(lock.writeLock());
  }

  boolean isWriteLockedByCurrentThread() {
    return lock.isWriteLockedByCurrentThread();
  }

  /// Holds one side of the lock until closed.
  static final class Guard implements AutoCloseable {
    private final Lock lock;

    Guard(Lock lock) {
      this.lock = lock;
      lock.lock();
    }

    @Override
    public void close() {
      lock.unlock();
    }
  }
}
