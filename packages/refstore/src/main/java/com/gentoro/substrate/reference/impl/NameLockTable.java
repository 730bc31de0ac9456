package com.gentoro.substrate.reference.impl;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-name mutual exclusion. An entry exists only while some thread holds or waits for the name, so
 * the table does not grow with the number of names ever written.
 */
final class NameLockTable {
  private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

  private static final class Entry {
    final ReentrantLock lock = new ReentrantLock();
    // guarded by the map's per-key compute
    int users;
  }

  /** Blocks until the calling thread owns {@code name}. */
  Handle acquire(String name) {
    Entry entry =
        entries.compute(
            name,
            (k, v) -> {
              Entry e = v == null ? new Entry() : v;
              e.users++;
              return e;
            });
    entry.lock.lock();
    return new Handle(name, entry);
  }

  /** Number of names currently held or awaited. */
  int size() {
    return entries.size();
  }

  final class Handle implements AutoCloseable {
    private final String name;
    private final Entry entry;
    private boolean released;

    private Handle(String name, Entry entry) {
      this.name = name;
      this.entry = entry;
    }

    @Override
    public void close() {
      if (released) return;
      released = true;
      entry.lock.unlock();
      entries.computeIfPresent(name, (k, v) -> --v.users == 0 ? null : v);
    }
  }
}
