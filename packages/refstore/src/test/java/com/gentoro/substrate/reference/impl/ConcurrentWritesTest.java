package com.gentoro.substrate.reference.impl;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.substrate.reference.WriteResult;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("Concurrent writers")
@Timeout(value = 60, unit = TimeUnit.SECONDS)
class ConcurrentWritesTest {

  private static final int THREADS = 8;
  private static final int WRITES_PER_THREAD = 25;

  @TempDir Path root;
  private FileSystemReferenceStore store;
  private ExecutorService pool;

  @BeforeEach
  void setUp() {
    store = new FileSystemReferenceStore(root);
    pool = Executors.newFixedThreadPool(THREADS);
  }

  @AfterEach
  void tearDown() throws Exception {
    pool.shutdownNow();
    pool.awaitTermination(10, TimeUnit.SECONDS);
  }

  @Test
  void noUpdateIsLostOnTheSameName() throws Exception {
    CountDownLatch start = new CountDownLatch(1);
    List<Future<List<Long>>> futures = new ArrayList<>();
    for (int t = 0; t < THREADS; t++) {
      final int thread = t;
      Callable<List<Long>> task =
          () -> {
            start.await();
            List<Long> versions = new ArrayList<>();
            for (int i = 0; i < WRITES_PER_THREAD; i++) {
              WriteResult r = store.createOrUpdate("shared/counter", "t" + thread + "-" + i);
              versions.add(r.version());
            }
            return versions;
          };
      futures.add(pool.submit(task));
    }
    start.countDown();

    Set<Long> seen = new HashSet<>();
    for (Future<List<Long>> f : futures) {
      for (Long v : f.get()) {
        assertTrue(seen.add(v), "version " + v + " returned twice");
      }
    }
    int total = THREADS * WRITES_PER_THREAD;
    assertEquals(total, seen.size());
    assertEquals(total, store.read("shared/counter").version());
    for (long v = 1; v <= total; v++) {
      assertTrue(seen.contains(v), "missing version " + v);
    }
  }

  @Test
  void differentNamesProgressIndependently() throws Exception {
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    for (int t = 0; t < THREADS; t++) {
      final String name = "group/ref" + t;
      futures.add(
          pool.submit(
              () -> {
                start.await();
                for (int i = 0; i < WRITES_PER_THREAD; i++) {
                  store.createOrUpdate(name, "v" + i);
                }
                return null;
              }));
    }
    start.countDown();
    for (Future<?> f : futures) f.get();

    assertEquals(THREADS, store.list("group/").size());
    for (int t = 0; t < THREADS; t++) {
      assertEquals(WRITES_PER_THREAD, store.read("group/ref" + t).version());
    }
  }

  @Test
  void deletesAndCreatesInTheSameDirectoryDoNotInterfere() throws Exception {
    CountDownLatch start = new CountDownLatch(1);
    Future<?> churn =
        pool.submit(
            () -> {
              start.await();
              for (int i = 0; i < 100; i++) {
                store.createOrUpdate("dir/churn", "x");
                store.delete("dir/churn");
              }
              return null;
            });
    Future<?> writer =
        pool.submit(
            () -> {
              start.await();
              for (int i = 0; i < 100; i++) {
                store.createOrUpdate("dir/stable", "v" + i);
              }
              return null;
            });
    start.countDown();
    churn.get();
    writer.get();

    assertEquals(100, store.read("dir/stable").version());
    assertEquals(List.of("dir/stable"), store.list("dir/"));
  }

  @Test
  void readersNeverSeePartialRecords() throws Exception {
    String big = "x".repeat(64 * 1024);
    store.createOrUpdate("big", big);
    CountDownLatch start = new CountDownLatch(1);
    Future<?> writer =
        pool.submit(
            () -> {
              start.await();
              for (int i = 0; i < 50; i++) store.createOrUpdate("big", big);
              return null;
            });
    Future<?> reader =
        pool.submit(
            () -> {
              start.await();
              for (int i = 0; i < 200; i++) {
                assertEquals(big.length(), store.read("big").content().length());
              }
              return null;
            });
    start.countDown();
    writer.get();
    reader.get();
  }
}
