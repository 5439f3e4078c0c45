package org.example.shortdrop.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.example.shortdrop.model.Entry;
import org.example.shortdrop.model.WriteOutcome;
import org.example.shortdrop.testing.MutableClock;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link JsonMappingStore}: upsert semantics, snapshots, TTL query, idempotent delete,
 * admin listing, persistence across instances and failure handling.
 *
 * <p>Every test works on its own file under {@code @TempDir}.
 */
class JsonMappingStoreTest {

  @TempDir Path tempDir;

  private Path file;
  private MutableClock clock;
  private JsonMappingStore store;

  @BeforeEach
  void setUp() {
    file = tempDir.resolve("data").resolve("urls.json");
    clock = new MutableClock(1_000L);
    store = new JsonMappingStore(file, clock);
  }

  @Test
  @DisplayName("new store creates an empty file")
  void open_createsFile() throws Exception {
    assertTrue(Files.exists(file));
    assertEquals(0, store.size());
    assertEquals("[]", Files.readString(file, StandardCharsets.UTF_8).trim());
  }

  @Test
  @DisplayName("createOrReplace inserts with createdAt=now and hits=0")
  void create_insert() {
    assertEquals(WriteOutcome.INSERTED, store.createOrReplace("abc123", "https://example.com"));

    Entry e = store.get("abc123").orElseThrow();
    assertEquals("abc123", e.code);
    assertEquals("https://example.com", e.target);
    assertEquals(1_000L, e.createdAt);
    assertEquals(0L, e.hits);
  }

  @Test
  @DisplayName("replacing a code keeps the new target, resets hits and restamps createdAt")
  void create_replace_resetsHits() {
    store.createOrReplace("c", "t1");
    store.incrementHits("c");
    store.incrementHits("c");
    assertEquals(2L, store.get("c").orElseThrow().hits);

    clock.advanceSeconds(30);
    assertEquals(WriteOutcome.REPLACED, store.createOrReplace("c", "t2"));

    Entry e = store.get("c").orElseThrow();
    assertEquals("t2", e.target);
    assertEquals(0L, e.hits);
    assertEquals(1_030L, e.createdAt);
    assertEquals(1, store.size());
  }

  @Test
  void get_absent_isEmpty() {
    assertEquals(Optional.empty(), store.get("nope"));
  }

  @Test
  @DisplayName("get returns a detached copy")
  void get_returnsSnapshot() {
    store.createOrReplace("c", "t");
    Entry e = store.get("c").orElseThrow();
    e.hits = 99;
    e.target = "tampered";

    Entry again = store.get("c").orElseThrow();
    assertEquals(0L, again.hits);
    assertEquals("t", again.target);
  }

  @Test
  void get_returnsExpiredRowsToo() {
    store.createOrReplace("c", "t");
    clock.advanceSeconds(10_000);
    assertTrue(store.get("c").isPresent());
  }

  @Test
  void incrementHits_absent_isNoop() {
    assertFalse(store.incrementHits("ghost"));
    assertEquals(0, store.size());
  }

  @Test
  @DisplayName("concurrent increments on one code lose no updates")
  void incrementHits_concurrent() throws Exception {
    store.createOrReplace("hot", "https://example.com");
    int threads = 8;
    int perThread = 100;

    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    for (int t = 0; t < threads; t++) {
      futures.add(
          pool.submit(
              () -> {
                start.await();
                for (int i = 0; i < perThread; i++) store.incrementHits("hot");
                return null;
              }));
    }
    start.countDown();
    for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
    pool.shutdown();

    assertEquals((long) threads * perThread, store.get("hot").orElseThrow().hits);
  }

  @Test
  @DisplayName("findExpired returns only entries strictly past the TTL")
  void findExpired_strictBoundary() {
    clock.setEpochSecond(0);
    store.createOrReplace("old", "t");
    clock.setEpochSecond(100);
    store.createOrReplace("mid", "t");
    clock.setEpochSecond(200);
    store.createOrReplace("new", "t");

    List<String> expired =
        store.findExpired(700, 600).stream().map(e -> e.code).collect(Collectors.toList());
    assertEquals(List.of("old"), expired);

    // at 700 "mid" is exactly at the TTL: still live
    assertTrue(store.findExpired(700, 600).stream().noneMatch(e -> e.code.equals("mid")));

    assertEquals(2, store.findExpired(701, 600).size());
    assertTrue(store.findExpired(0, 600).isEmpty());
  }

  @Test
  @DisplayName("delete is idempotent")
  void delete_idempotent() {
    store.createOrReplace("c", "t");
    assertTrue(store.delete("c"));
    assertFalse(store.delete("c"));
    assertFalse(store.delete("never-existed"));
    assertTrue(store.get("c").isEmpty());
  }

  @Test
  @DisplayName("deleteIfExpired leaves live and replaced entries alone")
  void deleteIfExpired_onlyExpired() {
    clock.setEpochSecond(0);
    store.createOrReplace("c", "old");

    assertFalse(store.deleteIfExpired("c", 600, 600), "not yet expired");
    clock.setEpochSecond(650);
    store.createOrReplace("c", "fresh");
    assertFalse(store.deleteIfExpired("c", 650, 600), "replaced entry must survive");
    assertTrue(store.get("c").isPresent());

    assertTrue(store.deleteIfExpired("c", 1_251, 600));
    assertFalse(store.deleteIfExpired("c", 1_251, 600));
  }

  @Test
  @DisplayName("list: newest first, optional substring filter on code or target")
  void list_orderAndFilter() {
    clock.setEpochSecond(10);
    store.createOrReplace("aaa", "https://example.com/x");
    clock.setEpochSecond(20);
    store.createOrReplace("bbb", "/uploads/20_report.pdf");
    clock.setEpochSecond(30);
    store.createOrReplace("ccc", "https://other.org");

    assertEquals(
        List.of("ccc", "bbb", "aaa"),
        store.list(null).stream().map(e -> e.code).collect(Collectors.toList()));
    assertEquals(3, store.list("   ").size());

    assertEquals(
        List.of("aaa"),
        store.list("example").stream().map(e -> e.code).collect(Collectors.toList()));
    assertEquals(
        List.of("bbb"), store.list("bb").stream().map(e -> e.code).collect(Collectors.toList()));
    assertEquals(
        List.of("ccc", "aaa"),
        store.list("https").stream().map(e -> e.code).collect(Collectors.toList()));
    assertTrue(store.list("zzz").isEmpty());
  }

  @Test
  @DisplayName("entries survive reopening the same file")
  void persistence_reopen() {
    store.createOrReplace("abc", "https://example.com/?a=1&b=2");
    store.incrementHits("abc");
    store.createOrReplace("", "empty-code-target");

    JsonMappingStore reopened = new JsonMappingStore(file, clock);
    Entry e = reopened.get("abc").orElseThrow();
    assertEquals("https://example.com/?a=1&b=2", e.target);
    assertEquals(1L, e.hits);
    assertEquals(1_000L, e.createdAt);
    assertEquals("empty-code-target", reopened.get("").orElseThrow().target);
  }

  @Test
  void storedFile_keepsUrlsReadable() throws Exception {
    store.createOrReplace("abc", "https://example.com/?a=1&b=2");
    String json = Files.readString(file, StandardCharsets.UTF_8);
    assertTrue(json.contains("https://example.com/?a=1&b=2"), json);
  }

  @Test
  @DisplayName("rows without a code or target are skipped on load")
  void incompleteRows_skipped() throws Exception {
    Path edited = tempDir.resolve("edited.json");
    Files.writeString(
        edited,
        "[{\"code\":\"ok\",\"target\":\"https://a\",\"createdAt\":1000,\"hits\":0},"
            + "{\"code\":\"nt\",\"createdAt\":1000,\"hits\":0},"
            + "{\"target\":\"https://b\",\"createdAt\":1000}]",
        StandardCharsets.UTF_8);

    JsonMappingStore loaded = new JsonMappingStore(edited, clock);

    assertEquals(1, loaded.size());
    assertTrue(loaded.get("ok").isPresent());
    assertTrue(loaded.get("nt").isEmpty());
  }

  @Test
  @DisplayName("malformed store file is fatal, not silently replaced")
  void corruptFile_isFatal() throws Exception {
    Path bad = tempDir.resolve("bad.json");
    Files.writeString(bad, "{ not json", StandardCharsets.UTF_8);

    assertThrows(StoreUnavailableException.class, () -> new JsonMappingStore(bad, clock));
    assertEquals("{ not json", Files.readString(bad, StandardCharsets.UTF_8));
  }

  @Test
  @DisplayName("failed flush rolls back the in-memory change")
  void flushFailure_rollsBack() throws Exception {
    store.createOrReplace("keep", "t");

    // replace the data directory with a plain file so the next write cannot happen
    Path dataDir = file.getParent();
    Files.delete(file);
    Files.delete(dataDir);
    Files.writeString(dataDir, "blocker", StandardCharsets.UTF_8);

    assertThrows(StoreUnavailableException.class, () -> store.createOrReplace("new", "t"));
    assertTrue(store.get("new").isEmpty());

    assertThrows(StoreUnavailableException.class, () -> store.incrementHits("keep"));
    assertEquals(0L, store.get("keep").orElseThrow().hits);

    assertThrows(StoreUnavailableException.class, () -> store.delete("keep"));
    assertTrue(store.get("keep").isPresent());
  }
}
