package org.example.shortdrop.service;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.example.shortdrop.model.Entry;
import org.example.shortdrop.model.EntryMetadata;
import org.example.shortdrop.model.LookupResult;
import org.example.shortdrop.storage.JsonMappingStore;
import org.example.shortdrop.storage.LocalArtifactStore;
import org.example.shortdrop.storage.MappingStore;
import org.example.shortdrop.storage.StoreUnavailableException;
import org.example.shortdrop.testing.FaultyMappingStore;
import org.example.shortdrop.testing.MutableClock;
import org.example.shortdrop.testing.RecordingArtifactStore;
import org.example.shortdrop.util.TtlPolicy;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link ShortDropService}: creation rules, lookup outcomes around the TTL boundary, hit
 * counting and the admin queries.
 */
class ShortDropServiceTest {

  @TempDir Path tempDir;

  private MutableClock clock;
  private JsonMappingStore store;
  private RecordingArtifactStore artifacts;
  private ShortDropService service;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(0);
    store = new JsonMappingStore(tempDir.resolve("urls.json"), clock);
    artifacts = new RecordingArtifactStore();
    service = newService(store);
  }

  private ShortDropService newService(MappingStore s) {
    return new ShortDropService(
        s,
        artifacts,
        new CodeGenerator(new Random(3), 6),
        new TtlPolicy(600),
        clock,
        "http://localhost:5050/");
  }

  private static ByteArrayInputStream bytes(String s) {
    return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  @DisplayName("scenario: live lookup counts a hit, expired lookup does not, sweep removes")
  void lookup_lifecycle() {
    service.shortenUrl("https://example.com", "abc123");

    clock.setEpochSecond(599);
    assertEquals(LookupResult.target("https://example.com"), service.lookup("abc123"));
    assertEquals(1L, store.get("abc123").orElseThrow().hits);

    clock.setEpochSecond(601);
    assertEquals(LookupResult.expired(), service.lookup("abc123"));
    assertEquals(1L, store.get("abc123").orElseThrow().hits, "expired lookup must not count");

    new ExpiryReaper(store, artifacts, new TtlPolicy(600), clock, Duration.ofSeconds(60)).sweep();
    assertEquals(LookupResult.notFound(), service.lookup("abc123"));
  }

  @Test
  @DisplayName("an entry exactly TTL seconds old is still served")
  void lookup_exactBoundaryIsLive() {
    service.shortenUrl("https://example.com", "edge");

    clock.setEpochSecond(600);
    assertTrue(service.lookup("edge").isTarget());
    clock.setEpochSecond(601);
    assertEquals(LookupResult.Outcome.EXPIRED, service.lookup("edge").outcome());
  }

  @Test
  void lookup_unknown_isNotFound() {
    assertEquals(LookupResult.Outcome.NOT_FOUND, service.lookup("missing").outcome());
    assertNull(service.lookup("missing").target());
  }

  @Test
  @DisplayName("custom codes are used verbatim after trimming")
  void customCode_passthrough() {
    Entry e = service.shortenUrl("  https://example.com/path  ", "  my-Code_1 ");

    assertEquals("my-Code_1", e.code);
    assertEquals("https://example.com/path", e.target);
    assertEquals(0L, e.createdAt);
    assertTrue(store.get("my-Code_1").isPresent());
  }

  @Test
  @DisplayName("reusing a code overwrites the target and restarts hits and TTL")
  void customCode_replace() {
    service.shortenUrl("https://one.example", "dup");
    service.lookup("dup");
    service.lookup("dup");
    assertEquals(2L, store.get("dup").orElseThrow().hits);

    clock.setEpochSecond(500);
    Entry replaced = service.shortenUrl("https://two.example", "dup");
    assertEquals(0L, replaced.hits);
    assertEquals(500L, replaced.createdAt);

    clock.setEpochSecond(1_000);
    assertEquals(LookupResult.target("https://two.example"), service.lookup("dup"));
  }

  @Test
  @DisplayName("blank or missing custom code gets a generated 6-char code")
  void generatedCode() {
    Entry a = service.shortenUrl("https://a.example", null);
    Entry b = service.shortenUrl("https://b.example", "   ");

    assertTrue(a.code.matches("[A-Za-z0-9]{6}"), a.code);
    assertTrue(b.code.matches("[A-Za-z0-9]{6}"), b.code);
    assertNotEquals(a.code, b.code);
  }

  @Test
  void blankUrl_rejected() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> service.shortenUrl("  ", null));
    assertEquals("Error: URL must not be blank.", ex.getMessage());
    assertEquals(0, store.size());
  }

  @Test
  @DisplayName("create: exactly one of URL or file")
  void create_mutualExclusion() throws Exception {
    IllegalArgumentException both =
        assertThrows(
            IllegalArgumentException.class,
            () -> service.create("https://x", "a.txt", bytes("x"), null));
    assertEquals("Error: Provide EITHER a URL OR a file, not both.", both.getMessage());

    IllegalArgumentException none =
        assertThrows(IllegalArgumentException.class, () -> service.create(" ", "", null, null));
    assertEquals("Error: Please provide a file or a URL.", none.getMessage());

    assertEquals("https://x", service.create("https://x", null, null, "u").target);
    assertEquals("/uploads/1_a.txt", service.create(null, "a.txt", bytes("x"), "f").target);
    assertEquals(2, store.size());
  }

  @Test
  @DisplayName("dropping a file stores it and points the entry at the artifact")
  void dropFile_storesArtifact() throws Exception {
    Entry e = service.dropFile("a.png", bytes("PNG"), "x");

    assertEquals("/uploads/1_a.png", e.target);
    assertTrue(e.isArtifact());
    assertEquals(List.of("/uploads/1_a.png"), artifacts.saved());
    assertEquals(LookupResult.target("/uploads/1_a.png"), service.lookup("x"));
    assertEquals(Path.of("memory", "1_a.png"), service.resolveArtifact(e.target).orElseThrow());
  }

  @Test
  @DisplayName("a file whose entry cannot be written is removed again")
  void dropFile_storeDown_leavesNoFile() throws Exception {
    Path uploads = tempDir.resolve("uploads");
    LocalArtifactStore files = new LocalArtifactStore(uploads, clock);
    FaultyMappingStore faulty = new FaultyMappingStore(store);
    ShortDropService s =
        new ShortDropService(
            faulty, files, new CodeGenerator(new Random(3), 6), new TtlPolicy(600), clock, "");
    faulty.storeDown(true);

    assertThrows(StoreUnavailableException.class, () -> s.dropFile("a.png", bytes("PNG"), "x"));

    faulty.storeDown(false);
    assertEquals(0, store.size());
    try (Stream<Path> left = Files.list(uploads)) {
      assertEquals(List.of(), left.collect(Collectors.toList()));
    }
  }

  @Test
  @DisplayName("failed entry write still propagates when the cleanup also fails")
  void dropFile_storeDown_cleanupFailure() {
    FaultyMappingStore faulty = new FaultyMappingStore(store);
    ShortDropService s = newService(faulty);
    faulty.storeDown(true);
    artifacts.failRemovals(true);

    StoreUnavailableException ex =
        assertThrows(StoreUnavailableException.class, () -> s.dropFile("a.png", bytes("x"), "x"));

    assertEquals(List.of("/uploads/1_a.png"), artifacts.removed());
    assertEquals(1, ex.getSuppressed().length);
  }

  @Test
  @DisplayName("N concurrent lookups produce exactly N hits")
  void lookup_concurrentHits() throws Exception {
    service.shortenUrl("https://example.com", "hot");
    int n = 200;

    ExecutorService pool = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<LookupResult>> futures = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      futures.add(
          pool.submit(
              () -> {
                start.await();
                return service.lookup("hot");
              }));
    }
    start.countDown();
    for (Future<LookupResult> f : futures) {
      assertTrue(f.get(30, TimeUnit.SECONDS).isTarget());
    }
    pool.shutdown();

    assertEquals((long) n, store.get("hot").orElseThrow().hits);
  }

  @Test
  @DisplayName("a failed hit increment still serves the target")
  void lookup_incrementFailure_stillServes() {
    FaultyMappingStore faulty = new FaultyMappingStore(store);
    ShortDropService s = newService(faulty);
    s.shortenUrl("https://example.com", "c");
    faulty.failIncrements(true);

    assertEquals(LookupResult.target("https://example.com"), s.lookup("c"));
    assertEquals(0L, store.get("c").orElseThrow().hits);
  }

  @Test
  @DisplayName("metadata reports remaining TTL without counting a hit")
  void metadata() {
    service.shortenUrl("https://example.com", "m");
    service.lookup("m");
    clock.setEpochSecond(100);

    EntryMetadata md = service.metadata("m").orElseThrow();
    assertEquals("https://example.com", md.target);
    assertEquals(0L, md.createdAt);
    assertEquals(500L, md.expiresIn);
    assertEquals(1L, md.hits);
    assertEquals(1L, store.get("m").orElseThrow().hits);

    clock.setEpochSecond(10_000);
    assertEquals(0L, service.metadata("m").orElseThrow().expiresIn);
    assertTrue(service.metadata("nope").isEmpty());
  }

  @Test
  void search_filtersAndOrders() {
    service.shortenUrl("https://example.com", "first");
    clock.setEpochSecond(5);
    service.shortenUrl("https://other.org", "second");

    assertEquals(
        List.of("second", "first"),
        service.search(null).stream().map(e -> e.code).collect(Collectors.toList()));
    assertEquals(
        List.of("first"),
        service.search("example").stream().map(e -> e.code).collect(Collectors.toList()));
  }

  @Test
  void makeShort_andSecondsLeft() {
    assertEquals("http://localhost:5050/abc", service.makeShort("abc"));
    clock.setEpochSecond(42);
    assertEquals(558L, service.secondsLeft(0));
    assertEquals(600L, service.ttl().ttlSeconds());
  }
}
