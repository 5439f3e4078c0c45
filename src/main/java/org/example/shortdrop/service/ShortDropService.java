package org.example.shortdrop.service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.example.shortdrop.model.Entry;
import org.example.shortdrop.model.EntryMetadata;
import org.example.shortdrop.model.LookupResult;
import org.example.shortdrop.model.WriteOutcome;
import org.example.shortdrop.storage.ArtifactStore;
import org.example.shortdrop.storage.MappingStore;
import org.example.shortdrop.util.TtlPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application service for the short-link lifecycle seen by callers: creating links and drops,
 * resolving codes, and reading metadata for the admin view.
 *
 * <p>The service holds no mutable state of its own; everything goes through the shared {@link
 * MappingStore}, which makes it safe to use from many request threads at once.
 *
 * <h2>Creation</h2>
 *
 * <ul>
 *   <li>A caller may supply a custom code. It is trimmed and otherwise used as-is; a blank one is
 *       replaced by a generated code.
 *   <li>A custom code that already exists overwrites the old entry (hits start over at 0).
 *   <li>A URL target is stored verbatim (trimmed). A file is saved to the {@link ArtifactStore}
 *       and its reference becomes the target.
 * </ul>
 *
 * <h2>Lookup</h2>
 *
 * <p>{@link #lookup(String)} re-checks the TTL itself, so an expired entry the reaper has not yet
 * removed is reported as {@link LookupResult.Outcome#EXPIRED}, never served.
 */
public class ShortDropService {
  private static final Logger LOGGER = LoggerFactory.getLogger(ShortDropService.class);

  private final MappingStore store;
  private final ArtifactStore artifacts;
  private final CodeGenerator codes;
  private final TtlPolicy ttl;
  private final Clock clock;
  private final String baseUrl;

  public ShortDropService(
      MappingStore store,
      ArtifactStore artifacts,
      CodeGenerator codes,
      TtlPolicy ttl,
      Clock clock,
      String baseUrl) {
    this.store = Objects.requireNonNull(store, "store");
    this.artifacts = Objects.requireNonNull(artifacts, "artifacts");
    this.codes = Objects.requireNonNull(codes, "codes");
    this.ttl = Objects.requireNonNull(ttl, "ttl");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.baseUrl = (baseUrl == null) ? "" : baseUrl;
  }

  // ---------- Create ----------

  /**
   * Creates (or replaces) a link to {@code url}.
   *
   * @param url redirect target; absolute or relative, not validated beyond being non-blank
   * @param customCode optional code; blank means "generate one"
   * @return stored entry
   * @throws IllegalArgumentException if {@code url} is blank
   */
  public Entry shortenUrl(String url, String customCode) {
    if (url == null || url.isBlank()) {
      throw new IllegalArgumentException("Error: URL must not be blank.");
    }
    return save(resolveCode(customCode), url.trim());
  }

  /**
   * Stores an uploaded file and creates (or replaces) an entry pointing at it.
   *
   * <p>If the entry cannot be written the saved file is removed again before the failure
   * propagates.
   *
   * @param originalName client file name
   * @param content file bytes; not closed here
   * @param customCode optional code; blank means "generate one"
   * @return stored entry whose target is the artifact reference
   * @throws IOException if the file cannot be stored
   */
  public Entry dropFile(String originalName, InputStream content, String customCode)
      throws IOException {
    String target = artifacts.save(originalName, content);
    String code = resolveCode(customCode);
    try {
      write(code, target);
    } catch (RuntimeException e) {
      // an artifact without an entry would never be reaped
      discardArtifact(target, e);
      throw e;
    }
    return stored(code, target);
  }

  private void discardArtifact(String target, RuntimeException cause) {
    try {
      artifacts.remove(target);
    } catch (IOException | RuntimeException e) {
      cause.addSuppressed(e);
      LOGGER.warn("Could not discard orphaned artifact {}: {}", target, e.getMessage());
    }
  }

  /**
   * Handles a combined submission where exactly one of URL or file must be present.
   *
   * @param url URL field, may be {@code null}/blank
   * @param fileName uploaded file name, may be {@code null}/blank when no file was sent
   * @param content uploaded file content, required when {@code fileName} is present
   * @param customCode optional code
   * @return stored entry
   * @throws IllegalArgumentException if both or neither of URL and file are given
   * @throws IOException if the file cannot be stored
   */
  public Entry create(String url, String fileName, InputStream content, String customCode)
      throws IOException {
    boolean hasFile = fileName != null && !fileName.isBlank() && content != null;
    boolean hasUrl = url != null && !url.isBlank();
    if (hasFile && hasUrl) {
      throw new IllegalArgumentException("Error: Provide EITHER a URL OR a file, not both.");
    }
    if (hasFile) return dropFile(fileName, content, customCode);
    if (hasUrl) return shortenUrl(url, customCode);
    throw new IllegalArgumentException("Error: Please provide a file or a URL.");
  }

  private String resolveCode(String customCode) {
    String code = (customCode == null) ? "" : customCode.trim();
    return code.isEmpty() ? codes.generate() : code;
  }

  private Entry save(String code, String target) {
    write(code, target);
    return stored(code, target);
  }

  private void write(String code, String target) {
    WriteOutcome outcome = store.createOrReplace(code, target);
    LOGGER.info("{} {} -> {}", outcome == WriteOutcome.INSERTED ? "Created" : "Replaced", code, target);
  }

  private Entry stored(String code, String target) {
    return store
        .get(code)
        .orElseGet(() -> new Entry(code, target, clock.instant().getEpochSecond(), 0L));
  }

  // ---------- Lookup ----------

  /**
   * Resolves a code for redirection.
   *
   * <p>On success the hit counter is incremented before returning. A failed increment is logged
   * and the target is still returned.
   *
   * @param code short code
   * @return target, expired or not-found
   */
  public LookupResult lookup(String code) {
    Optional<Entry> opt = store.get(code);
    if (opt.isEmpty()) return LookupResult.notFound();
    Entry e = opt.get();

    long now = clock.instant().getEpochSecond();
    if (ttl.isExpired(now, e.createdAt)) {
      return LookupResult.expired();
    }
    try {
      store.incrementHits(code);
    } catch (RuntimeException ex) {
      LOGGER.warn("Hit increment failed for {}: {}", code, ex.getMessage());
    }
    return LookupResult.target(e.target);
  }

  // ---------- Queries ----------

  /**
   * Reads an entry's metadata without counting a hit. Expired-but-unreaped entries are still
   * reported, with {@code expiresIn == 0}.
   *
   * @param code short code
   * @return metadata, or empty if the code is unknown
   */
  public Optional<EntryMetadata> metadata(String code) {
    return store.get(code).map(this::toMetadata);
  }

  /**
   * Admin listing, newest first.
   *
   * @param filter optional substring matched against code and target
   * @return matching entries
   */
  public List<Entry> search(String filter) {
    return store.list(filter);
  }

  /**
   * @param createdAt entry creation time, seconds since the epoch
   * @return seconds until expiry, never negative
   */
  public long secondsLeft(long createdAt) {
    return ttl.secondsLeft(clock.instant().getEpochSecond(), createdAt);
  }

  /**
   * @param target artifact reference
   * @return stored file, or empty if {@code target} is not a valid artifact reference
   */
  public Optional<Path> resolveArtifact(String target) {
    return artifacts.resolve(target);
  }

  /**
   * Builds the absolute short link for {@code code}.
   *
   * @param code short code
   * @return {@code baseUrl + code}
   */
  public String makeShort(String code) {
    return baseUrl + code;
  }

  public TtlPolicy ttl() {
    return ttl;
  }

  private EntryMetadata toMetadata(Entry e) {
    EntryMetadata m = new EntryMetadata();
    m.target = e.target;
    m.createdAt = e.createdAt;
    m.expiresIn = secondsLeft(e.createdAt);
    m.hits = e.hits;
    return m;
  }
}
