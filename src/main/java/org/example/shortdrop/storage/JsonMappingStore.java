package org.example.shortdrop.storage;

import com.google.gson.reflect.TypeToken;
import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.file.Path;
import java.time.Clock;
import java.util.*;
import java.util.stream.Collectors;
import org.example.shortdrop.model.Entry;
import org.example.shortdrop.model.WriteOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MappingStore} kept in memory and persisted to a single JSON file.
 *
 * <p>Entries are cached in a map keyed by code and flushed to disk after every mutation via
 * {@link JsonFiles#writeAtomic(Path, Object)}. All operations are {@code synchronized} on the
 * store, which serializes writers and readers alike; callers only ever receive {@link
 * Entry#copy() copies}.
 *
 * <p>If a flush fails, the in-memory mutation is undone before {@link StoreUnavailableException}
 * is thrown, so memory never runs ahead of the file.
 *
 * <p>A missing file is created empty on construction. A file that cannot be parsed is treated as
 * fatal rather than overwritten. Rows without a code or a target are skipped on load.
 */
public class JsonMappingStore implements MappingStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(JsonMappingStore.class);

  private static final Type LIST_TYPE = new TypeToken<List<Entry>>() {}.getType();

  private static final Comparator<Entry> NEWEST_FIRST =
      Comparator.comparingLong((Entry e) -> e.createdAt)
          .reversed()
          .thenComparing(
              (Entry e) -> e.code, Comparator.nullsFirst(Comparator.<String>naturalOrder()));

  private final Path file;
  private final Clock clock;
  private final Map<String, Entry> entries = new LinkedHashMap<>();

  /**
   * Opens (or creates) the store at {@code file}.
   *
   * @param file JSON file holding the entries
   * @param clock source of creation timestamps
   * @throws StoreUnavailableException if the file cannot be read, created or parsed
   */
  public JsonMappingStore(Path file, Clock clock) {
    this.file = Objects.requireNonNull(file, "file");
    this.clock = Objects.requireNonNull(clock, "clock");
    List<Entry> loaded;
    try {
      loaded = JsonFiles.readOrCreate(file, LIST_TYPE, new ArrayList<>());
    } catch (IOException e) {
      throw new StoreUnavailableException("Cannot open mapping store " + file, e);
    }
    for (Entry e : loaded) {
      if (e == null || e.code == null || e.target == null) {
        LOGGER.warn("Skipping incomplete row in {}: {}", file, e);
        continue;
      }
      entries.put(e.code, e); // duplicate codes: last one wins
    }
    LOGGER.info("Mapping store opened at {} with {} entries", file.toAbsolutePath(), entries.size());
  }

  @Override
  public synchronized WriteOutcome createOrReplace(String code, String target) {
    Objects.requireNonNull(code, "code");
    Objects.requireNonNull(target, "target");
    long now = clock.instant().getEpochSecond();
    Entry fresh = new Entry(code, target, now, 0L);

    Entry previous = entries.get(code);
    WriteOutcome outcome;
    if (previous == null) {
      entries.put(code, fresh);
      outcome = WriteOutcome.INSERTED;
    } else {
      // overwrite: the previous entry's hits are dropped with it
      entries.put(code, fresh);
      outcome = WriteOutcome.REPLACED;
      LOGGER.debug("Replacing entry {} (had {} hits)", code, previous.hits);
    }

    try {
      flush();
    } catch (StoreUnavailableException e) {
      if (previous == null) {
        entries.remove(code);
      } else {
        entries.put(code, previous);
      }
      throw e;
    }
    return outcome;
  }

  @Override
  public synchronized Optional<Entry> get(String code) {
    Entry e = entries.get(code);
    return (e == null) ? Optional.empty() : Optional.of(e.copy());
  }

  @Override
  public synchronized boolean incrementHits(String code) {
    Entry e = entries.get(code);
    if (e == null) return false;
    e.hits++;
    try {
      flush();
    } catch (StoreUnavailableException ex) {
      e.hits--;
      throw ex;
    }
    return true;
  }

  @Override
  public synchronized List<Entry> findExpired(long nowEpochSec, long ttlSeconds) {
    List<Entry> out = new ArrayList<>();
    for (Entry e : entries.values()) {
      if (nowEpochSec - e.createdAt > ttlSeconds) out.add(e.copy());
    }
    return out;
  }

  @Override
  public synchronized boolean delete(String code) {
    Entry removed = entries.remove(code);
    if (removed == null) return false;
    try {
      flush();
    } catch (StoreUnavailableException e) {
      entries.put(code, removed);
      throw e;
    }
    return true;
  }

  @Override
  public synchronized boolean deleteIfExpired(String code, long nowEpochSec, long ttlSeconds) {
    Entry e = entries.get(code);
    if (e == null || nowEpochSec - e.createdAt <= ttlSeconds) return false;
    return delete(code);
  }

  @Override
  public synchronized List<Entry> list(String filter) {
    String q = (filter == null) ? "" : filter.trim();
    return entries.values().stream()
        .filter(e -> q.isEmpty() || contains(e.code, q) || contains(e.target, q))
        .sorted(NEWEST_FIRST)
        .map(Entry::copy)
        .collect(Collectors.toList());
  }

  /**
   * Number of stored entries, expired ones included.
   *
   * @return entry count
   */
  public synchronized int size() {
    return entries.size();
  }

  private static boolean contains(String value, String q) {
    return value != null && value.contains(q);
  }

  /** Writes the current map to disk; caller holds the lock. */
  private void flush() {
    try {
      JsonFiles.writeAtomic(file, new ArrayList<>(entries.values()));
    } catch (IOException e) {
      throw new StoreUnavailableException("Failed to write mapping store " + file, e);
    }
  }
}
