package org.example.shortdrop.storage;

import java.util.List;
import java.util.Optional;
import org.example.shortdrop.model.Entry;
import org.example.shortdrop.model.WriteOutcome;

/**
 * Concurrency-safe table of {@link Entry} records keyed by short code.
 *
 * <p>All operations may be called concurrently from request threads and the reaper. Each one is
 * atomic for a single entry: no lost updates, and no reader ever observes a half-written entry.
 * Returned entries are detached snapshots.
 *
 * <p>TTL is not evaluated here except by {@link #findExpired(long, long)}; {@link #get(String)}
 * returns expired rows too and leaves the decision to the caller.
 *
 * <p>Implementations throw {@link StoreUnavailableException} when the backing storage fails.
 */
public interface MappingStore {

  /**
   * Stores a fresh entry for {@code code} with {@code createdAt = now} and {@code hits = 0},
   * replacing any existing entry for the same code. The replaced entry's hit count is discarded.
   *
   * @param code short code; passed through as-is
   * @param target redirect URL or artifact reference
   * @return whether a new entry was inserted or an existing one replaced
   */
  WriteOutcome createOrReplace(String code, String target);

  /**
   * @param code short code
   * @return snapshot of the entry regardless of TTL, or empty if absent
   */
  Optional<Entry> get(String code);

  /**
   * Atomically adds one to the entry's hit count.
   *
   * @param code short code
   * @return {@code true} if the entry existed and was incremented
   */
  boolean incrementHits(String code);

  /**
   * Returns all entries for which {@code nowEpochSec - createdAt > ttlSeconds}. Order is
   * unspecified.
   *
   * @param nowEpochSec current time, seconds since the epoch
   * @param ttlSeconds time-to-live in seconds
   * @return snapshots of expired entries
   */
  List<Entry> findExpired(long nowEpochSec, long ttlSeconds);

  /**
   * Removes the entry for {@code code}. Deleting an absent code is not an error.
   *
   * @param code short code
   * @return {@code true} if an entry was removed
   */
  boolean delete(String code);

  /**
   * Removes the entry for {@code code} only if it is still expired at {@code nowEpochSec}. Used
   * by the reaper so that an entry replaced after the expiry query is not deleted.
   *
   * @param code short code
   * @param nowEpochSec current time, seconds since the epoch
   * @param ttlSeconds time-to-live in seconds
   * @return {@code true} if an expired entry was removed
   */
  boolean deleteIfExpired(String code, long nowEpochSec, long ttlSeconds);

  /**
   * Lists entries newest first. A non-blank {@code filter} keeps entries whose code or target
   * contains it.
   *
   * @param filter substring to match, or {@code null}/blank for all entries
   * @return snapshots ordered by {@code createdAt} descending
   */
  List<Entry> list(String filter);
}
