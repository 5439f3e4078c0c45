package org.example.shortdrop.util;

/**
 * Fixed time-to-live rule shared by the lookup path and the reaper.
 *
 * <p>An entry is expired when strictly more than {@code ttlSeconds} have elapsed since it was
 * created: {@code now - createdAt > ttl}. At exactly {@code createdAt + ttl} the entry is still
 * live.
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class TtlPolicy {

  /** Default lifetime of an entry: 10 minutes. */
  public static final long DEFAULT_TTL_SECONDS = 10 * 60;

  private final long ttlSeconds;

  /**
   * @param ttlSeconds lifetime in seconds; must not be negative
   * @throws IllegalArgumentException if {@code ttlSeconds < 0}
   */
  public TtlPolicy(long ttlSeconds) {
    if (ttlSeconds < 0) {
      throw new IllegalArgumentException("ttlSeconds must not be negative: " + ttlSeconds);
    }
    this.ttlSeconds = ttlSeconds;
  }

  public long ttlSeconds() {
    return ttlSeconds;
  }

  /**
   * Returns {@code true} if an entry created at {@code createdAt} is past its TTL at {@code now}.
   *
   * @param nowEpochSec current time, seconds since the epoch
   * @param createdAt creation time, seconds since the epoch
   * @return {@code now - createdAt > ttl}
   */
  public boolean isExpired(long nowEpochSec, long createdAt) {
    return nowEpochSec - createdAt > ttlSeconds;
  }

  /**
   * Seconds remaining before expiry, clamped at zero.
   *
   * @param nowEpochSec current time, seconds since the epoch
   * @param createdAt creation time, seconds since the epoch
   * @return {@code max(0, ttl - (now - createdAt))}
   */
  public long secondsLeft(long nowEpochSec, long createdAt) {
    return Math.max(0L, ttlSeconds - (nowEpochSec - createdAt));
  }
}
