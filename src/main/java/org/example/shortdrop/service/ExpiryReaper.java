package org.example.shortdrop.service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.example.shortdrop.model.Entry;
import org.example.shortdrop.storage.ArtifactStore;
import org.example.shortdrop.storage.MappingStore;
import org.example.shortdrop.storage.StoreUnavailableException;
import org.example.shortdrop.util.TtlPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background task that physically removes expired entries and their file artifacts.
 *
 * <p>Lookups already refuse expired entries on their own; the reaper makes sure those entries and
 * their uploaded files do not linger forever when nobody asks for them again.
 *
 * <h2>Sweep</h2>
 *
 * <ol>
 *   <li>Compute {@code now} and query {@link MappingStore#findExpired(long, long)}.
 *   <li>For an artifact target, ask the {@link ArtifactStore} to remove the file. Failures are
 *       logged and counted, and never block the entry's deletion.
 *   <li>Delete the entry with {@link MappingStore#deleteIfExpired(String, long, long)}, so an
 *       entry replaced after the query survives.
 * </ol>
 *
 * <p>A failed delete of a single entry is logged and the sweep moves on. {@link
 * StoreUnavailableException} aborts the sweep and propagates.
 *
 * <h2>Scheduling</h2>
 *
 * <p>{@link #start()} runs the sweep at a fixed rate on a single daemon thread named {@code
 * expiry-reaper}. An ordinary failure is logged and the next tick retries. A {@link
 * StoreUnavailableException} is recorded in {@link #fatalError()} and stops further ticks.
 *
 * <p>Sweeps never overlap: manual calls to {@link #sweep()} and scheduled ticks are serialized.
 */
public class ExpiryReaper {
  private static final Logger LOGGER = LoggerFactory.getLogger(ExpiryReaper.class);

  private final MappingStore store;
  private final ArtifactStore artifacts;
  private final TtlPolicy ttl;
  private final Clock clock;
  private final Duration interval;
  private final Object sweepLock = new Object();

  private ScheduledExecutorService scheduler;
  private volatile StoreUnavailableException fatal;

  /**
   * @param store mapping store to prune
   * @param artifacts file store for artifact targets
   * @param ttl expiry rule
   * @param clock time source
   * @param interval period between scheduled sweeps; must be positive
   */
  public ExpiryReaper(
      MappingStore store, ArtifactStore artifacts, TtlPolicy ttl, Clock clock, Duration interval) {
    this.store = Objects.requireNonNull(store, "store");
    this.artifacts = Objects.requireNonNull(artifacts, "artifacts");
    this.ttl = Objects.requireNonNull(ttl, "ttl");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.interval = Objects.requireNonNull(interval, "interval");
    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("interval must be positive, got: " + interval);
    }
  }

  /**
   * Starts periodic sweeping. The first sweep runs one interval after this call.
   *
   * @throws IllegalStateException if already started
   */
  public synchronized void start() {
    if (scheduler != null) {
      throw new IllegalStateException("Reaper already started");
    }
    scheduler =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, "expiry-reaper");
              t.setDaemon(true);
              return t;
            });
    long millis = interval.toMillis();
    scheduler.scheduleAtFixedRate(this::tick, millis, millis, TimeUnit.MILLISECONDS);
    LOGGER.info("Expiry reaper started (ttl={}s, interval={})", ttl.ttlSeconds(), interval);
  }

  /** Stops periodic sweeping. Safe to call more than once. */
  public synchronized void stop() {
    if (scheduler == null) return;
    scheduler.shutdownNow();
    try {
      if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
        LOGGER.warn("Expiry reaper did not terminate in time");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    scheduler = null;
    LOGGER.info("Expiry reaper stopped");
  }

  /**
   * @return {@code true} while scheduled sweeping is active and no fatal error has occurred
   */
  public synchronized boolean isRunning() {
    return scheduler != null && !scheduler.isShutdown() && fatal == null;
  }

  /**
   * @return the store failure that stopped scheduled sweeping, or {@code null}
   */
  public StoreUnavailableException fatalError() {
    return fatal;
  }

  /**
   * Runs one sweep now.
   *
   * @return what was found and removed
   * @throws StoreUnavailableException if the store fails as a whole
   */
  public SweepReport sweep() {
    synchronized (sweepLock) {
      long now = clock.instant().getEpochSecond();
      List<Entry> expired = store.findExpired(now, ttl.ttlSeconds());
      SweepReport report = new SweepReport();
      report.expired = expired.size();

      for (Entry e : expired) {
        if (e.isArtifact()) {
          report.artifactsAttempted++;
          removeArtifact(e, report);
        }
        try {
          if (store.deleteIfExpired(e.code, now, ttl.ttlSeconds())) {
            report.deleted++;
            LOGGER.debug("Reaped {} -> {}", e.code, e.target);
          }
        } catch (StoreUnavailableException ex) {
          throw ex;
        } catch (RuntimeException ex) {
          report.deleteFailures++;
          LOGGER.warn("Failed to delete expired entry {}: {}", e.code, ex.getMessage());
        }
      }
      return report;
    }
  }

  private void removeArtifact(Entry e, SweepReport report) {
    try {
      artifacts.remove(e.target);
    } catch (IOException | RuntimeException ex) {
      report.artifactFailures++;
      LOGGER.warn("Could not remove artifact {} of {}: {}", e.target, e.code, ex.getMessage());
    }
  }

  private void tick() {
    try {
      SweepReport report = sweep();
      if (report.isEmpty()) {
        LOGGER.debug("Sweep found nothing expired");
      } else {
        LOGGER.info("Sweep: {}", report);
      }
    } catch (StoreUnavailableException e) {
      fatal = e;
      LOGGER.error("Mapping store unavailable; expiry reaper stops", e);
      throw e;
    } catch (RuntimeException e) {
      LOGGER.error("Sweep failed, retrying on next tick", e);
    }
  }
}
