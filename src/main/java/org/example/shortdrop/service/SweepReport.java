package org.example.shortdrop.service;

/**
 * Summary of one reaper sweep.
 *
 * <p>{@code artifactFailures} and {@code deleteFailures} count per-entry problems that were
 * logged and absorbed without aborting the sweep.
 */
public class SweepReport {
  /** Entries returned by the expiry query. */
  public int expired;

  /** Entries actually removed from the store. */
  public int deleted;

  /** Artifact files whose removal was attempted. */
  public int artifactsAttempted;

  /** Artifact removals that failed. */
  public int artifactFailures;

  /** Store deletes that failed for a single entry. */
  public int deleteFailures;

  public boolean isEmpty() {
    return expired == 0;
  }

  @Override
  public String toString() {
    return "expired="
        + expired
        + ", deleted="
        + deleted
        + ", artifacts="
        + artifactsAttempted
        + " (failed "
        + artifactFailures
        + "), deleteFailures="
        + deleteFailures;
  }
}
