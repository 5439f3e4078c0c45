package org.example.shortdrop.model;

import java.util.Objects;

/**
 * Outcome of resolving a short code on the redirect path.
 *
 * <p>Exactly one of three shapes is possible:
 *
 * <ul>
 *   <li>{@link Outcome#TARGET} – the entry is live; {@link #target()} holds the redirect URL or
 *       artifact reference.
 *   <li>{@link Outcome#EXPIRED} – the entry still exists but its TTL has passed.
 *   <li>{@link Outcome#NOT_FOUND} – no entry exists for the code.
 * </ul>
 *
 * <p>NotFound and Expired are ordinary values, not exceptions. Callers that care map them to
 * different responses (for example HTTP 404 vs 410).
 */
public final class LookupResult {

  /** Lookup outcome category. */
  public enum Outcome {
    TARGET,
    EXPIRED,
    NOT_FOUND
  }

  private static final LookupResult EXPIRED = new LookupResult(Outcome.EXPIRED, null);
  private static final LookupResult NOT_FOUND = new LookupResult(Outcome.NOT_FOUND, null);

  private final Outcome outcome;
  private final String target;

  private LookupResult(Outcome outcome, String target) {
    this.outcome = outcome;
    this.target = target;
  }

  public static LookupResult target(String target) {
    return new LookupResult(Outcome.TARGET, Objects.requireNonNull(target, "target"));
  }

  public static LookupResult expired() {
    return EXPIRED;
  }

  public static LookupResult notFound() {
    return NOT_FOUND;
  }

  public Outcome outcome() {
    return outcome;
  }

  /**
   * Returns the resolved target.
   *
   * @return target string for {@link Outcome#TARGET}; {@code null} otherwise
   */
  public String target() {
    return target;
  }

  public boolean isTarget() {
    return outcome == Outcome.TARGET;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof LookupResult)) return false;
    LookupResult that = (LookupResult) o;
    return outcome == that.outcome && Objects.equals(target, that.target);
  }

  @Override
  public int hashCode() {
    return Objects.hash(outcome, target);
  }

  @Override
  public String toString() {
    return outcome == Outcome.TARGET ? "Target(" + target + ")" : outcome.name();
  }
}
