package org.example.shortdrop.model;

/**
 * A single code-to-target mapping held by the mapping store.
 *
 * <p>An {@code Entry} binds a short code either to a redirect URL or to an uploaded file
 * ("drop"), records when it was created and counts successful lookups.
 *
 * <p>All fields are public to keep JSON serialization free of boilerplate. The store never hands
 * out its own instances: callers always receive a {@link #copy()}, so mutating a returned entry
 * has no effect on stored state.
 *
 * <h2>Fields overview</h2>
 *
 * <ul>
 *   <li>{@code code} – unique key, immutable once stored.
 *   <li>{@code target} – redirect URL, or an artifact reference starting with {@link
 *       #ARTIFACT_PREFIX}.
 *   <li>{@code createdAt} – creation time in seconds since the epoch.
 *   <li>{@code hits} – number of successful lookups; starts at 0 and only grows.
 * </ul>
 *
 * @since 1.0
 */
public class Entry {

  /** Prefix that marks a target as a stored file rather than a redirect URL. */
  public static final String ARTIFACT_PREFIX = "/uploads/";

  /** Short code used as the primary key. */
  public String code;

  /** Redirect URL (absolute or relative) or artifact reference. */
  public String target;

  /** Creation timestamp, seconds since the epoch. */
  public long createdAt;

  /** Successful lookup count. */
  public long hits;

  public Entry() {}

  public Entry(String code, String target, long createdAt, long hits) {
    this.code = code;
    this.target = target;
    this.createdAt = createdAt;
    this.hits = hits;
  }

  /**
   * Returns {@code true} if the target refers to a stored file artifact.
   *
   * @return whether {@link #target} starts with {@link #ARTIFACT_PREFIX}
   */
  public boolean isArtifact() {
    return isArtifactTarget(target);
  }

  /**
   * Checks whether an arbitrary target string is an artifact reference.
   *
   * @param target target string, may be {@code null}
   * @return {@code true} for {@code /uploads/...} targets
   */
  public static boolean isArtifactTarget(String target) {
    return target != null && target.startsWith(ARTIFACT_PREFIX);
  }

  /**
   * Creates a detached copy of this entry.
   *
   * @return new instance with the same field values
   */
  public Entry copy() {
    return new Entry(code, target, createdAt, hits);
  }

  @Override
  public String toString() {
    return "Entry{code='"
        + code
        + "', target='"
        + target
        + "', createdAt="
        + createdAt
        + ", hits="
        + hits
        + '}';
  }
}
