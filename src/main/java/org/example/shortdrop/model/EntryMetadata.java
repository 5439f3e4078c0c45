package org.example.shortdrop.model;

import com.google.gson.annotations.SerializedName;

/**
 * Read-only view of an entry as exposed by the metadata endpoint and the console.
 *
 * <p>Serialized with snake_case keys: {@code target}, {@code created_at}, {@code expires_in},
 * {@code hits}.
 */
public class EntryMetadata {
  public String target;

  @SerializedName("created_at")
  public long createdAt;

  /** Seconds until expiry, never negative. */
  @SerializedName("expires_in")
  public long expiresIn;

  public long hits;
}
