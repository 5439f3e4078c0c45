package org.example.shortdrop.model;

/**
 * Result of a create-or-replace write.
 *
 * <ul>
 *   <li>{@code INSERTED} – no entry existed for the code; a new one was stored.
 *   <li>{@code REPLACED} – an entry existed and was overwritten; its hit count was discarded.
 * </ul>
 */
public enum WriteOutcome {
  INSERTED,
  REPLACED
}
