package org.example.shortdrop.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * JSON utilities for the application.
 *
 * <p>Two shared {@link Gson} configurations are provided:
 *
 * <ul>
 *   <li>{@link #gson()} – pretty printed, used for files on disk (store, config);
 *   <li>{@link #compact()} – single line, used for HTTP response bodies.
 * </ul>
 *
 * <p>HTML escaping is disabled in both so that targets such as {@code https://x/?a=1&b=2} stay
 * readable in the stored file.
 *
 * <p><b>Thread safety:</b> {@link Gson} instances are thread-safe after construction and can be
 * reused across the application.
 */
public final class JsonUtils {
  private JsonUtils() {}

  private static final Gson PRETTY =
      new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

  private static final Gson COMPACT = new GsonBuilder().disableHtmlEscaping().create();

  /**
   * Returns the pretty-printing {@link Gson} used for persisted files.
   *
   * @return shared instance
   */
  public static Gson gson() {
    return PRETTY;
  }

  /**
   * Returns the compact {@link Gson} used for wire responses.
   *
   * @return shared instance
   */
  public static Gson compact() {
    return COMPACT;
  }
}
