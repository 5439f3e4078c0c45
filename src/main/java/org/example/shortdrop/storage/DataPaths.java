package org.example.shortdrop.storage;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Default file-system locations, relative to the working directory.
 *
 * <ul>
 *   <li>{@link #DATA_DIR} – root data folder.
 *   <li>{@link #CONFIG_JSON} – application configuration.
 *   <li>{@link #URLS_JSON} – mapping store file.
 *   <li>{@link #UPLOAD_DIR} – uploaded file artifacts.
 * </ul>
 *
 * <p>The store and upload locations can be overridden in {@code config.json}.
 */
public final class DataPaths {
  private DataPaths() {}

  /** Root directory for application data files: {@code data/}. */
  public static final Path DATA_DIR = Paths.get("data");

  /** Configuration file: {@code data/config.json}. */
  public static final Path CONFIG_JSON = DATA_DIR.resolve("config.json");

  /** Mapping store file: {@code data/urls.json}. */
  public static final Path URLS_JSON = DATA_DIR.resolve("urls.json");

  /** Upload directory: {@code static/uploads}. */
  public static final Path UPLOAD_DIR = Paths.get("static", "uploads");
}
