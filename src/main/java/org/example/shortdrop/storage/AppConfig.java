package org.example.shortdrop.storage;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import org.example.shortdrop.util.JsonUtils;
import org.example.shortdrop.util.TtlPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application configuration holder with load helpers.
 *
 * <p>All tunable parameters live here and are read from a JSON file, {@code data/config.json} by
 * default. If the file is missing it is created with defaults. If it is unreadable or malformed,
 * in-memory defaults are used and a warning is logged. A field whose value is out of range is
 * reset to its default the same way, so a bad config never stops the process.
 *
 * <p>Fields missing from the file keep their default values.
 *
 * <p><b>Typical usage:</b>
 *
 * <pre>{@code
 * AppConfig cfg = AppConfig.loadOrCreateDefault();
 * TtlPolicy ttl = cfg.ttlPolicy();
 * }</pre>
 */
public class AppConfig {
  private static final Logger LOGGER = LoggerFactory.getLogger(AppConfig.class);

  /** Prefix used when printing short links. */
  public String baseUrl = "http://localhost:5050/";

  /** Port of the redirect HTTP server; {@code 0} picks a free port. */
  public int port = 5050;

  /** Length of generated codes. */
  public int codeLength = 6;

  /** Lifetime of every entry, in seconds. */
  public long ttlSeconds = TtlPolicy.DEFAULT_TTL_SECONDS;

  /** Period of the background reaper, in seconds. */
  public long sweepIntervalSeconds = 60;

  /** Mapping store file. */
  public String dataFile = DataPaths.URLS_JSON.toString();

  /** Directory for uploaded files. */
  public String uploadDir = DataPaths.UPLOAD_DIR.toString();

  private static final Gson GSON = JsonUtils.gson();

  /**
   * Loads configuration from {@link DataPaths#CONFIG_JSON}, creating it with defaults if missing.
   *
   * @return a non-null configuration
   */
  public static AppConfig loadOrCreateDefault() {
    return load(DataPaths.CONFIG_JSON);
  }

  /**
   * Loads configuration from {@code path}, creating it with defaults if missing.
   *
   * <p>On any read or parse failure the defaults are returned and the cause is logged.
   *
   * @param path configuration file
   * @return a non-null configuration
   */
  public static AppConfig load(Path path) {
    try {
      if (Files.exists(path)) {
        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
          AppConfig cfg = GSON.fromJson(br, AppConfig.class);
          return (cfg != null) ? cfg.sanitized(path) : new AppConfig();
        }
      }
      AppConfig def = new AppConfig();
      JsonFiles.writeAtomic(path, def);
      return def;
    } catch (IOException | JsonParseException e) {
      LOGGER.warn("Failed to load {}, using in-memory defaults. Cause: {}", path, e.getMessage());
      return new AppConfig();
    }
  }

  /**
   * Resets every out-of-range or missing field to its default, logging each reset.
   *
   * @param source file the values came from, for the log message
   * @return this instance
   */
  AppConfig sanitized(Path source) {
    AppConfig def = new AppConfig();
    if (baseUrl == null) {
      baseUrl = reset(source, "baseUrl", null, def.baseUrl);
    }
    if (port < 0 || port > 65535) {
      port = reset(source, "port", port, def.port);
    }
    if (codeLength < 1) {
      codeLength = reset(source, "codeLength", codeLength, def.codeLength);
    }
    if (ttlSeconds < 0) {
      ttlSeconds = reset(source, "ttlSeconds", ttlSeconds, def.ttlSeconds);
    }
    if (sweepIntervalSeconds < 1) {
      sweepIntervalSeconds =
          reset(source, "sweepIntervalSeconds", sweepIntervalSeconds, def.sweepIntervalSeconds);
    }
    if (dataFile == null || dataFile.isBlank()) {
      dataFile = reset(source, "dataFile", dataFile, def.dataFile);
    }
    if (uploadDir == null || uploadDir.isBlank()) {
      uploadDir = reset(source, "uploadDir", uploadDir, def.uploadDir);
    }
    return this;
  }

  private static <T> T reset(Path source, String field, Object bad, T fallback) {
    LOGGER.warn("Invalid {} in {}: {}. Using default {}", field, source, bad, fallback);
    return fallback;
  }

  public TtlPolicy ttlPolicy() {
    return new TtlPolicy(ttlSeconds);
  }

  public Path dataFilePath() {
    return Paths.get(dataFile);
  }

  public Path uploadDirPath() {
    return Paths.get(uploadDir);
  }
}
