package org.example.shortdrop.storage;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.Objects;
import org.example.shortdrop.util.JsonUtils;

/**
 * Minimal JSON persistence helper for small file-backed stores.
 *
 * <p>This utility provides two operations:
 *
 * <ul>
 *   <li>{@link #readOrCreate(Path, Type, Object)} – read JSON into a model type, creating the file
 *       with the provided default value when it doesn't exist.
 *   <li>{@link #writeAtomic(Path, Object)} – write a value as JSON to a temporary file and then
 *       atomically move it into place, so readers of the file never see a partial write.
 * </ul>
 *
 * <p>Unlike a best-effort loader, malformed content is reported as an {@link IOException}: a
 * store must not silently start empty on top of a file it failed to parse.
 *
 * <p>All file I/O is performed with UTF-8 encoding. Parent directories are created as needed.
 *
 * <p><b>Thread-safety:</b> this class is stateless; callers must synchronize writes to the same
 * path.
 */
final class JsonFiles {
  private JsonFiles() {}

  private static final Gson GSON = JsonUtils.gson();

  /**
   * Reads JSON from {@code path} into an object of type {@code typeOfT}. If the file does not
   * exist, it is created with {@code defaultValue} and {@code defaultValue} is returned. An empty
   * file (parsing yields {@code null}) also yields {@code defaultValue}.
   *
   * @param path the file to read
   * @param typeOfT the target type token
   * @param defaultValue value used for a missing or empty file
   * @param <T> the result type
   * @return the parsed value, or {@code defaultValue}
   * @throws IOException if the file cannot be read or created, or contains malformed JSON
   */
  static <T> T readOrCreate(Path path, Type typeOfT, T defaultValue) throws IOException {
    if (Files.exists(path)) {
      try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        T data = GSON.fromJson(br, typeOfT);
        return (data != null) ? data : defaultValue;
      } catch (JsonParseException e) {
        throw new IOException("Malformed JSON in " + path + ": " + e.getMessage(), e);
      }
    }
    writeAtomic(path, defaultValue);
    return defaultValue;
  }

  /**
   * Writes {@code value} as JSON to {@code target} using an atomic replace strategy.
   *
   * <p>The JSON is written to {@code .<filename>.tmp} in the same directory and then moved over
   * the target with {@link StandardCopyOption#ATOMIC_MOVE} and {@link
   * StandardCopyOption#REPLACE_EXISTING}.
   *
   * @param target destination file to write
   * @param value the object to serialize as JSON
   * @throws IOException if the target has no parent, or if the write/move operation fails
   */
  static void writeAtomic(Path target, Object value) throws IOException {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(value, "value");

    Path absolute = target.toAbsolutePath();
    Path parent = absolute.getParent();
    if (parent == null) {
      throw new IOException("Target path has no parent directory: " + target);
    }
    Files.createDirectories(parent);

    Path fn = absolute.getFileName();
    String baseName = (fn != null) ? fn.toString() : "data";
    Path tmp = parent.resolve("." + baseName + ".tmp");

    try (BufferedWriter bw =
        Files.newBufferedWriter(
            tmp,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE)) {
      GSON.toJson(value, bw);
    }

    Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
  }
}
