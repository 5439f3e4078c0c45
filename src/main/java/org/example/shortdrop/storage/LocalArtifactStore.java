package org.example.shortdrop.storage;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import org.example.shortdrop.model.Entry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ArtifactStore} backed by a flat local directory.
 *
 * <p>Stored names have the form {@code <epochSec>_<sanitized-name>}. If that name is already
 * taken (two uploads of the same file within one second), a counter is inserted: {@code
 * <epochSec>_<n>_<sanitized-name>}.
 *
 * <p>A copy that fails part way deletes whatever was written before the exception propagates.
 *
 * <p>References are resolved strictly inside the upload directory; anything that would escape it
 * (separators, {@code ..}) is rejected.
 */
public class LocalArtifactStore implements ArtifactStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(LocalArtifactStore.class);

  private final Path uploadDir;
  private final Clock clock;

  /**
   * @param uploadDir directory holding the artifacts; created if missing
   * @param clock source of the timestamp prefix
   * @throws IOException if the directory cannot be created
   */
  public LocalArtifactStore(Path uploadDir, Clock clock) throws IOException {
    this.uploadDir = Objects.requireNonNull(uploadDir, "uploadDir").toAbsolutePath().normalize();
    this.clock = Objects.requireNonNull(clock, "clock");
    Files.createDirectories(this.uploadDir);
  }

  @Override
  public String save(String originalName, InputStream content) throws IOException {
    Objects.requireNonNull(content, "content");
    String safe = sanitizeFileName(originalName);
    long ts = clock.instant().getEpochSecond();

    String storedName = ts + "_" + safe;
    for (int n = 1; ; n++) {
      Path path = uploadDir.resolve(storedName);
      try {
        Files.copy(content, path);
        break;
      } catch (FileAlreadyExistsException e) {
        storedName = ts + "_" + n + "_" + safe;
      } catch (IOException e) {
        // no partial file may outlive a failed upload
        discardPartial(path, e);
        throw e;
      }
    }
    LOGGER.debug("Stored artifact {}", storedName);
    return Entry.ARTIFACT_PREFIX + storedName;
  }

  private static void discardPartial(Path path, IOException cause) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      cause.addSuppressed(e);
      LOGGER.warn("Could not delete partial upload {}: {}", path.getFileName(), e.getMessage());
    }
  }

  @Override
  public void remove(String target) throws IOException {
    Path path =
        resolve(target).orElseThrow(() -> new IOException("Not an artifact reference: " + target));
    if (Files.deleteIfExists(path)) {
      LOGGER.debug("Removed artifact {}", path.getFileName());
    }
  }

  @Override
  public Optional<Path> resolve(String target) {
    if (!Entry.isArtifactTarget(target)) return Optional.empty();
    String name = target.substring(Entry.ARTIFACT_PREFIX.length());
    if (name.isEmpty() || name.contains("/") || name.contains("\\") || name.equals("..")) {
      return Optional.empty();
    }
    Path path = uploadDir.resolve(name).normalize();
    if (!uploadDir.equals(path.getParent())) return Optional.empty();
    return Optional.of(path);
  }

  /**
   * Reduces a client-supplied file name to a safe single path segment.
   *
   * <p>Directory components are dropped, runs of characters outside {@code [A-Za-z0-9._-]} become
   * a single {@code _}, and leading/trailing dots and underscores are stripped. An empty result
   * becomes {@code "file"}.
   *
   * @param name original name, may be {@code null}
   * @return sanitized name, never empty
   */
  static String sanitizeFileName(String name) {
    if (name == null) return "file";
    String base = name.replace('\\', '/');
    base = base.substring(base.lastIndexOf('/') + 1).trim();
    String cleaned = base.replaceAll("[^A-Za-z0-9._-]+", "_").replaceAll("^[._]+|[._]+$", "");
    return cleaned.isEmpty() ? "file" : cleaned;
  }
}
