package org.example.shortdrop.storage;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Storage for uploaded files referenced by entries.
 *
 * <p>Only the creation path writes artifacts and only the reaper removes them. Stored names are
 * made unique by a creation-timestamp prefix, so no two writers touch the same path.
 */
public interface ArtifactStore {

  /**
   * Stores {@code content} under a unique name derived from {@code originalName}.
   *
   * @param originalName client-supplied file name; sanitized before use
   * @param content bytes to store; not closed by this method
   * @return artifact reference to use as an entry target ({@code /uploads/<stored-name>})
   * @throws IOException if the file cannot be written
   */
  String save(String originalName, InputStream content) throws IOException;

  /**
   * Removes the artifact referenced by {@code target}. An already-missing file is not an error.
   *
   * @param target artifact reference
   * @throws IOException if the reference is invalid or the file exists but cannot be deleted
   */
  void remove(String target) throws IOException;

  /**
   * Maps an artifact reference to the stored file.
   *
   * @param target artifact reference
   * @return path inside the store, or empty if {@code target} is not a valid reference
   */
  Optional<Path> resolve(String target);
}
