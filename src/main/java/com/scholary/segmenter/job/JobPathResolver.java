package com.scholary.segmenter.job;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Resolves manifest paths named by job requests.
 *
 * <p>Paths are taken relative to {@code jobstore.baseDir} and normalized. A path that lands
 * outside the base directory is rejected.
 */
@Component
public class JobPathResolver {

  private final Path baseDir;

  public JobPathResolver(@Value("${jobstore.baseDir}") String baseDir) {
    this.baseDir = Path.of(baseDir).toAbsolutePath().normalize();
  }

  public Path resolve(String path) {
    if (path == null || path.isBlank()) {
      throw new JobPathException("Job path must not be empty");
    }
    Path resolved;
    try {
      resolved = baseDir.resolve(path).normalize();
    } catch (InvalidPathException e) {
      throw new JobPathException("Invalid job path: " + path, e);
    }
    if (!resolved.startsWith(baseDir)) {
      throw new JobPathException("Job path is outside the job directory: " + path);
    }
    return resolved;
  }

  public Path getBaseDir() {
    return baseDir;
  }
}
