package com.scholary.segmenter.manifest;

import java.nio.file.Path;
import java.util.Locale;

/** On-disk layout of a manifest, derived from its file name. */
public enum ManifestFormat {
  JSON_LINES,
  JSON_ARRAY;

  public static ManifestFormat of(Path path) {
    String name = stripGzip(path.getFileName().toString().toLowerCase(Locale.ROOT));
    return name.endsWith(".json") ? JSON_ARRAY : JSON_LINES;
  }

  public static boolean isGzipped(Path path) {
    return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".gz");
  }

  private static String stripGzip(String name) {
    return name.endsWith(".gz") ? name.substring(0, name.length() - 3) : name;
  }
}
