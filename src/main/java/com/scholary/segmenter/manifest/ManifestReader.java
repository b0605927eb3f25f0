package com.scholary.segmenter.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.segmenter.model.RecordingSegment;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads cut manifests into recording segments.
 *
 * <p>Supports JSON Lines ({@code .jsonl}), a JSON array ({@code .json}) and the gzip-compressed
 * variants of both. Segment order follows the file.
 */
@Component
public class ManifestReader {

  private static final Logger LOGGER = LoggerFactory.getLogger(ManifestReader.class);

  private final ObjectMapper objectMapper;
  private final ManifestMapper mapper;

  public ManifestReader(ObjectMapper objectMapper, ManifestMapper mapper) {
    this.objectMapper = objectMapper;
    this.mapper = mapper;
  }

  public List<RecordingSegment> read(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new ManifestException("Manifest not found: " + path);
    }
    ManifestFormat format = ManifestFormat.of(path);
    try (InputStream in = open(path)) {
      List<CutManifest> cuts =
          format == ManifestFormat.JSON_ARRAY ? readArray(in, path) : readLines(in, path);
      List<RecordingSegment> segments = new ArrayList<>(cuts.size());
      for (CutManifest cut : cuts) {
        segments.add(mapper.toSegment(cut));
      }
      LOGGER.info("Read {} segments from {} ({})", segments.size(), path, format);
      return segments;
    } catch (IOException e) {
      throw new ManifestException("Failed to read manifest " + path, e);
    }
  }

  private InputStream open(Path path) throws IOException {
    InputStream in = Files.newInputStream(path);
    return ManifestFormat.isGzipped(path) ? new GZIPInputStream(in) : in;
  }

  private List<CutManifest> readArray(InputStream in, Path path) throws IOException {
    try {
      List<CutManifest> cuts =
          objectMapper.readValue(in, new TypeReference<List<CutManifest>>() {});
      return cuts == null ? List.of() : cuts;
    } catch (JsonProcessingException e) {
      throw new ManifestException("Malformed manifest " + path + ": " + e.getOriginalMessage(), e);
    }
  }

  private List<CutManifest> readLines(InputStream in, Path path) throws IOException {
    List<CutManifest> cuts = new ArrayList<>();
    BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    String line;
    int lineNumber = 0;
    while ((line = reader.readLine()) != null) {
      lineNumber++;
      if (line.isBlank()) {
        continue;
      }
      try {
        cuts.add(objectMapper.readValue(line, CutManifest.class));
      } catch (JsonProcessingException e) {
        throw new ManifestException(
            "Malformed manifest " + path + " at line " + lineNumber + ": " + e.getOriginalMessage(),
            e);
      }
    }
    return cuts;
  }
}
