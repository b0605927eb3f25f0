package com.scholary.segmenter.manifest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.scholary.segmenter.export.RecordingSupervision;
import com.scholary.segmenter.model.RecordingSegment;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes recording segments as a cut manifest, in the format given by the file name.
 *
 * <p>JSON Lines output holds one compact object per line; {@code .json} output is a pretty printed
 * array. Parent directories are created as needed.
 */
@Component
public class ManifestWriter {

  private static final Logger LOGGER = LoggerFactory.getLogger(ManifestWriter.class);

  private final ObjectMapper objectMapper;
  private final ManifestMapper mapper;

  public ManifestWriter(ObjectMapper objectMapper, ManifestMapper mapper) {
    this.objectMapper = objectMapper;
    this.mapper = mapper;
  }

  public void write(List<RecordingSegment> segments, Path path) {
    writeEntries(segments.stream().map(mapper::toManifest).toList(), path);
    LOGGER.info("Wrote {} segments to {}", segments.size(), path);
  }

  /** Write a supervision manifest, one entry per utterance on the recording timeline. */
  public void writeSupervisions(List<RecordingSupervision> supervisions, Path path) {
    writeEntries(supervisions.stream().map(mapper::toManifest).toList(), path);
    LOGGER.info("Wrote {} supervisions to {}", supervisions.size(), path);
  }

  private void writeEntries(List<?> entries, Path path) {
    ManifestFormat format = ManifestFormat.of(path);
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      try (Writer writer = open(path)) {
        if (format == ManifestFormat.JSON_ARRAY) {
          objectMapper.writerWithDefaultPrettyPrinter().writeValue(writer, entries);
        } else {
          ObjectWriter lineWriter = objectMapper.writer();
          for (Object entry : entries) {
            writer.write(lineWriter.writeValueAsString(entry));
            writer.write('\n');
          }
        }
      }
    } catch (IOException e) {
      throw new ManifestException("Failed to write manifest " + path, e);
    }
  }

  private Writer open(Path path) throws IOException {
    OutputStream out = Files.newOutputStream(path);
    if (ManifestFormat.isGzipped(path)) {
      out = new GZIPOutputStream(out);
    }
    return new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
  }
}
