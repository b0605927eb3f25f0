package com.scholary.segmenter.export;

import com.scholary.segmenter.model.UtteranceSpan;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes supervisions as an STM reference transcript.
 *
 * <p>Format, one line per utterance and channel:
 *
 * <pre>
 * rec1 1 spkA 0.000 5.200 hello world
 * rec1 1 spkB 4.100 7.000 hi there
 * </pre>
 *
 * <p>Lines are sorted by recording, channel and start time. Scoring tools such as sclite and
 * meeteval read this format directly.
 */
@Component
public class StmWriter {

  private static final Logger LOGGER = LoggerFactory.getLogger(StmWriter.class);

  static final int DEFAULT_CHANNEL = 1;

  private static final Comparator<StmLine> ORDER =
      Comparator.comparing(StmLine::recordingId)
          .thenComparingInt(StmLine::channel)
          .thenComparingDouble(StmLine::start);

  public String render(List<RecordingSupervision> supervisions) {
    List<StmLine> lines = new ArrayList<>();
    for (RecordingSupervision supervision : supervisions) {
      String recordingId =
          supervision.recordingId() != null ? supervision.recordingId() : supervision.id();
      String speaker =
          supervision.speakerId() == null || supervision.speakerId().isBlank()
              ? UtteranceSpan.UNKNOWN_SPEAKER
              : supervision.speakerId();
      List<Integer> channels =
          supervision.channels().isEmpty() ? List.of(DEFAULT_CHANNEL) : supervision.channels();
      for (int channel : channels) {
        lines.add(
            new StmLine(
                recordingId,
                channel,
                speaker,
                supervision.start(),
                supervision.end(),
                sanitize(supervision.text())));
      }
    }
    lines.sort(ORDER);

    StringBuilder stm = new StringBuilder();
    for (StmLine line : lines) {
      stm.append(line.format()).append("\n");
    }
    return stm.toString();
  }

  public void write(List<RecordingSupervision> supervisions, Path path) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.writeString(path, render(supervisions), StandardCharsets.UTF_8);
    LOGGER.info("Wrote STM for {} supervisions to {}", supervisions.size(), path);
  }

  /** Collapse tabs, newlines and repeated spaces into single spaces. */
  static String sanitize(String text) {
    if (text == null || text.isBlank()) {
      return "";
    }
    return String.join(" ", text.trim().split("\\s+"));
  }

  private record StmLine(
      String recordingId, int channel, String speaker, double start, double end, String text) {

    String format() {
      return String.format(
          Locale.ROOT, "%s %d %s %.3f %.3f %s", recordingId, channel, speaker, start, end, text);
    }
  }
}
