package com.scholary.segmenter.manifest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.segmenter.model.RecordingSegment;
import com.scholary.segmenter.model.UtteranceSpan;
import com.scholary.segmenter.model.Word;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.GZIPOutputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ManifestReaderTest {

  private static final String CUT =
      "{\"id\":\"cut1\",\"start\":100.0,\"duration\":20.0,\"recording_id\":\"rec1\","
          + "\"type\":\"MonoCut\",\"channel\":0,"
          + "\"supervisions\":[{\"id\":\"sup1\",\"recording_id\":\"rec1\",\"speaker\":\"A\","
          + "\"start\":2.0,\"duration\":3.0,\"text\":\"hello world\",\"language\":\"en\","
          + "\"alignment\":{\"word\":["
          + "{\"symbol\":\"hello\",\"start\":102.0,\"duration\":1.0},"
          + "[\"world\",103.0,2.0,0.9]]}}],"
          + "\"custom\":{\"dataset\":\"ami\",\"per_spk_flags\":{\"A\":true}}}";

  @TempDir Path tempDir;

  private ManifestReader reader;

  @BeforeEach
  void setUp() {
    reader = new ManifestReader(new ObjectMapper(), new ManifestMapper());
  }

  @Test
  void read_shouldParseJsonLinesWithSegmentRelativeWords() throws IOException {
    Path manifest = tempDir.resolve("cuts.jsonl");
    Files.writeString(manifest, CUT + "\n\n" + CUT.replace("cut1", "cut2") + "\n");

    List<RecordingSegment> segments = reader.read(manifest);

    assertThat(segments).extracting(RecordingSegment::id).containsExactly("cut1", "cut2");
    RecordingSegment segment = segments.get(0);
    assertThat(segment.recordingId()).isEqualTo("rec1");
    assertThat(segment.startInRecording()).isEqualTo(100.0);
    assertThat(segment.duration()).isEqualTo(20.0);

    UtteranceSpan utterance = segment.utterances().get(0);
    assertThat(utterance.speakerId()).isEqualTo("A");
    assertThat(utterance.start()).isEqualTo(2.0);
    assertThat(utterance.text()).isEqualTo("hello world");
    assertThat(utterance.alignment())
        .containsExactly(new Word("hello", 2.0, 1.0), new Word("world", 3.0, 2.0));
  }

  @Test
  void read_shouldKeepUnknownFieldsAndMapContinuationFlags() throws IOException {
    Path manifest = tempDir.resolve("cuts.jsonl");
    Files.writeString(manifest, CUT + "\n");

    RecordingSegment segment = reader.read(manifest).get(0);

    assertThat(segment.properties()).containsEntry("type", "MonoCut").containsEntry("channel", 0);
    assertThat(segment.utterances().get(0).properties()).containsEntry("language", "en");
    assertThat(segment.metadata()).containsEntry("dataset", "ami");
    assertThat(segment.continuationFlags()).containsEntry("A", true);
  }

  @Test
  void read_shouldParseGzippedJsonLines() throws IOException {
    Path manifest = tempDir.resolve("cuts.jsonl.gz");
    try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(manifest))) {
      out.write((CUT + "\n").getBytes(StandardCharsets.UTF_8));
    }

    assertThat(reader.read(manifest)).hasSize(1);
  }

  @Test
  void read_shouldParseJsonArray() throws IOException {
    Path manifest = tempDir.resolve("cuts.json");
    Files.writeString(manifest, "[" + CUT + "," + CUT.replace("cut1", "cut2") + "]");

    assertThat(reader.read(manifest))
        .extracting(RecordingSegment::id)
        .containsExactly("cut1", "cut2");
  }

  @Test
  void read_shouldAcceptSupervisionsWithoutAlignment() throws IOException {
    Path manifest = tempDir.resolve("cuts.jsonl");
    Files.writeString(
        manifest,
        "{\"id\":\"c\",\"start\":0,\"duration\":5,\"supervisions\":"
            + "[{\"id\":\"s\",\"speaker\":\"B\",\"start\":0,\"duration\":5,\"text\":\"hi\"}]}\n");

    RecordingSegment segment = reader.read(manifest).get(0);

    assertThat(segment.recordingId()).isEqualTo("c");
    assertThat(segment.utterances().get(0).hasAlignment()).isFalse();
  }

  @Test
  void read_shouldReportLineOfMalformedEntry() throws IOException {
    Path manifest = tempDir.resolve("cuts.jsonl");
    Files.writeString(manifest, CUT + "\n{not json\n");

    assertThatThrownBy(() -> reader.read(manifest))
        .isInstanceOf(ManifestException.class)
        .hasMessageContaining("line 2");
  }

  @Test
  void read_shouldFailForMissingFile() {
    assertThatThrownBy(() -> reader.read(tempDir.resolve("missing.jsonl")))
        .isInstanceOf(ManifestException.class)
        .hasMessageContaining("not found");
  }
}
