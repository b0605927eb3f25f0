package com.scholary.segmenter.manifest;

import com.scholary.segmenter.export.RecordingSupervision;
import com.scholary.segmenter.model.RecordingSegment;
import com.scholary.segmenter.model.UtteranceSpan;
import com.scholary.segmenter.model.Word;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Converts between manifest entries and the in-memory segment model.
 *
 * <p>Manifests store word alignments relative to the recording, the model relative to the segment.
 * Continuation flags live under {@code custom.per_spk_flags} on disk and under {@link
 * RecordingSegment#CONTINUATION_KEY} in memory.
 */
@Component
public class ManifestMapper {

  static final String FLAGS_FIELD = "per_spk_flags";
  static final String RECORDING_ID_FIELD = "recording_id";
  static final String CHANNEL_FIELD = "channel";

  public RecordingSegment toSegment(CutManifest cut) {
    if (cut.getId() == null || cut.getId().isBlank()) {
      throw new ManifestException("Cut without an id");
    }
    List<UtteranceSpan> utterances = new ArrayList<>();
    if (cut.getSupervisions() != null) {
      for (SupervisionManifest supervision : cut.getSupervisions()) {
        utterances.add(toUtterance(supervision, cut.getStart()));
      }
    }

    Map<String, Object> metadata = new LinkedHashMap<>();
    if (cut.getCustom() != null) {
      cut.getCustom()
          .forEach(
              (key, value) ->
                  metadata.put(
                      FLAGS_FIELD.equals(key) ? RecordingSegment.CONTINUATION_KEY : key, value));
    }

    String recordingId = cut.getRecordingId() != null ? cut.getRecordingId() : cut.getId();
    return new RecordingSegment(
        cut.getId(),
        recordingId,
        cut.getStart(),
        cut.getDuration(),
        utterances,
        metadata,
        cut.getExtra());
  }

  public CutManifest toManifest(RecordingSegment segment) {
    CutManifest cut = new CutManifest();
    cut.setId(segment.id());
    cut.setStart(segment.startInRecording());
    cut.setDuration(segment.duration());
    cut.setRecordingId(segment.recordingId());

    List<SupervisionManifest> supervisions = new ArrayList<>();
    for (UtteranceSpan utterance : segment.utterances()) {
      supervisions.add(toSupervision(utterance, segment.startInRecording()));
    }
    cut.setSupervisions(supervisions);

    if (!segment.metadata().isEmpty()) {
      Map<String, Object> custom = new LinkedHashMap<>();
      segment
          .metadata()
          .forEach(
              (key, value) -> {
                if (RecordingSegment.CONTINUATION_KEY.equals(key)) {
                  custom.put(FLAGS_FIELD, segment.continuationFlags());
                } else {
                  custom.put(key, value);
                }
              });
      cut.setCustom(custom);
    }
    segment.properties().forEach(cut::putExtra);
    return cut;
  }

  /** Supervision manifest entry on the recording timeline, as written by supervision export. */
  public SupervisionManifest toManifest(RecordingSupervision supervision) {
    SupervisionManifest entry = new SupervisionManifest();
    entry.setId(supervision.id());
    entry.setSpeaker(supervision.speakerId());
    entry.setStart(supervision.start());
    entry.setDuration(supervision.duration());
    entry.setText(supervision.text());
    if (!supervision.alignment().isEmpty()) {
      List<AlignmentItemManifest> items =
          supervision.alignment().stream()
              .map(w -> new AlignmentItemManifest(w.symbol(), w.start(), w.duration()))
              .toList();
      entry.setAlignment(Map.of(SupervisionManifest.WORD_ALIGNMENT_KEY, items));
    }
    entry.putExtra(RECORDING_ID_FIELD, supervision.recordingId());
    if (supervision.channels().size() == 1) {
      entry.putExtra(CHANNEL_FIELD, supervision.channels().get(0));
    } else if (!supervision.channels().isEmpty()) {
      entry.putExtra(CHANNEL_FIELD, supervision.channels());
    }
    supervision.properties().forEach(entry::putExtra);
    return entry;
  }

  private UtteranceSpan toUtterance(SupervisionManifest supervision, double cutStart) {
    List<Word> words = new ArrayList<>();
    if (supervision.getAlignment() != null) {
      List<AlignmentItemManifest> items =
          supervision.getAlignment().get(SupervisionManifest.WORD_ALIGNMENT_KEY);
      if (items != null) {
        for (AlignmentItemManifest item : items) {
          words.add(new Word(item.symbol(), item.start() - cutStart, item.duration()));
        }
      }
    }
    return new UtteranceSpan(
        supervision.getId(),
        supervision.getSpeaker(),
        supervision.getStart(),
        supervision.getDuration(),
        supervision.getText(),
        words,
        supervision.getExtra());
  }

  private SupervisionManifest toSupervision(UtteranceSpan utterance, double cutStart) {
    SupervisionManifest supervision = new SupervisionManifest();
    supervision.setId(utterance.id());
    supervision.setSpeaker(utterance.speakerId());
    supervision.setStart(utterance.start());
    supervision.setDuration(utterance.duration());
    supervision.setText(utterance.text());
    if (utterance.hasAlignment()) {
      List<AlignmentItemManifest> items =
          utterance.alignment().stream()
              .map(w -> new AlignmentItemManifest(w.symbol(), w.start() + cutStart, w.duration()))
              .toList();
      supervision.setAlignment(Map.of(SupervisionManifest.WORD_ALIGNMENT_KEY, items));
    }
    utterance.properties().forEach(supervision::putExtra);
    return supervision;
  }
}
