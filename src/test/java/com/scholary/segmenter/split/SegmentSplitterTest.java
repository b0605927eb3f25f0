package com.scholary.segmenter.split;

import static com.scholary.segmenter.SegmentFixtures.aligned;
import static com.scholary.segmenter.SegmentFixtures.segment;
import static com.scholary.segmenter.SegmentFixtures.unaligned;
import static com.scholary.segmenter.SegmentFixtures.words;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.segmenter.alignment.WordAlignmentMatcher;
import com.scholary.segmenter.model.RecordingSegment;
import com.scholary.segmenter.model.UtteranceSpan;
import com.scholary.segmenter.model.Word;
import com.scholary.segmenter.timing.TimeRange;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SegmentSplitterTest {

  private static final double EPS = TimeRange.EPSILON;

  private SegmentSplitter splitter;

  @BeforeEach
  void setUp() {
    WordAlignmentMatcher matcher = new WordAlignmentMatcher();
    splitter = new SegmentSplitter(new BoundaryTrimmer(matcher), new OverlapCarrier(matcher), true);
  }

  @Test
  void split_shouldReturnEmptyListForSegmentWithoutUtterances() {
    RecordingSegment empty = segment("empty", 60.0);

    assertThat(splitter.split(empty, 30.0)).isEmpty();
  }

  @Test
  void split_shouldReturnShortSegmentUnchanged() {
    RecordingSegment shortSegment =
        new RecordingSegment(
            "short",
            10.0,
            20.0,
            List.of(aligned("A", "spkA", 0.0, 2.0, words(5))),
            Map.of("source", "ami"));

    List<RecordingSegment> result = splitter.split(shortSegment, 30.0);

    assertThat(result).hasSize(1);
    assertThat(result.get(0)).isSameAs(shortSegment);
  }

  @Test
  void split_shouldTrimLongUtteranceAndContinueItInNextSubSegment() {
    UtteranceSpan a = aligned("A", "spkA", 0.0, 5.0, words(8));
    UtteranceSpan b = aligned("B", "spkB", 35.0, 3.0, "yes", "I", "agree");
    RecordingSegment input = segment("seg", 45.0, a, b);

    List<RecordingSegment> result = splitter.split(input, 30.0);

    assertThat(result).hasSize(2);

    RecordingSegment first = result.get(0);
    assertThat(first.id()).isEqualTo("seg-0");
    assertThat(first.startInRecording()).isEqualTo(0.0);
    assertThat(first.duration()).isEqualTo(25.0);
    assertThat(first.utterances()).hasSize(1);
    assertThat(first.utterances().get(0).text()).isEqualTo("w0 w1 w2 w3 w4");
    assertThat(first.continuationFlags()).containsExactly(Map.entry("spkA", true));

    RecordingSegment second = result.get(1);
    assertThat(second.id()).isEqualTo("seg-1");
    assertThat(second.startInRecording()).isEqualTo(25.0);
    assertThat(second.duration()).isEqualTo(19.0);
    assertThat(second.utterances())
        .extracting(UtteranceSpan::speakerId)
        .containsExactly("spkA", "spkB");
    UtteranceSpan rest = second.utterances().get(0);
    assertThat(rest.start()).isEqualTo(0.0);
    assertThat(rest.duration()).isEqualTo(15.0);
    assertThat(rest.text()).isEqualTo("w5 w6 w7");
    assertThat(rest.alignment().get(0).start()).isEqualTo(0.0);
    UtteranceSpan answer = second.utterances().get(1);
    assertThat(answer.start()).isEqualTo(10.0);
    assertThat(answer.text()).isEqualTo("yes I agree");
    assertThat(second.continuationFlags())
        .containsExactly(Map.entry("spkA", false), Map.entry("spkB", false));
  }

  @Test
  void split_shouldMoveUnalignedOverflowUtteranceIntoNextGroupUnchanged() {
    UtteranceSpan a = aligned("A", "spkA", 0.0, 3.0, "hello", "there", "friend");
    UtteranceSpan b = unaligned("B", "spkB", 5.0, 30.0, "a long unaligned turn");
    UtteranceSpan c = unaligned("C", "spkC", 32.0, 8.0, "short reply");
    RecordingSegment input = segment("seg", 50.0, a, b, c);

    List<RecordingSegment> result = splitter.split(input, 30.0);

    assertThat(result).hasSize(3);
    assertThat(result.get(0).utterances()).extracting(UtteranceSpan::id).containsExactly("A-0-0");

    RecordingSegment second = result.get(1);
    assertThat(second.startInRecording()).isEqualTo(5.0);
    assertThat(second.duration()).isEqualTo(30.0);
    UtteranceSpan moved = second.utterances().get(0);
    assertThat(moved.id()).isEqualTo("B-1-0");
    assertThat(moved.text()).isEqualTo(b.text());
    assertThat(moved.start()).isEqualTo(0.0);
    assertThat(moved.duration()).isEqualTo(b.duration());

    RecordingSegment third = result.get(2);
    assertThat(third.startInRecording()).isEqualTo(32.0);
    assertThat(third.utterances()).extracting(UtteranceSpan::text).containsExactly("short reply");
  }

  @Test
  void split_shouldCarryOtherSpeakersWordsIntoGroupOpenedByRollback() {
    UtteranceSpan a = aligned("A", "spkA", 0.0, 3.0, "hello", "there", "friend");
    UtteranceSpan b = unaligned("B", "spkB", 5.0, 30.0, "a long unaligned turn");
    UtteranceSpan c = unaligned("C", "spkC", 32.0, 8.0, "short reply");

    List<RecordingSegment> result = splitter.split(segment("seg", 50.0, a, b, c), 30.0);

    RecordingSegment second = result.get(1);
    assertThat(second.utterances()).hasSize(2);
    UtteranceSpan carried = second.utterances().get(1);
    assertThat(carried.id()).isEqualTo("A-0-1" + OverlapCarrier.FRAGMENT_SUFFIX);
    assertThat(carried.text()).isEqualTo("friend");
    assertThat(carried.start()).isEqualTo(1.0);
    assertThat(carried.duration()).isEqualTo(3.0);
    assertThat(second.continuationFlags()).containsKeys("spkA", "spkB");
  }

  @Test
  void split_shouldFlagSpeakerOfDroppedUtteranceAsNotContinuing() {
    UtteranceSpan a = aligned("A", "spkA", 0.0, 3.0, "hello", "there", "friend");
    UtteranceSpan b = unaligned("B", "spkB", 5.0, 30.0, "a long unaligned turn");
    UtteranceSpan c = unaligned("C", "spkC", 32.0, 8.0, "short reply");

    List<RecordingSegment> result = splitter.split(segment("seg", 50.0, a, b, c), 30.0);

    assertThat(result.get(0).utterances())
        .extracting(UtteranceSpan::speakerId)
        .containsOnly("spkA");
    assertThat(result.get(0).continuationFlags())
        .containsExactly(Map.entry("spkA", false), Map.entry("spkB", false));
  }

  @Test
  void split_shouldReseedTrimmedSpeakerAfterRollbackAndCarryEarlierSpeaker() {
    UtteranceSpan a = aligned("A", "spkA", 0.0, 1.0, words(10));
    UtteranceSpan b = aligned("B", "spkB", 5.0, 1.0, words(35));

    List<RecordingSegment> result = splitter.split(segment("seg", 40.0, a, b), 30.0);

    assertThat(result).hasSize(3);

    RecordingSegment first = result.get(0);
    assertThat(first.startInRecording()).isEqualTo(0.0);
    assertThat(first.duration()).isEqualTo(29.0);
    assertThat(first.utterances())
        .extracting(UtteranceSpan::speakerId)
        .containsExactly("spkA", "spkB");
    assertThat(first.utterances().get(1).end()).isEqualTo(29.0);
    assertThat(first.continuationFlags()).containsEntry("spkB", true).containsEntry("spkA", false);

    RecordingSegment second = result.get(1);
    assertThat(second.startInRecording()).isEqualTo(5.0);
    assertThat(second.duration()).isEqualTo(29.0);
    assertThat(second.utterances())
        .extracting(UtteranceSpan::id)
        .containsExactly("B-1-0", "A-0-1" + OverlapCarrier.FRAGMENT_SUFFIX);
    UtteranceSpan fragment = second.utterances().get(1);
    assertThat(fragment.start()).isEqualTo(0.0);
    assertThat(fragment.duration()).isEqualTo(5.0);
    assertThat(fragment.text()).isEqualTo("w5 w6 w7 w8 w9");
    assertThat(second.continuationFlags()).containsEntry("spkB", true);

    RecordingSegment third = result.get(2);
    assertThat(third.startInRecording()).isEqualTo(34.0);
    assertThat(third.duration()).isEqualTo(6.0);
    assertThat(third.utterances()).hasSize(1);
    assertThat(third.utterances().get(0).text()).isEqualTo("w29 w30 w31 w32 w33 w34");
    assertThat(third.continuationFlags()).containsExactly(Map.entry("spkB", false));
  }

  @Test
  void split_withoutOverlapCarryingShouldNotAddFragments() {
    WordAlignmentMatcher matcher = new WordAlignmentMatcher();
    SegmentSplitter plain =
        new SegmentSplitter(new BoundaryTrimmer(matcher), new OverlapCarrier(matcher), false);
    UtteranceSpan a = aligned("A", "spkA", 0.0, 3.0, "hello", "there", "friend");
    UtteranceSpan b = unaligned("B", "spkB", 5.0, 30.0, "a long unaligned turn");
    UtteranceSpan c = unaligned("C", "spkC", 32.0, 8.0, "short reply");

    List<RecordingSegment> result = plain.split(segment("seg", 50.0, a, b, c), 30.0);

    assertThat(result.get(1).utterances()).extracting(UtteranceSpan::id).containsExactly("B-1-0");
  }

  @Test
  void split_shouldKeepInputMetadataAndAddContinuationFlags() {
    RecordingSegment input =
        new RecordingSegment(
            "seg",
            0.0,
            45.0,
            List.of(aligned("A", "spkA", 0.0, 5.0, words(8))),
            Map.of("dataset", "notsofar"));

    List<RecordingSegment> result = splitter.split(input, 30.0);

    assertThat(result)
        .allSatisfy(
            sub -> {
              assertThat(sub.metadata()).containsEntry("dataset", "notsofar");
              assertThat(sub.metadata()).containsKey(RecordingSegment.CONTINUATION_KEY);
            });
    assertThat(input.metadata()).doesNotContainKey(RecordingSegment.CONTINUATION_KEY);
  }

  @Test
  void split_shouldNotModifyInputSegment() {
    UtteranceSpan a = aligned("A", "spkA", 0.0, 5.0, words(8));
    RecordingSegment input = segment("seg", 45.0, a);

    splitter.split(input, 30.0);

    assertThat(input.utterances()).containsExactly(a);
    assertThat(a.text()).isEqualTo("w0 w1 w2 w3 w4 w5 w6 w7");
  }

  @Test
  void splitWithOutcome_shouldCountUtterancesThatFitNowhere() {
    UtteranceSpan lecture = unaligned("L", "spkL", 0.0, 45.0, "a very long unaligned lecture");
    UtteranceSpan question = aligned("Q", "spkQ", 40.0, 1.0, "why");

    SplitOutcome outcome =
        splitter.splitWithOutcome(segment("seg", 45.0, lecture, question), 30.0);

    assertThat(outcome.lostUtterances()).isEqualTo(1);
    assertThat(outcome.segments()).hasSize(1);
    assertThat(outcome.segments().get(0).utterances())
        .extracting(UtteranceSpan::text)
        .containsExactly("why");
  }

  @Test
  void split_shouldRejectNonPositiveMaxLen() {
    RecordingSegment input = segment("seg", 45.0, aligned("A", "spkA", 0.0, 5.0, words(8)));

    assertThatThrownBy(() -> splitter.split(input, 0.0))
        .isInstanceOf(SegmentationException.class)
        .hasMessageContaining("seg");
  }

  @Test
  void split_shouldRejectNegativeUtteranceDuration() {
    RecordingSegment input =
        segment("bad", 45.0, new UtteranceSpan("U", "spk", 0.0, -1.0, "oops", List.of()));

    assertThatThrownBy(() -> splitter.split(input, 30.0))
        .isInstanceOf(SegmentationException.class)
        .satisfies(e -> assertThat(((SegmentationException) e).getSegmentId()).isEqualTo("bad"));
  }

  @Test
  void split_outputsShouldRespectLengthAndBoundsOnGeneratedMeetings() {
    Random random = new Random(42);
    for (int run = 0; run < 50; run++) {
      RecordingSegment meeting = generateMeeting(random, "meeting" + run);

      List<RecordingSegment> result = splitter.split(meeting, 30.0);

      for (RecordingSegment sub : result) {
        assertThat(sub.duration()).isLessThanOrEqualTo(30.0 + EPS);
        for (UtteranceSpan utterance : sub.utterances()) {
          assertThat(utterance.start()).isGreaterThanOrEqualTo(0.0);
          assertThat(utterance.end()).isLessThanOrEqualTo(sub.duration() + EPS);
        }
      }
      for (RecordingSegment sub : result) {
        double shift = sub.startInRecording() - meeting.startInRecording();
        for (UtteranceSpan utterance : sub.utterances()) {
          double start = utterance.start() + shift;
          double end = utterance.end() + shift;
          assertThat(meeting.utterances())
              .as("source of %s in %s", utterance.id(), sub.id())
              .anySatisfy(
                  source -> {
                    assertThat(source.speakerId()).isEqualTo(utterance.speakerId());
                    assertThat(start).isGreaterThanOrEqualTo(source.start() - EPS);
                    assertThat(end).isLessThanOrEqualTo(source.end() + EPS);
                  });
        }
      }
      for (int i = 1; i < result.size(); i++) {
        assertThat(result.get(i).startInRecording())
            .isGreaterThanOrEqualTo(result.get(i - 1).startInRecording());
      }
    }
  }

  /** Three speakers taking overlapping turns of 2 to 25 seconds, some turns unaligned. */
  private static RecordingSegment generateMeeting(Random random, String id) {
    List<UtteranceSpan> utterances = new ArrayList<>();
    double cursor = 0.0;
    for (int i = 0; i < 12; i++) {
      String speaker = "spk" + random.nextInt(3);
      int wordCount = 2 + random.nextInt(20);
      double wordLength = 0.3 + random.nextDouble() * 0.9;
      List<Word> alignment = new ArrayList<>();
      List<String> tokens = new ArrayList<>();
      for (int w = 0; w < wordCount; w++) {
        tokens.add("t" + w);
        alignment.add(new Word("t" + w, cursor + w * wordLength, wordLength));
      }
      boolean withAlignment = random.nextInt(5) > 0;
      utterances.add(
          new UtteranceSpan(
              id + "-u" + i,
              speaker,
              cursor,
              wordCount * wordLength,
              String.join(" ", tokens),
              withAlignment ? alignment : List.of()));
      cursor += random.nextDouble() * wordCount * wordLength;
    }
    double end = utterances.stream().mapToDouble(UtteranceSpan::end).max().orElse(0.0);
    return new RecordingSegment(id, 0.0, end, utterances, Map.of());
  }
}
