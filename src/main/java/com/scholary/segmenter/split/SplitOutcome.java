package com.scholary.segmenter.split;

import com.scholary.segmenter.model.RecordingSegment;
import java.util.List;

/**
 * Result of splitting one segment.
 *
 * @param segments the sub-segments in chronological order
 * @param lostUtterances utterances that fit no window at all and appear in no sub-segment
 */
public record SplitOutcome(List<RecordingSegment> segments, int lostUtterances) {}
