package com.scholary.segmenter.corpus;

import com.scholary.segmenter.model.RecordingSegment;
import java.util.List;

/** Sub-segments of a corpus run, in input order, together with the run report. */
public record CorpusResult(List<RecordingSegment> segments, CorpusReport report) {}
