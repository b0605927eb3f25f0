package com.scholary.segmenter.api;

import com.scholary.segmenter.corpus.CorpusReport;
import com.scholary.segmenter.manifest.CutManifest;
import java.util.List;

/** Sub-segments of an inline request, in cut manifest layout, with the run report. */
public record SegmentResponse(List<CutManifest> segments, CorpusReport report) {}
