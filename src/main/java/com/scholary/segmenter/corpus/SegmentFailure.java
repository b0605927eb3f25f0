package com.scholary.segmenter.corpus;

/** A segment that could not be processed, with the reason. */
public record SegmentFailure(String segmentId, String errorType, String message) {}
