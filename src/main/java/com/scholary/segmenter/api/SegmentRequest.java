package com.scholary.segmenter.api;

import com.scholary.segmenter.manifest.CutManifest;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.util.List;

/**
 * Request to split segments given inline, in cut manifest layout.
 *
 * @param maxLen length limit in seconds; the configured limit when absent
 */
public record SegmentRequest(@NotEmpty List<CutManifest> segments, @Positive Double maxLen) {}
