package com.scholary.segmenter.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Request for an asynchronous manifest-to-manifest segmentation job.
 *
 * <p>Paths are resolved on the server, relative to the job base directory.
 */
public record SegmentationJobRequest(
    @NotBlank String input, @NotBlank String output, @Positive Double maxLen) {}
