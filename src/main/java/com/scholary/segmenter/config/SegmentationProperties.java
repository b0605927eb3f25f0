package com.scholary.segmenter.config;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for segmentation runs.
 *
 * <p>Controls the sub-segment length limit, worker pool size and the optional preprocessing steps
 * applied before splitting.
 */
@ConfigurationProperties(prefix = "segmentation")
@Validated
public record SegmentationProperties(
    @DefaultValue("30") @Positive double maxLen,
    @DefaultValue("8") @Positive int numJobs,
    @DefaultValue("2") @PositiveOrZero double maxPause,
    @DefaultValue("true") boolean carryOverlaps,
    @DefaultValue("true") boolean filterPunctuationAlignments,
    @DefaultValue("true") boolean trimToGroups,
    @DefaultValue("1000") @Positive int workerQueueSize) {

  public SegmentationProperties withMaxLen(double newMaxLen) {
    return new SegmentationProperties(
        newMaxLen,
        numJobs,
        maxPause,
        carryOverlaps,
        filterPunctuationAlignments,
        trimToGroups,
        workerQueueSize);
  }
}
