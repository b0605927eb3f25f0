package com.scholary.segmenter.api;

/**
 * Response for an async segmentation request.
 *
 * <p>Returns a job ID and the URL to poll for its status.
 */
public record AsyncJobResponse(String jobId, String statusUrl) {}
