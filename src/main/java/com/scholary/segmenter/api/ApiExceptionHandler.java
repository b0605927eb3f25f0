package com.scholary.segmenter.api;

import com.scholary.segmenter.job.JobPathException;
import com.scholary.segmenter.manifest.ManifestException;
import com.scholary.segmenter.split.SegmentationException;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps domain exceptions to HTTP error responses. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler({
    ManifestException.class,
    SegmentationException.class,
    JobPathException.class
  })
  public ResponseEntity<ApiError> handleInvalidInput(RuntimeException e) {
    LOGGER.warn("Rejected request: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiError(e.getClass().getSimpleName(), e.getMessage(), Instant.now()));
  }

  /** Error body returned to API clients. */
  public record ApiError(String errorCode, String message, Instant timestamp) {}
}
