package com.scholary.segmenter.corpus;

import com.scholary.segmenter.model.RecordingSegment;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Keeps only segments strictly shorter than a length limit. */
@Component
public class LengthFilter {

  private static final Logger LOGGER = LoggerFactory.getLogger(LengthFilter.class);

  public List<RecordingSegment> filter(List<RecordingSegment> segments, double maxLen) {
    List<RecordingSegment> kept =
        segments.stream().filter(segment -> segment.duration() < maxLen).toList();
    if (kept.size() < segments.size()) {
      LOGGER.info(
          "Removed {} of {} segments lasting {}s or more",
          segments.size() - kept.size(),
          segments.size(),
          maxLen);
    }
    return kept;
  }
}
