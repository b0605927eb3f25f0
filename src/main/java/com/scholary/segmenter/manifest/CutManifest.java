package com.scholary.segmenter.manifest;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One line of a cut manifest, in the lhotse layout.
 *
 * <p>Supervision starts are relative to the cut, word alignments relative to the recording. Fields
 * this service does not interpret land in {@link #getExtra()} and are written back untouched.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CutManifest {

  @JsonProperty("id")
  private String id;

  @JsonProperty("start")
  private double start;

  @JsonProperty("duration")
  private double duration;

  @JsonProperty("recording_id")
  private String recordingId;

  @JsonProperty("supervisions")
  private List<SupervisionManifest> supervisions;

  @JsonProperty("custom")
  private Map<String, Object> custom;

  private final Map<String, Object> extra = new LinkedHashMap<>();

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public double getStart() {
    return start;
  }

  public void setStart(double start) {
    this.start = start;
  }

  public double getDuration() {
    return duration;
  }

  public void setDuration(double duration) {
    this.duration = duration;
  }

  public String getRecordingId() {
    return recordingId;
  }

  public void setRecordingId(String recordingId) {
    this.recordingId = recordingId;
  }

  public List<SupervisionManifest> getSupervisions() {
    return supervisions;
  }

  public void setSupervisions(List<SupervisionManifest> supervisions) {
    this.supervisions = supervisions;
  }

  public Map<String, Object> getCustom() {
    return custom;
  }

  public void setCustom(Map<String, Object> custom) {
    this.custom = custom;
  }

  @JsonAnyGetter
  public Map<String, Object> getExtra() {
    return extra;
  }

  @JsonAnySetter
  public void putExtra(String key, Object value) {
    extra.put(key, value);
  }
}
