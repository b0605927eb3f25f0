package com.scholary.segmenter.manifest;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** One supervision of a cut manifest. The {@code word} alignment is the only one interpreted. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SupervisionManifest {

  static final String WORD_ALIGNMENT_KEY = "word";

  @JsonProperty("id")
  private String id;

  @JsonProperty("speaker")
  private String speaker;

  @JsonProperty("start")
  private double start;

  @JsonProperty("duration")
  private double duration;

  @JsonProperty("text")
  private String text;

  @JsonProperty("alignment")
  private Map<String, List<AlignmentItemManifest>> alignment;

  private final Map<String, Object> extra = new LinkedHashMap<>();

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public String getSpeaker() {
    return speaker;
  }

  public void setSpeaker(String speaker) {
    this.speaker = speaker;
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

  public String getText() {
    return text;
  }

  public void setText(String text) {
    this.text = text;
  }

  public Map<String, List<AlignmentItemManifest>> getAlignment() {
    return alignment;
  }

  public void setAlignment(Map<String, List<AlignmentItemManifest>> alignment) {
    this.alignment = alignment;
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
