package com.scholary.segmenter.manifest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A word alignment item as stored in a manifest.
 *
 * <p>Items are written as objects. Reading also accepts the compact array form {@code [symbol,
 * start, duration, score]} some manifest producers emit; the score is not kept.
 */
public record AlignmentItemManifest(String symbol, double start, double duration) {

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static AlignmentItemManifest fromJson(JsonNode node) {
    if (node.isArray()) {
      if (node.size() < 3) {
        throw new IllegalArgumentException(
            "Alignment item needs symbol, start and duration: " + node);
      }
      return new AlignmentItemManifest(
          node.get(0).asText(), node.get(1).asDouble(), node.get(2).asDouble());
    }
    if (!node.hasNonNull("start") || !node.hasNonNull("duration")) {
      throw new IllegalArgumentException("Alignment item needs start and duration: " + node);
    }
    return new AlignmentItemManifest(
        node.path("symbol").asText(""),
        node.get("start").asDouble(),
        node.get("duration").asDouble());
  }
}
