package com.flamingo.ai.contentextraction.service.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * Bounded-size summary of a node: its own title and text plus a shortened view of each direct
 * child. Serves as the hash input and as context for downstream consumers.
 *
 * @param title the node's title
 * @param text the node's own text, untruncated
 * @param subsections one entry per direct child, in document order
 */
@JsonPropertyOrder({"title", "text", "subsections"})
public record SectionDigest(String title, String text, List<SubsectionDigest> subsections) {

  public SectionDigest {
    title = title == null ? "" : title;
    text = text == null ? "" : text;
    subsections = subsections == null ? List.of() : List.copyOf(subsections);
  }
}
