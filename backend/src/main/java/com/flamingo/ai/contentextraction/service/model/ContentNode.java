package com.flamingo.ai.contentextraction.service.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * One node of the hierarchical section tree produced by the section chunker.
 *
 * @param title text of the node's defining heading, empty when the node has no heading
 * @param text serialized markup that belongs directly to this node and to none of its subsections
 * @param level resolved heading rank, {@code null} when {@code title} is empty
 * @param subsections direct child sections in document order
 */
@JsonPropertyOrder({"title", "text", "level", "subsections"})
public record ContentNode(String title, String text, Integer level, List<ContentNode> subsections) {

  public ContentNode {
    title = title == null ? "" : title;
    text = text == null ? "" : text;
    subsections = subsections == null ? List.of() : List.copyOf(subsections);
  }

  /** Creates a node without a heading. */
  public static ContentNode untitled(String text, List<ContentNode> subsections) {
    return new ContentNode("", text, null, subsections);
  }

  /** Returns {@code true} if this node has at least one subsection. */
  public boolean hasSubsections() {
    return !subsections.isEmpty();
  }
}
