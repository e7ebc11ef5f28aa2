package com.flamingo.ai.contentextraction.service.digest;

import com.flamingo.ai.contentextraction.config.ExtractionConfig;
import com.flamingo.ai.contentextraction.service.model.ContentNode;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.jsoup.nodes.Entities;
import org.springframework.stereotype.Component;

/** Truncates a child's text for inclusion in its parent's {@code SectionDigest}. */
@Component
@RequiredArgsConstructor
public class TextShortener {

  /** Cap value that disables truncation. */
  public static final int NO_LIMIT = -1;

  private final ExtractionConfig extractionConfig;

  /**
   * Shortens {@code text} to at most {@code cap} lines.
   *
   * <ul>
   *   <li>{@link #NO_LIMIT} returns the text unchanged.
   *   <li>Empty text with subsections becomes a list of the subsection titles, so the digest is
   *       never blank when deeper structure exists.
   *   <li>Text within the cap is kept whole, followed by the ellipsis only if subsections exist.
   *   <li>Longer text keeps the first {@code cap} lines followed by the ellipsis.
   * </ul>
   *
   * <p>Kept lines are joined without a delimiter.
   *
   * @param text the child's full text
   * @param cap maximum number of lines, or {@link #NO_LIMIT}
   * @param subsections the child's own subsections
   * @return the shortened text
   * @throws IllegalArgumentException if {@code cap} is negative and not {@link #NO_LIMIT}
   */
  public String shorten(String text, int cap, List<ContentNode> subsections) {
    if (cap == NO_LIMIT) {
      return text == null ? "" : text;
    }
    if (cap < 0) {
      throw new IllegalArgumentException("Line cap must be non-negative or NO_LIMIT: " + cap);
    }
    boolean hasSubsections = subsections != null && !subsections.isEmpty();
    if (text == null || text.isEmpty()) {
      return hasSubsections ? coveredTopics(subsections) : "";
    }

    String ellipsis = extractionConfig.getDigest().getEllipsis();
    List<String> lines = text.lines().collect(Collectors.toList());
    if (lines.size() <= cap) {
      return hasSubsections ? String.join("", lines) + ellipsis : String.join("", lines);
    }
    return String.join("", lines.subList(0, cap)) + ellipsis;
  }

  private String coveredTopics(List<ContentNode> subsections) {
    StringBuilder listing = new StringBuilder("<p>")
        .append(Entities.escape(extractionConfig.getDigest().getCoveredTopicsLabel()))
        .append("</p><ul>");
    for (ContentNode child : subsections) {
      listing.append("<li>").append(Entities.escape(child.title())).append("</li>");
    }
    return listing.append("</ul>").toString();
  }
}
