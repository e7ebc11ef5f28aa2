package com.flamingo.ai.contentextraction.service.chunking;

import org.jsoup.nodes.Element;

/**
 * An element that resolved to a heading, paired with its effective rank.
 *
 * @param element the heading element
 * @param level resolved rank, lower is more significant
 */
public record Heading(Element element, int level) {

  /** Normalized heading text, used as a section title. */
  public String title() {
    return element.text();
  }
}
