package com.flamingo.ai.contentextraction.service.chunking;

import com.flamingo.ai.contentextraction.config.ExtractionConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

/**
 * Builds the {@code text} of a node from the markup that belongs to it directly.
 *
 * <p>Everything is kept except headings, excluded tags and elements without text. Elements that
 * contain a heading are never kept whole; their children are examined instead, so the heading can
 * be routed to a subsection without losing the markup around it.
 *
 * <p>Kept markup is serialized without pretty printing, whatever the source document's output
 * settings are, so text keeps its original layout at every level of the tree.
 */
@Component
@RequiredArgsConstructor
public class ContentInclusionPolicy {

  private final HeadingLevelResolver headingLevelResolver;
  private final ExtractionConfig extractionConfig;

  /**
   * Serializes the content of {@code container} that is not listed in {@code skipped}.
   *
   * @param container element whose children are examined
   * @param skipped nodes owned elsewhere (boundary headings and their content), matched by identity
   * @return newline-joined markup, stripped
   */
  public String collectOwnContent(Element container, Set<Node> skipped) {
    List<String> parts = new ArrayList<>();
    collect(container, skipped, excludedTags(), serializerFor(container), parts);
    return String.join("\n", parts).strip();
  }

  /** Returns {@code true} if the element would be kept whole. */
  public boolean shouldInclude(Element element) {
    return isEligible(element, excludedTags()) && !headingLevelResolver.containsHeading(element);
  }

  // ---- private helpers ----

  private void collect(
      Element container,
      Set<Node> skipped,
      Set<String> excluded,
      Element serializer,
      List<String> parts) {
    for (Node child : container.childNodes()) {
      if (skipped.contains(child)) {
        continue;
      }
      if (child instanceof TextNode textNode) {
        if (!textNode.isBlank()) {
          parts.add(serialize(textNode, serializer).strip());
        }
      } else if (child instanceof Element element && isEligible(element, excluded)) {
        if (headingLevelResolver.containsHeading(element)) {
          collect(element, skipped, excluded, serializer, parts);
        } else {
          parts.add(serialize(element, serializer));
        }
      }
    }
  }

  /**
   * Body of a detached shell document carrying the source's output settings with pretty printing
   * off. The source document itself is left as it is.
   */
  private Element serializerFor(Element container) {
    Document source = container.ownerDocument();
    Document.OutputSettings settings =
        source == null ? new Document.OutputSettings() : source.outputSettings().clone();
    Document shell = Document.createShell("");
    shell.outputSettings(settings.prettyPrint(false));
    return shell.body();
  }

  private String serialize(Node node, Element serializer) {
    serializer.appendChild(node.clone());
    String html = serializer.html();
    serializer.empty();
    return html;
  }

  private boolean isEligible(Element element, Set<String> excluded) {
    return !excluded.contains(element.normalName())
        && !headingLevelResolver.isHeading(element)
        && element.hasText();
  }

  private Set<String> excludedTags() {
    return extractionConfig.getChunking().getExcludedTags().stream()
        .map(tag -> tag.trim().toLowerCase(Locale.ROOT))
        .collect(Collectors.toSet());
  }
}
