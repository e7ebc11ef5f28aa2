package com.flamingo.ai.contentextraction.service.chunking;

import com.flamingo.ai.contentextraction.config.ExtractionConfig;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Chooses the element the chunker starts from.
 *
 * <p>Preference order: the first {@code main}, {@code [role=main]} or {@code article} element with
 * text; the {@code body} if it has text; the first {@code section} with text; the first {@code
 * div} whose text is longer than the configured minimum; otherwise the document itself.
 */
@Component
@RequiredArgsConstructor
public class RootElementSelector {

  private static final List<String> PRIMARY_CONTENT_QUERIES =
      List.of("main", "[role=main]", "article");

  private final ExtractionConfig extractionConfig;

  public Element select(Document document) {
    for (String query : PRIMARY_CONTENT_QUERIES) {
      Element primary = firstWithText(document, query);
      if (primary != null) {
        return primary;
      }
    }

    // selectFirst rather than body(): body() inserts a body into XML documents that lack one.
    Element body = document.selectFirst("body");
    if (body != null && body.hasText()) {
      return body;
    }

    Element section = firstWithText(document, "section");
    if (section != null) {
      return section;
    }

    int threshold = extractionConfig.getChunking().getMinRootContentLength();
    for (Element div : document.select("div")) {
      if (div.text().length() > threshold) {
        return div;
      }
    }
    return document;
  }

  private Element firstWithText(Document document, String query) {
    for (Element candidate : document.select(query)) {
      if (candidate.hasText()) {
        return candidate;
      }
    }
    return null;
  }
}
