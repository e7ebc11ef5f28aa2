package com.flamingo.ai.contentextraction.service.parsing;

import com.flamingo.ai.contentextraction.config.ExtractionConfig;
import com.flamingo.ai.contentextraction.exception.DocumentProcessingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Service;

/** {@link MarkupParser} backed by jsoup. */
@Service
@Slf4j
@RequiredArgsConstructor
public class JsoupMarkupParser implements MarkupParser {

  private final ExtractionConfig extractionConfig;

  @Override
  public Document parse(String documentId, String markup, MarkupKind kind) {
    if (markup == null || markup.isBlank()) {
      throw new DocumentProcessingException(documentId, "No markup provided");
    }
    int maxLength = extractionConfig.getChunking().getMaxMarkupLength();
    if (markup.length() > maxLength) {
      throw new DocumentProcessingException(
          documentId,
          "Markup length " + markup.length() + " exceeds limit " + maxLength,
          "Document is too large to process");
    }
    MarkupKind effectiveKind = kind != null ? kind : MarkupKind.HTML;
    try {
      Document document = Jsoup.parse(markup, "", effectiveKind.newParser());
      document.outputSettings().prettyPrint(false);
      log.debug(
          "Parsed {} markup for document {}: {} chars", effectiveKind, documentId, markup.length());
      return document;
    } catch (RuntimeException e) {
      log.error("Markup parsing failed for document {}: {}", documentId, e.getMessage());
      throw new DocumentProcessingException(
          documentId, "Failed to parse markup: " + e.getMessage(), e);
    }
  }
}
