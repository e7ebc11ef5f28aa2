package com.flamingo.ai.contentextraction.service.parsing;

import org.jsoup.nodes.Document;

/**
 * Parses raw markup into a jsoup {@link Document} ready for section chunking.
 *
 * <p>Implementations must be stateless so a single instance can be shared across concurrent
 * document-processing threads.
 */
public interface MarkupParser {

  /**
   * Parses the given markup.
   *
   * @param documentId identifier used in error reports, may be {@code null}
   * @param markup raw markup
   * @param kind the markup kind selecting the parser
   * @return parsed document
   * @throws com.flamingo.ai.contentextraction.exception.DocumentProcessingException if the markup
   *     is missing, too large, or cannot be parsed
   */
  Document parse(String documentId, String markup, MarkupKind kind);
}
