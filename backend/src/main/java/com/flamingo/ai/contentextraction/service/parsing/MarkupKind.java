package com.flamingo.ai.contentextraction.service.parsing;

import java.util.Locale;
import java.util.Set;
import java.util.function.Supplier;
import org.jsoup.parser.Parser;

/**
 * Kinds of markup the extraction pipeline accepts, each bound to the jsoup parser that reads it.
 *
 * <p>Callers resolve a kind from the request's content type and pass it into {@link
 * MarkupParser#parse}; there is no global registry of handlers.
 */
public enum MarkupKind {

  /** HTML5 markup, parsed leniently. Also used for plain text and unknown types. */
  HTML(Set.of("text/html", "text/plain"), Parser::htmlParser),

  /** XHTML or generic XML markup. Tag case and structure are kept as written. */
  XHTML(Set.of("application/xhtml+xml", "application/xml", "text/xml"), Parser::xmlParser);

  private final Set<String> contentTypes;
  private final Supplier<Parser> parserFactory;

  MarkupKind(Set<String> contentTypes, Supplier<Parser> parserFactory) {
    this.contentTypes = contentTypes;
    this.parserFactory = parserFactory;
  }

  public Set<String> getContentTypes() {
    return contentTypes;
  }

  /** Returns a fresh parser; jsoup parsers keep state and are not shared between threads. */
  public Parser newParser() {
    return parserFactory.get();
  }

  /**
   * Resolves the kind for a content type such as {@code application/xhtml+xml; charset=UTF-8}.
   *
   * @param contentType media type, may be {@code null}
   * @return the matching kind, {@link #HTML} when nothing matches
   */
  public static MarkupKind fromContentType(String contentType) {
    if (contentType == null || contentType.isBlank()) {
      return HTML;
    }
    String base = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
    for (MarkupKind kind : values()) {
      if (kind.contentTypes.contains(base)) {
        return kind;
      }
    }
    return HTML;
  }
}
