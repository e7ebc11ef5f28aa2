package com.flamingo.ai.contentextraction.service.parsing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.contentextraction.config.ExtractionConfig;
import com.flamingo.ai.contentextraction.exception.DocumentProcessingException;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("JsoupMarkupParser Tests")
class JsoupMarkupParserTest {

  private ExtractionConfig config;
  private JsoupMarkupParser parser;

  @BeforeEach
  void setUp() {
    config = new ExtractionConfig();
    parser = new JsoupMarkupParser(config);
  }

  @Test
  @DisplayName("should parse HTML without pretty printing")
  void shouldParseHtml_whenMarkupGiven() {
    Document document = parser.parse("doc-1", "<h1>T</h1><p>A</p>", MarkupKind.HTML);

    assertThat(document.body().html()).isEqualTo("<h1>T</h1><p>A</p>");
  }

  @Test
  @DisplayName("should parse XHTML with the XML parser")
  void shouldParseXhtml_whenKindIsXhtml() {
    String xhtml =
        "<?xml version=\"1.0\"?><html xmlns=\"http://www.w3.org/1999/xhtml\">"
            + "<body><h1>X</h1><p>y</p></body></html>";

    Document document = parser.parse("doc-2", xhtml, MarkupKind.XHTML);

    assertThat(document.selectFirst("body")).isNotNull();
    assertThat(document.selectFirst("h1").text()).isEqualTo("X");
  }

  @Test
  @DisplayName("should default to HTML when kind is null")
  void shouldDefaultToHtml_whenKindIsNull() {
    Document document = parser.parse("doc-3", "<p>x</p>", null);

    assertThat(document.body().child(0).normalName()).isEqualTo("p");
  }

  @Test
  @DisplayName("should reject blank markup")
  void shouldThrow_whenMarkupBlank() {
    assertThatThrownBy(() -> parser.parse("doc-4", "  \n ", MarkupKind.HTML))
        .isInstanceOf(DocumentProcessingException.class)
        .hasMessage("No markup provided")
        .extracting(e -> ((DocumentProcessingException) e).getDocumentId())
        .isEqualTo("doc-4");
  }

  @Test
  @DisplayName("should reject markup over the configured length")
  void shouldThrow_whenMarkupTooLong() {
    config.getChunking().setMaxMarkupLength(10);

    assertThatThrownBy(() -> parser.parse("doc-5", "<p>0123456789</p>", MarkupKind.HTML))
        .isInstanceOf(DocumentProcessingException.class)
        .satisfies(
            e ->
                assertThat(((DocumentProcessingException) e).getUserMessage())
                    .isEqualTo("Document is too large to process"));
  }
}
