package com.flamingo.ai.contentextraction.service.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.OptionalInt;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("HeadingLevelResolver Tests")
class HeadingLevelResolverTest {

  private HeadingLevelResolver resolver;

  @BeforeEach
  void setUp() {
    resolver = new HeadingLevelResolver();
  }

  @ParameterizedTest(name = "{0} -> {1}")
  @CsvSource(
      delimiter = '|',
      value = {
        "<h1>T</h1>                                     | 1",
        "<h6>T</h6>                                     | 6",
        "<h2 aria-level=\"4\">T</h2>                     | 4",
        "<h6 aria-level=\"7\">T</h6>                     | 7",
        "<h2 aria-level=\" 5 \">T</h2>                   | 5",
        "<h2 aria-level=\"\">T</h2>                      | 2",
        "<h3 aria-level=\"abc\">T</h3>                   | 3",
        "<h3 aria-level=\"2.5\">T</h3>                   | 3",
        "<h2 aria-level=\"0\">T</h2>                     | 0",
        "<h2 aria-level=\"-1\">T</h2>                    | -1",
        "<div role=\"heading\" aria-level=\"3\">T</div>  | 3",
        "<div role=\"HEADING\" aria-level=\"1\">T</div>  | 1",
        "<span role=\"heading\" aria-level=\"2\">T</span>| 2"
      })
  @DisplayName("should resolve heading rank with aria-level override")
  void shouldResolveRank_whenElementIsHeading(String html, int expected) {
    assertThat(resolver.resolve(element(html.trim()))).hasValue(expected);
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "<div role=\"heading\">T</div>",
        "<div role=\"heading\" aria-level=\"\">T</div>",
        "<div role=\"heading\" aria-level=\"bad\">T</div>",
        "<span aria-level=\"2\">T</span>",
        "<p>T</p>",
        "<header>T</header>",
        "<hr>"
      })
  @DisplayName("should not treat element as heading without a usable rank")
  void shouldReturnEmpty_whenElementIsNotHeading(String html) {
    assertThat(resolver.resolve(element(html))).isEqualTo(OptionalInt.empty());
  }

  @Test
  @DisplayName("should list headings in document order excluding the root")
  void shouldListHeadingsInDocumentOrder_whenNested() {
    Element root =
        Jsoup.parseBodyFragment(
                "<section><h2>A</h2><div><h3>B</h3></div>"
                    + "<div role=\"heading\" aria-level=\"1\">C</div></section>")
            .body()
            .child(0);

    List<Heading> headings = resolver.headingsWithin(root);

    assertThat(headings).extracting(Heading::title).containsExactly("A", "B", "C");
    assertThat(headings).extracting(Heading::level).containsExactly(2, 3, 1);
  }

  @Test
  @DisplayName("should ignore a heading nested inside another heading")
  void shouldIgnoreHeading_whenNestedInsideHeading() {
    Element root =
        Jsoup.parseBodyFragment(
                "<div><div role=\"heading\" aria-level=\"1\">Outer <h4>Inner</h4></div></div>")
            .body()
            .child(0);

    assertThat(resolver.headingsWithin(root)).extracting(Heading::level).containsExactly(1);
  }

  @Test
  @DisplayName("should pick the first of equally ranked headings as highest")
  void shouldPickFirstOccurrence_whenRanksTie() {
    Element root =
        Jsoup.parseBodyFragment("<h2>A</h2><h1>B</h1><h3>C</h3><h1>D</h1>").body();

    Heading highest = resolver.highest(resolver.headingsWithin(root)).orElseThrow();

    assertThat(highest.title()).isEqualTo("B");
  }

  @Test
  @DisplayName("should detect headings at or above a rank inside containers")
  void shouldDetectHeadingAtOrAbove_whenContainerHoldsOne() {
    Element container = element("<div><p>x</p><h2>Y</h2></div>");

    assertThat(resolver.containsHeadingAtOrAbove(container, 2)).isTrue();
    assertThat(resolver.containsHeadingAtOrAbove(container, 1)).isFalse();
    assertThat(resolver.containsHeading(container)).isTrue();
  }

  private Element element(String html) {
    return Jsoup.parseBodyFragment(html).body().child(0);
  }
}
