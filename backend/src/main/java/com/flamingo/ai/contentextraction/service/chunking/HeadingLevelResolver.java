package com.flamingo.ai.contentextraction.service.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Decides whether an element is a heading and at which rank.
 *
 * <p>{@code h1} to {@code h6} imply ranks 1 to 6. A non-blank {@code aria-level} that parses as an
 * integer overrides the implied rank; a malformed value falls back to it. Any other element is a
 * heading only when it carries {@code role="heading"} together with a parseable {@code
 * aria-level}.
 */
@Component
@Slf4j
public class HeadingLevelResolver {

  static final String ARIA_LEVEL = "aria-level";
  static final String ROLE = "role";
  static final String HEADING_ROLE = "heading";

  /**
   * Resolves the effective rank of an element.
   *
   * @param element element to inspect
   * @return the rank, or empty if the element is not a heading
   */
  public OptionalInt resolve(Element element) {
    OptionalInt implied = impliedLevel(element);
    if (implied.isPresent()) {
      OptionalInt override = ariaLevel(element);
      return override.isPresent() ? override : implied;
    }
    if (HEADING_ROLE.equalsIgnoreCase(element.attr(ROLE).trim())) {
      return ariaLevel(element);
    }
    return OptionalInt.empty();
  }

  public boolean isHeading(Element element) {
    return resolve(element).isPresent();
  }

  /**
   * Returns the headings below {@code root} in document order, excluding {@code root} itself and
   * any heading nested inside another heading.
   */
  public List<Heading> headingsWithin(Element root) {
    List<Heading> headings = new ArrayList<>();
    for (Element element : root.getAllElements()) {
      if (element == root || hasHeadingAncestor(element, root)) {
        continue;
      }
      OptionalInt level = resolve(element);
      if (level.isPresent()) {
        headings.add(new Heading(element, level.getAsInt()));
      }
    }
    return headings;
  }

  /** Returns {@code true} if any descendant of {@code element} is a heading. */
  public boolean containsHeading(Element element) {
    for (Element descendant : element.getAllElements()) {
      if (descendant != element && isHeading(descendant)) {
        return true;
      }
    }
    return false;
  }

  /** Whether {@code element} or one of its descendants is a heading of rank {@code <= level}. */
  public boolean containsHeadingAtOrAbove(Element element, int level) {
    for (Element candidate : element.getAllElements()) {
      OptionalInt resolved = resolve(candidate);
      if (resolved.isPresent() && resolved.getAsInt() <= level) {
        return true;
      }
    }
    return false;
  }

  /**
   * Picks the most significant heading. Ties go to the first in document order.
   *
   * @param headings headings in document order
   * @return the highest-ranked heading, empty if the list is empty
   */
  public Optional<Heading> highest(List<Heading> headings) {
    Heading best = null;
    for (Heading heading : headings) {
      if (best == null || heading.level() < best.level()) {
        best = heading;
      }
    }
    return Optional.ofNullable(best);
  }

  // ---- private helpers ----

  private boolean hasHeadingAncestor(Element element, Element root) {
    for (Element parent = element.parent();
        parent != null && parent != root;
        parent = parent.parent()) {
      if (isHeading(parent)) {
        return true;
      }
    }
    return false;
  }

  private OptionalInt impliedLevel(Element element) {
    String name = element.normalName();
    if (name.length() == 2 && name.charAt(0) == 'h') {
      char rank = name.charAt(1);
      if (rank >= '1' && rank <= '6') {
        return OptionalInt.of(rank - '0');
      }
    }
    return OptionalInt.empty();
  }

  private OptionalInt ariaLevel(Element element) {
    String raw = element.attr(ARIA_LEVEL).trim();
    if (raw.isEmpty()) {
      return OptionalInt.empty();
    }
    try {
      return OptionalInt.of(Integer.parseInt(raw));
    } catch (NumberFormatException e) {
      log.debug("Ignoring malformed {}='{}' on <{}>", ARIA_LEVEL, raw, element.normalName());
      return OptionalInt.empty();
    }
  }
}
