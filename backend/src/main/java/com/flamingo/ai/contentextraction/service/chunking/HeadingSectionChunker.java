package com.flamingo.ai.contentextraction.service.chunking;

import com.flamingo.ai.contentextraction.service.model.ContentNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.springframework.stereotype.Service;

/**
 * {@link SectionChunker} that decomposes markup recursively around its most significant heading.
 *
 * <p>A subtree with no heading becomes an untitled node, and one with a single heading becomes a
 * leaf. Otherwise the highest-ranked heading (first occurrence on ties) titles the node and every
 * other heading is routed either to a new subsection or to the open intermediate heading that
 * already nests it. When several headings share the top rank, the node stays untitled and each of
 * them opens a sibling subsection.
 *
 * <p>Each subsection is cloned into its own shell document before it is chunked again, so the
 * input tree is never modified and no node is shared between two trees.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HeadingSectionChunker implements SectionChunker {

  private final HeadingLevelResolver headingLevelResolver;
  private final ContentInclusionPolicy contentInclusionPolicy;
  private final RootElementSelector rootElementSelector;

  @Override
  public ContentNode chunk(Document document) {
    Element root = rootElementSelector.select(document);
    log.debug("Chunking from root <{}>", root.normalName());
    ContentNode node = chunk(root);
    log.debug(
        "Chunked document: title='{}', {} top-level subsections",
        node.title(),
        node.subsections().size());
    return node;
  }

  @Override
  public ContentNode chunk(Element root) {
    OptionalInt ownLevel = headingLevelResolver.resolve(root);
    if (ownLevel.isPresent()) {
      return chunkHeadingSection(new Heading(root, ownLevel.getAsInt()));
    }

    List<Heading> headings = headingLevelResolver.headingsWithin(root);
    if (headings.isEmpty()) {
      return ContentNode.untitled(
          contentInclusionPolicy.collectOwnContent(root, Set.of()), List.of());
    }
    if (headings.size() == 1) {
      Heading heading = headings.get(0);
      return new ContentNode(
          heading.title(),
          contentInclusionPolicy.collectOwnContent(root, Set.of()),
          heading.level(),
          List.of());
    }
    return decompose(root, headings);
  }

  // ---- private helpers ----

  /** A heading handed in as the root: chunk it together with the siblings it governs. */
  private ContentNode chunkHeadingSection(Heading heading) {
    Section section = new Section();
    section.add(heading.element(), sectionContent(heading));
    return chunk(isolate(section, heading.element()).body());
  }

  private ContentNode decompose(Element root, List<Heading> headings) {
    Heading anchor = headingLevelResolver.highest(headings).orElseThrow();
    boolean hasPeers =
        headings.stream().anyMatch(h -> h != anchor && h.level() == anchor.level());
    // Headings at or below the floor never adopt others. With peers the anchor rank opens sections.
    long floor = hasPeers ? (long) anchor.level() - 1 : anchor.level();

    Map<Node, Section> owners = new IdentityHashMap<>();
    List<PlacedHeading> placed = new ArrayList<>();
    List<Section> sections = new ArrayList<>();

    for (Heading candidate : headings) {
      if (!hasPeers && candidate == anchor) {
        placed.add(new PlacedHeading(candidate, null));
        continue;
      }
      Section owner = owners.get(candidate.element());
      if (owner == null) {
        owner = findOpenIntermediate(placed, candidate, floor);
        if (owner == null) {
          owner = new Section();
          sections.add(owner);
        }
        List<Node> content = sectionContent(candidate);
        owner.add(candidate.element(), content);
        claim(owners, candidate.element(), owner);
        for (Node node : content) {
          claim(owners, node, owner);
        }
      }
      placed.add(new PlacedHeading(candidate, owner));
    }

    Set<Node> skipped = Collections.newSetFromMap(new IdentityHashMap<>());
    skipped.addAll(owners.keySet());
    skipped.add(anchor.element());
    String ownText = contentInclusionPolicy.collectOwnContent(root, skipped);

    List<ContentNode> subsections = new ArrayList<>(sections.size());
    for (Section section : sections) {
      subsections.add(chunk(isolate(section, root).body()));
    }

    if (hasPeers) {
      return ContentNode.untitled(ownText, subsections);
    }
    return new ContentNode(anchor.title(), ownText, anchor.level(), subsections);
  }

  /**
   * Finds the section of the nearest earlier heading that still nests {@code candidate}: its rank
   * lies strictly between the floor and the candidate's, and no heading of equal or higher rank
   * has closed it since.
   */
  private Section findOpenIntermediate(
      List<PlacedHeading> placed, Heading candidate, long floor) {
    long closingLevel = Long.MAX_VALUE;
    for (int i = placed.size() - 1; i >= 0 && closingLevel > floor; i--) {
      PlacedHeading earlier = placed.get(i);
      int level = earlier.heading().level();
      if (earlier.owner() != null
          && level > floor
          && level < candidate.level()
          && level < closingLevel) {
        return earlier.owner();
      }
      closingLevel = Math.min(closingLevel, level);
    }
    return null;
  }

  /**
   * Collects the siblings following {@code heading} up to the next sibling that is, or contains, a
   * heading of equal or higher rank.
   */
  private List<Node> sectionContent(Heading heading) {
    List<Node> content = new ArrayList<>();
    for (Node sibling = heading.element().nextSibling();
        sibling != null;
        sibling = sibling.nextSibling()) {
      if (sibling instanceof Element element
          && headingLevelResolver.containsHeadingAtOrAbove(element, heading.level())) {
        break;
      }
      content.add(sibling);
    }
    return content;
  }

  private void claim(Map<Node, Section> owners, Node node, Section owner) {
    owners.put(node, owner);
    if (node instanceof Element element) {
      for (Element descendant : element.getAllElements()) {
        owners.put(descendant, owner);
      }
    }
  }

  /** Clones the section's headings and content, in document order, into a fresh shell document. */
  private Document isolate(Section section, Element source) {
    Document fragment = Document.createShell("");
    Document sourceDocument = source.ownerDocument();
    if (sourceDocument != null) {
      fragment.outputSettings(sourceDocument.outputSettings().clone());
    }
    fragment.outputSettings().prettyPrint(false);

    Element body = fragment.body();
    for (Member member : section.members) {
      body.appendChild(member.heading().clone());
      for (Node node : member.content()) {
        body.appendChild(node.clone());
      }
    }
    return fragment;
  }

  private record PlacedHeading(Heading heading, Section owner) {}

  private record Member(Element heading, List<Node> content) {}

  /** Headings routed to one subsection, each with the sibling content it governs. */
  private static final class Section {
    private final List<Member> members = new ArrayList<>();

    void add(Element heading, List<Node> content) {
      members.add(new Member(heading, content));
    }
  }
}
