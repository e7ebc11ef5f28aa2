package com.flamingo.ai.contentextraction.service.chunking;

import com.flamingo.ai.contentextraction.service.model.ContentNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Turns a parsed markup tree into a hierarchical {@link ContentNode} tree that follows its
 * headings.
 *
 * <p>Implementations must be stateless and must not modify the tree they are given.
 */
public interface SectionChunker {

  /**
   * Selects the primary content region of the document and chunks it.
   *
   * @param document parsed document
   * @return the root node of the section tree
   */
  ContentNode chunk(Document document);

  /**
   * Chunks the subtree rooted at {@code root}.
   *
   * @param root element to decompose
   * @return the node describing {@code root}
   */
  ContentNode chunk(Element root);
}
