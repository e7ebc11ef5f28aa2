package com.flamingo.ai.contentextraction.service.digest;

import com.flamingo.ai.contentextraction.service.model.ContentNode;
import com.flamingo.ai.contentextraction.service.model.DigestNode;
import com.flamingo.ai.contentextraction.service.model.SectionDigest;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Flattens a section tree into content-addressed {@link DigestNode}s in pre-order.
 *
 * <p>Each node is handed to the sink as soon as it is hashed, before any of its children, so the
 * output can be streamed and later reassembled from hash linkage alone.
 */
@Component
@RequiredArgsConstructor
public class DigestFlattener {

  private final SectionDigestFactory sectionDigestFactory;
  private final DigestHasher digestHasher;

  /**
   * Emits one {@link DigestNode} per node of the tree, parents before children.
   *
   * @param root root of the section tree
   * @param sink receives nodes in pre-order
   * @return number of nodes emitted
   */
  public int flatten(ContentNode root, Consumer<DigestNode> sink) {
    return visit(root, null, sink);
  }

  /** Flattens the tree into a list. */
  public List<DigestNode> flatten(ContentNode root) {
    List<DigestNode> nodes = new ArrayList<>();
    flatten(root, nodes::add);
    return nodes;
  }

  private int visit(ContentNode node, String parentDigestHash, Consumer<DigestNode> sink) {
    SectionDigest digest = sectionDigestFactory.create(node);
    String digestHash = digestHasher.hash(digest);
    sink.accept(new DigestNode(digestHash, parentDigestHash, node.title(), node.text(), digest));

    int emitted = 1;
    for (ContentNode child : node.subsections()) {
      emitted += visit(child, digestHash, sink);
    }
    return emitted;
  }
}
