package com.flamingo.ai.contentextraction.service.digest;

import com.flamingo.ai.contentextraction.service.model.ContentNode;
import com.flamingo.ai.contentextraction.service.model.DigestNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Rebuilds a section tree from a pre-order sequence of {@link DigestNode}s using only {@code
 * digest_hash} and {@code parent_digest_hash}.
 *
 * <p>Levels are not part of a digest, so every rebuilt node has a {@code null} level. Identical
 * subtrees share a hash; the stack of open ancestors keeps them apart.
 */
@Component
public class DigestTreeAssembler {

  public ContentNode assemble(List<DigestNode> nodes) {
    if (nodes == null || nodes.isEmpty()) {
      throw new IllegalArgumentException("No digest nodes provided");
    }
    DigestNode first = nodes.get(0);
    if (!first.isRoot()) {
      throw new IllegalArgumentException(
          "First digest node must be a root but has parent " + first.parentDigestHash());
    }

    PendingNode root = new PendingNode(first);
    Deque<PendingNode> ancestors = new ArrayDeque<>();
    ancestors.push(root);

    for (int i = 1; i < nodes.size(); i++) {
      DigestNode node = nodes.get(i);
      if (node.isRoot()) {
        throw new IllegalArgumentException("Digest node " + i + " is a second root");
      }
      while (!ancestors.isEmpty()
          && !Objects.equals(ancestors.peek().source.digestHash(), node.parentDigestHash())) {
        ancestors.pop();
      }
      if (ancestors.isEmpty()) {
        throw new IllegalArgumentException(
            "Digest node "
                + i
                + " references unknown parent "
                + node.parentDigestHash());
      }
      PendingNode pending = new PendingNode(node);
      ancestors.peek().children.add(pending);
      ancestors.push(pending);
    }
    return root.toContentNode();
  }

  private static final class PendingNode {
    private final DigestNode source;
    private final List<PendingNode> children = new ArrayList<>();

    PendingNode(DigestNode source) {
      this.source = source;
    }

    ContentNode toContentNode() {
      List<ContentNode> subsections = new ArrayList<>(children.size());
      for (PendingNode child : children) {
        subsections.add(child.toContentNode());
      }
      return new ContentNode(source.title(), source.text(), null, subsections);
    }
  }
}
