package com.flamingo.ai.contentextraction.service.digest;

import com.flamingo.ai.contentextraction.config.ExtractionConfig;
import com.flamingo.ai.contentextraction.service.model.ContentNode;
import com.flamingo.ai.contentextraction.service.model.SectionDigest;
import com.flamingo.ai.contentextraction.service.model.SubsectionDigest;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds the {@link SectionDigest} of a node. Children are shortened to the configured line cap
 * when the node has text of its own and shown in full otherwise.
 */
@Component
@RequiredArgsConstructor
public class SectionDigestFactory {

  private final TextShortener textShortener;
  private final ExtractionConfig extractionConfig;

  public SectionDigest create(ContentNode node) {
    int childCap =
        node.text().isEmpty()
            ? TextShortener.NO_LIMIT
            : extractionConfig.getDigest().getParentTextLineCap();

    List<SubsectionDigest> children = new ArrayList<>(node.subsections().size());
    for (ContentNode child : node.subsections()) {
      children.add(
          new SubsectionDigest(
              child.title(), textShortener.shorten(child.text(), childCap, child.subsections())));
    }
    return new SectionDigest(node.title(), node.text(), children);
  }
}
