package com.flamingo.ai.contentextraction.service.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Flattened, content-addressed form of a {@link ContentNode}.
 *
 * @param digestHash lowercase hex hash of {@code sectionDigest}
 * @param parentDigestHash hash of the parent node, {@code null} for the root
 * @param title copied from the source node
 * @param text copied from the source node
 * @param sectionDigest the digest the hash was computed from
 */
@JsonPropertyOrder({"digest_hash", "parent_digest_hash", "title", "text", "section_digest"})
public record DigestNode(
    @JsonProperty("digest_hash") String digestHash,
    @JsonProperty("parent_digest_hash") String parentDigestHash,
    @JsonProperty("title") String title,
    @JsonProperty("text") String text,
    @JsonProperty("section_digest") SectionDigest sectionDigest) {

  /** Returns {@code true} if this node has no parent. */
  @JsonIgnore
  public boolean isRoot() {
    return parentDigestHash == null;
  }
}
