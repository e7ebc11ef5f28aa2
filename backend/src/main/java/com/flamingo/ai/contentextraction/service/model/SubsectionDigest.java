package com.flamingo.ai.contentextraction.service.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Title and shortened text of one direct child inside a {@link SectionDigest}. */
@JsonPropertyOrder({"title", "text"})
public record SubsectionDigest(String title, String text) {

  public SubsectionDigest {
    title = title == null ? "" : title;
    text = text == null ? "" : text;
  }
}
