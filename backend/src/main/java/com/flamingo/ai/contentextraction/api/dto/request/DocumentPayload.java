package com.flamingo.ai.contentextraction.api.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One document of a batch extraction request. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentPayload {

  /** Caller-chosen identifier echoed in the result. Generated when absent. */
  @Size(max = 200, message = "Document id must not exceed 200 characters")
  private String id;

  /** Raw markup. Blank markup fails only this document. */
  private String markup;

  /** Media type selecting the markup kind, {@code text/html} when absent. */
  private String contentType;
}
