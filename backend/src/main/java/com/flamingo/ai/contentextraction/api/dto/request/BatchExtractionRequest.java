package com.flamingo.ai.contentextraction.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for extracting several documents in one call. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchExtractionRequest {

  @NotEmpty(message = "At least one document is required")
  @Valid
  private List<DocumentPayload> documents;
}
