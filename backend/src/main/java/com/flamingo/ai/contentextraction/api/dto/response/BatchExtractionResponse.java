package com.flamingo.ai.contentextraction.api.dto.response;

import com.flamingo.ai.contentextraction.domain.enums.ExtractionStatus;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a batch extraction, results in request order. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchExtractionResponse {

  private List<DocumentExtractionResult> results;
  private int succeeded;
  private int failed;

  /** Creates a response and tallies the outcomes. */
  public static BatchExtractionResponse of(List<DocumentExtractionResult> results) {
    int failedCount =
        (int) results.stream().filter(r -> r.getStatus() == ExtractionStatus.FAILED).count();
    return BatchExtractionResponse.builder()
        .results(results)
        .succeeded(results.size() - failedCount)
        .failed(failedCount)
        .build();
  }
}
