package com.flamingo.ai.contentextraction.api.dto.response;

import com.flamingo.ai.contentextraction.domain.enums.ExtractionStatus;
import com.flamingo.ai.contentextraction.service.model.DigestNode;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Result of extracting one document of a batch. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentExtractionResult {

  private String id;
  private ExtractionStatus status;

  /** Flattened nodes in pre-order, empty when the document failed. */
  private List<DigestNode> nodes;

  private String error;

  /** Creates a successful result. */
  public static DocumentExtractionResult succeeded(String id, List<DigestNode> nodes) {
    return DocumentExtractionResult.builder()
        .id(id)
        .status(ExtractionStatus.SUCCEEDED)
        .nodes(nodes)
        .build();
  }

  /** Creates a failed result. */
  public static DocumentExtractionResult failed(String id, String error) {
    return DocumentExtractionResult.builder()
        .id(id)
        .status(ExtractionStatus.FAILED)
        .nodes(List.of())
        .error(error)
        .build();
  }
}
