package com.flamingo.ai.contentextraction.domain.enums;

/** Outcome of extracting one document of a batch. */
public enum ExtractionStatus {
  /** The document was chunked and flattened. */
  SUCCEEDED,

  /** The document could not be processed; the other documents of the batch are unaffected. */
  FAILED
}
