package com.flamingo.ai.contentextraction.service.extraction;

import com.flamingo.ai.contentextraction.api.dto.request.DocumentPayload;
import com.flamingo.ai.contentextraction.api.dto.response.DocumentExtractionResult;
import com.flamingo.ai.contentextraction.service.model.ContentNode;
import com.flamingo.ai.contentextraction.service.model.DigestNode;
import com.flamingo.ai.contentextraction.service.parsing.MarkupKind;
import java.util.List;
import java.util.function.Consumer;

/** Runs markup through the section chunker and the digest flattener. */
public interface ContentExtractionService {

  /**
   * Parses markup and chunks it into a section tree.
   *
   * @throws com.flamingo.ai.contentextraction.exception.DocumentProcessingException if the markup
   *     cannot be processed
   */
  ContentNode chunk(String documentId, String markup, MarkupKind kind);

  /** Flattens a section tree into digest nodes in pre-order. */
  List<DigestNode> digest(ContentNode root);

  /**
   * Flattens a section tree, handing each node to {@code sink} as soon as it is hashed.
   *
   * @return number of nodes emitted
   */
  int digest(ContentNode root, Consumer<DigestNode> sink);

  /** Chunks and flattens one document. */
  List<DigestNode> extract(String documentId, String markup, MarkupKind kind);

  /** Chunks one document and streams its digest nodes to {@code sink}. */
  int extract(String documentId, String markup, MarkupKind kind, Consumer<DigestNode> sink);

  /**
   * Extracts every document on its own pipeline, in parallel. A failing document yields a failed
   * result and never affects the others.
   *
   * @return one result per document, in request order
   */
  List<DocumentExtractionResult> extractBatch(List<DocumentPayload> documents);

  /** Rebuilds a section tree from digest nodes in pre-order. */
  ContentNode reassemble(List<DigestNode> nodes);
}
