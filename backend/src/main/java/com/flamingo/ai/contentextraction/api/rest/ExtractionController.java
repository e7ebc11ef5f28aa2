package com.flamingo.ai.contentextraction.api.rest;

import com.flamingo.ai.contentextraction.api.dto.request.BatchExtractionRequest;
import com.flamingo.ai.contentextraction.api.dto.response.BatchExtractionResponse;
import com.flamingo.ai.contentextraction.api.dto.response.DocumentExtractionResult;
import com.flamingo.ai.contentextraction.service.digest.DigestNodeWriter;
import com.flamingo.ai.contentextraction.service.extraction.ContentExtractionService;
import com.flamingo.ai.contentextraction.service.model.ContentNode;
import com.flamingo.ai.contentextraction.service.model.DigestNode;
import com.flamingo.ai.contentextraction.service.parsing.MarkupKind;
import jakarta.validation.Valid;
import java.io.IOException;
import java.io.StringReader;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

/** REST controller for section chunking and digest flattening. */
@RestController
@RequestMapping("/api/extraction")
@RequiredArgsConstructor
public class ExtractionController {

  private final ContentExtractionService extractionService;
  private final DigestNodeWriter digestNodeWriter;

  /** Chunks markup into a section tree. */
  @PostMapping(
      value = "/sections",
      consumes = {
        MediaType.TEXT_HTML_VALUE,
        MediaType.APPLICATION_XHTML_XML_VALUE,
        MediaType.APPLICATION_XML_VALUE,
        MediaType.TEXT_XML_VALUE,
        MediaType.TEXT_PLAIN_VALUE
      },
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ContentNode> chunkSections(
      @RequestBody String markup,
      @RequestHeader(HttpHeaders.CONTENT_TYPE) String contentType,
      @RequestParam(required = false) String documentId) {
    ContentNode root =
        extractionService.chunk(
            resolveId(documentId), markup, MarkupKind.fromContentType(contentType));
    return ResponseEntity.ok(root);
  }

  /** Chunks markup and streams its digest nodes as JSON Lines. */
  @PostMapping(
      value = "/documents",
      consumes = {
        MediaType.TEXT_HTML_VALUE,
        MediaType.APPLICATION_XHTML_XML_VALUE,
        MediaType.APPLICATION_XML_VALUE,
        MediaType.TEXT_XML_VALUE,
        MediaType.TEXT_PLAIN_VALUE
      })
  public ResponseEntity<StreamingResponseBody> extractDocument(
      @RequestBody String markup,
      @RequestHeader(HttpHeaders.CONTENT_TYPE) String contentType,
      @RequestParam(required = false) String documentId) {
    // Chunk before streaming so markup errors still map to an error status.
    ContentNode root =
        extractionService.chunk(
            resolveId(documentId), markup, MarkupKind.fromContentType(contentType));
    return streamDigests(root);
  }

  /** Flattens a section tree and streams its digest nodes as JSON Lines. */
  @PostMapping(value = "/digests", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<StreamingResponseBody> digestSections(@RequestBody ContentNode root) {
    return streamDigests(root);
  }

  /** Rebuilds a section tree from JSON Lines digest nodes. */
  @PostMapping(
      value = "/digests/tree",
      consumes = {MediaType.APPLICATION_NDJSON_VALUE, MediaType.TEXT_PLAIN_VALUE},
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ContentNode> reassemble(@RequestBody String jsonLines) {
    List<DigestNode> nodes;
    try {
      nodes = digestNodeWriter.readAll(new StringReader(jsonLines));
    } catch (IOException e) {
      throw new IllegalArgumentException("Malformed digest node stream: " + e.getMessage(), e);
    }
    return ResponseEntity.ok(extractionService.reassemble(nodes));
  }

  /** Extracts several documents in parallel; failures are reported per document. */
  @PostMapping(
      value = "/documents/batch",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<BatchExtractionResponse> extractBatch(
      @Valid @RequestBody BatchExtractionRequest request) {
    List<DocumentExtractionResult> results =
        extractionService.extractBatch(request.getDocuments());
    return ResponseEntity.ok(BatchExtractionResponse.of(results));
  }

  // ---- private helpers ----

  private ResponseEntity<StreamingResponseBody> streamDigests(ContentNode root) {
    if (root == null) {
      throw new IllegalArgumentException("No section tree provided");
    }
    StreamingResponseBody body =
        out -> extractionService.digest(root, digestNodeWriter.sinkFor(out));
    return ResponseEntity.ok().contentType(MediaType.APPLICATION_NDJSON).body(body);
  }

  private String resolveId(String documentId) {
    return documentId == null || documentId.isBlank()
        ? UUID.randomUUID().toString().substring(0, 8)
        : documentId;
  }
}
