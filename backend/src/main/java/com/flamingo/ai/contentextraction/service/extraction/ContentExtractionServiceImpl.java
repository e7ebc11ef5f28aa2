package com.flamingo.ai.contentextraction.service.extraction;

import com.flamingo.ai.contentextraction.api.dto.request.DocumentPayload;
import com.flamingo.ai.contentextraction.api.dto.response.DocumentExtractionResult;
import com.flamingo.ai.contentextraction.config.ExtractionConfig;
import com.flamingo.ai.contentextraction.exception.DocumentProcessingException;
import com.flamingo.ai.contentextraction.service.chunking.SectionChunker;
import com.flamingo.ai.contentextraction.service.digest.DigestFlattener;
import com.flamingo.ai.contentextraction.service.digest.DigestTreeAssembler;
import com.flamingo.ai.contentextraction.service.model.ContentNode;
import com.flamingo.ai.contentextraction.service.model.DigestNode;
import com.flamingo.ai.contentextraction.service.parsing.MarkupKind;
import com.flamingo.ai.contentextraction.service.parsing.MarkupParser;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Orchestrates extraction: parse, chunk, flatten.
 *
 * <p>Every document gets its own parsed tree and section tree, and the collaborators are
 * stateless, so batch documents run concurrently on {@code documentProcessingExecutor} without
 * coordination.
 *
 * <p>Batch documents run through internal calls that bypass the {@code @Timed} proxy, so each one
 * is timed explicitly as {@code extraction.document.duration}.
 */
@Service
@Slf4j
public class ContentExtractionServiceImpl implements ContentExtractionService {

  private final MarkupParser markupParser;
  private final SectionChunker sectionChunker;
  private final DigestFlattener digestFlattener;
  private final DigestTreeAssembler digestTreeAssembler;
  private final ExtractionConfig extractionConfig;
  private final MeterRegistry meterRegistry;
  private final Executor documentProcessingExecutor;

  public ContentExtractionServiceImpl(
      MarkupParser markupParser,
      SectionChunker sectionChunker,
      DigestFlattener digestFlattener,
      DigestTreeAssembler digestTreeAssembler,
      ExtractionConfig extractionConfig,
      MeterRegistry meterRegistry,
      @Qualifier("documentProcessingExecutor") Executor documentProcessingExecutor) {
    this.markupParser = markupParser;
    this.sectionChunker = sectionChunker;
    this.digestFlattener = digestFlattener;
    this.digestTreeAssembler = digestTreeAssembler;
    this.extractionConfig = extractionConfig;
    this.meterRegistry = meterRegistry;
    this.documentProcessingExecutor = documentProcessingExecutor;
  }

  @Override
  @Timed(value = "extraction.chunk", description = "Time to parse and chunk a document")
  public ContentNode chunk(String documentId, String markup, MarkupKind kind) {
    try {
      Document document = markupParser.parse(documentId, markup, kind);
      ContentNode root = sectionChunker.chunk(document);
      recordOutcome("success");
      log.debug(
          "Document {} chunked: title='{}', {} top-level subsections",
          documentId,
          root.title(),
          root.subsections().size());
      return root;
    } catch (DocumentProcessingException e) {
      recordOutcome("failure");
      throw e;
    } catch (RuntimeException e) {
      recordOutcome("failure");
      log.error("Chunking failed for document {}: {}", documentId, e.getMessage(), e);
      throw new DocumentProcessingException(
          documentId, "Failed to chunk document: " + e.getMessage(), e);
    }
  }

  @Override
  public List<DigestNode> digest(ContentNode root) {
    List<DigestNode> nodes = new ArrayList<>();
    digest(root, nodes::add);
    return nodes;
  }

  @Override
  @Timed(value = "extraction.digest", description = "Time to flatten a section tree")
  public int digest(ContentNode root, Consumer<DigestNode> sink) {
    if (root == null) {
      throw new IllegalArgumentException("No section tree provided");
    }
    int emitted = digestFlattener.flatten(root, sink);
    meterRegistry.counter("extraction_nodes_total").increment(emitted);
    log.debug("Flattened section tree into {} digest nodes", emitted);
    return emitted;
  }

  @Override
  public List<DigestNode> extract(String documentId, String markup, MarkupKind kind) {
    List<DigestNode> nodes = new ArrayList<>();
    extract(documentId, markup, kind, nodes::add);
    return nodes;
  }

  @Override
  public int extract(
      String documentId, String markup, MarkupKind kind, Consumer<DigestNode> sink) {
    ContentNode root = chunk(documentId, markup, kind);
    return digest(root, sink);
  }

  @Override
  @Timed(value = "extraction.batch", description = "Time to extract a batch of documents")
  public List<DocumentExtractionResult> extractBatch(List<DocumentPayload> documents) {
    if (documents == null || documents.isEmpty()) {
      throw new IllegalArgumentException("At least one document is required");
    }
    int maxDocuments = extractionConfig.getBatch().getMaxDocuments();
    if (documents.size() > maxDocuments) {
      throw new IllegalArgumentException(
          "Batch of " + documents.size() + " documents exceeds limit " + maxDocuments);
    }

    List<CompletableFuture<DocumentExtractionResult>> futures = new ArrayList<>(documents.size());
    for (int i = 0; i < documents.size(); i++) {
      DocumentPayload payload = documents.get(i);
      String documentId = resolveId(payload, i);
      futures.add(submit(documentId, payload));
    }

    List<DocumentExtractionResult> results = new ArrayList<>(futures.size());
    for (CompletableFuture<DocumentExtractionResult> future : futures) {
      results.add(future.join());
    }
    long failed = results.stream().filter(r -> r.getError() != null).count();
    log.info("Batch extraction finished: {} documents, {} failed", results.size(), failed);
    return results;
  }

  @Override
  public ContentNode reassemble(List<DigestNode> nodes) {
    ContentNode root = digestTreeAssembler.assemble(nodes);
    log.debug("Reassembled section tree from {} digest nodes", nodes.size());
    return root;
  }

  // ---- private helpers ----

  private CompletableFuture<DocumentExtractionResult> submit(
      String documentId, DocumentPayload payload) {
    try {
      return CompletableFuture.supplyAsync(
          () -> extractOne(documentId, payload), documentProcessingExecutor);
    } catch (RejectedExecutionException e) {
      log.warn("Document {} rejected by executor: {}", documentId, e.getMessage());
      recordOutcome("rejected");
      return CompletableFuture.completedFuture(
          DocumentExtractionResult.failed(
              documentId, "Extraction capacity exhausted, please retry later"));
    }
  }

  private DocumentExtractionResult extractOne(String documentId, DocumentPayload payload) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      MarkupKind kind = MarkupKind.fromContentType(payload.getContentType());
      List<DigestNode> nodes = extract(documentId, payload.getMarkup(), kind);
      return DocumentExtractionResult.succeeded(documentId, nodes);
    } catch (DocumentProcessingException e) {
      log.warn("Document {} failed: {}", documentId, e.getMessage());
      return DocumentExtractionResult.failed(documentId, e.getMessage());
    } catch (RuntimeException e) {
      log.warn("Document {} failed unexpectedly: {}", documentId, e.getMessage(), e);
      return DocumentExtractionResult.failed(documentId, "Failed to process document");
    } finally {
      sample.stop(meterRegistry.timer("extraction.document.duration"));
    }
  }

  private String resolveId(DocumentPayload payload, int index) {
    String id = payload == null ? null : payload.getId();
    return id == null || id.isBlank() ? "document-" + (index + 1) : id;
  }

  private void recordOutcome(String outcome) {
    meterRegistry.counter("extraction_documents_total", "outcome", outcome).increment();
  }
}
