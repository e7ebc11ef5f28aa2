package com.flamingo.ai.contentextraction.api.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.contentextraction.TestExtractionComponents;
import com.flamingo.ai.contentextraction.api.dto.request.BatchExtractionRequest;
import com.flamingo.ai.contentextraction.api.dto.request.DocumentPayload;
import com.flamingo.ai.contentextraction.config.ExtractionConfig;
import com.flamingo.ai.contentextraction.exception.GlobalExceptionHandler;
import com.flamingo.ai.contentextraction.service.digest.DigestNodeWriter;
import com.flamingo.ai.contentextraction.service.digest.DigestTreeAssembler;
import com.flamingo.ai.contentextraction.service.extraction.ContentExtractionServiceImpl;
import com.flamingo.ai.contentextraction.service.model.ContentNode;
import com.flamingo.ai.contentextraction.service.model.DigestNode;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.StringReader;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@DisplayName("ExtractionController Tests")
class ExtractionControllerTest {

  private static final String EXAMPLE =
      "<h1>T</h1><p>A</p><h2>S1</h2><p>B</p><h2>S2</h2><p>C</p>";

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;
  private DigestNodeWriter digestNodeWriter;
  private MeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    ExtractionConfig config = new ExtractionConfig();
    objectMapper = new ObjectMapper();
    meterRegistry = new SimpleMeterRegistry();
    digestNodeWriter = TestExtractionComponents.digestNodeWriter();
    ContentExtractionServiceImpl service =
        new ContentExtractionServiceImpl(
            TestExtractionComponents.markupParser(config),
            TestExtractionComponents.sectionChunker(config),
            TestExtractionComponents.digestFlattener(config),
            new DigestTreeAssembler(),
            config,
            meterRegistry,
            Runnable::run);

    mockMvc =
        MockMvcBuilders.standaloneSetup(new ExtractionController(service, digestNodeWriter))
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .build();
  }

  @Test
  @DisplayName("should return the section tree for HTML")
  void shouldReturnSectionTree_whenHtmlPosted() throws Exception {
    mockMvc
        .perform(post("/api/extraction/sections").contentType(MediaType.TEXT_HTML).content(EXAMPLE))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.title").value("T"))
        .andExpect(jsonPath("$.text").value("<p>A</p>"))
        .andExpect(jsonPath("$.level").value(1))
        .andExpect(jsonPath("$.subsections[0].title").value("S1"))
        .andExpect(jsonPath("$.subsections[1].text").value("<p>C</p>"))
        .andExpect(jsonPath("$.subsections[1].subsections").isEmpty());
  }

  @Test
  @DisplayName("should return 422 with error body for blank markup")
  void shouldReturnUnprocessable_whenMarkupBlank() throws Exception {
    mockMvc
        .perform(post("/api/extraction/sections").contentType(MediaType.TEXT_HTML).content("   "))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("DOCUMENT_003"))
        .andExpect(jsonPath("$.message").value("No markup provided"))
        .andExpect(jsonPath("$.path").value("/api/extraction/sections"));

    assertThat(
            meterRegistry.counter("api_errors_total", "error_type", "document_processing").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("should stream digest nodes as JSON Lines for a document")
  void shouldStreamJsonLines_whenDocumentPosted() throws Exception {
    MvcResult started =
        mockMvc
            .perform(
                post("/api/extraction/documents").contentType(MediaType.TEXT_HTML).content(EXAMPLE))
            .andExpect(request().asyncStarted())
            .andReturn();

    MvcResult result =
        mockMvc
            .perform(asyncDispatch(started))
            .andExpect(status().isOk())
            .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_NDJSON))
            .andReturn();

    List<DigestNode> nodes =
        digestNodeWriter.readAll(new StringReader(result.getResponse().getContentAsString()));
    assertThat(nodes).extracting(DigestNode::title).containsExactly("T", "S1", "S2");
    assertThat(nodes.get(1).parentDigestHash()).isEqualTo(nodes.get(0).digestHash());
  }

  @Test
  @DisplayName("should flatten a posted section tree")
  void shouldStreamJsonLines_whenTreePosted() throws Exception {
    ContentNode tree =
        new ContentNode("", "", null, List.of(new ContentNode("X", "<p>x</p>", 2, List.of())));

    MvcResult started =
        mockMvc
            .perform(
                post("/api/extraction/digests")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(tree)))
            .andExpect(request().asyncStarted())
            .andReturn();
    MvcResult result =
        mockMvc.perform(asyncDispatch(started)).andExpect(status().isOk()).andReturn();

    String body = result.getResponse().getContentAsString();
    assertThat(body.split("\n")).hasSize(2);
    assertThat(body).contains("\"digest_hash\"").contains("\"section_digest\"");
  }

  @Test
  @DisplayName("should rebuild a tree from JSON Lines")
  void shouldReassembleTree_whenJsonLinesPosted() throws Exception {
    MvcResult started =
        mockMvc
            .perform(
                post("/api/extraction/documents").contentType(MediaType.TEXT_HTML).content(EXAMPLE))
            .andReturn();
    String jsonLines =
        mockMvc.perform(asyncDispatch(started)).andReturn().getResponse().getContentAsString();

    mockMvc
        .perform(
            post("/api/extraction/digests/tree")
                .contentType(MediaType.APPLICATION_NDJSON)
                .content(jsonLines))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.title").value("T"))
        .andExpect(jsonPath("$.level").doesNotExist())
        .andExpect(jsonPath("$.subsections.length()").value(2));
  }

  @Test
  @DisplayName("should return 400 for malformed JSON Lines")
  void shouldReturnBadRequest_whenJsonLinesMalformed() throws Exception {
    mockMvc
        .perform(
            post("/api/extraction/digests/tree")
                .contentType(MediaType.APPLICATION_NDJSON)
                .content("not json"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));
  }

  @Test
  @DisplayName("should report per-document outcomes for a batch")
  void shouldReportOutcomes_whenBatchPosted() throws Exception {
    BatchExtractionRequest request =
        BatchExtractionRequest.builder()
            .documents(
                List.of(
                    DocumentPayload.builder().id("ok").markup(EXAMPLE).build(),
                    DocumentPayload.builder().id("bad").markup(" ").build()))
            .build();

    mockMvc
        .perform(
            post("/api/extraction/documents/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.succeeded").value(1))
        .andExpect(jsonPath("$.failed").value(1))
        .andExpect(jsonPath("$.results[0].id").value("ok"))
        .andExpect(jsonPath("$.results[0].nodes.length()").value(3))
        .andExpect(jsonPath("$.results[0].nodes[0].digest_hash").isString())
        .andExpect(jsonPath("$.results[1].status").value("FAILED"))
        .andExpect(jsonPath("$.results[1].error").value("No markup provided"));
  }

  @Test
  @DisplayName("should return 400 for an empty batch")
  void shouldReturnBadRequest_whenBatchEmpty() throws Exception {
    mockMvc
        .perform(
            post("/api/extraction/documents/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"documents\":[]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"))
        .andExpect(jsonPath("$.message").value("documents: At least one document is required"));
  }

  @Test
  @DisplayName("should return 415 for unsupported content types")
  void shouldReturnUnsupportedMediaType_whenContentTypeUnknown() throws Exception {
    mockMvc
        .perform(
            post("/api/extraction/sections")
                .contentType(MediaType.APPLICATION_PDF)
                .content("%PDF"))
        .andExpect(status().isUnsupportedMediaType());
  }
}
