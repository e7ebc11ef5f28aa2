package com.flamingo.ai.contentextraction.service.digest;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.flamingo.ai.contentextraction.service.model.DigestNode;
import java.io.IOException;
import java.io.OutputStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Reads and writes {@link DigestNode}s as JSON Lines, one compact object per line. */
@Component
@RequiredArgsConstructor
public class DigestNodeWriter {

  private static final byte NEWLINE = '\n';

  private final ObjectMapper objectMapper;

  /** Writes one node followed by a newline and flushes. */
  public void write(DigestNode node, OutputStream out) throws IOException {
    ObjectWriter writer = objectMapper.writerFor(DigestNode.class);
    out.write(writer.writeValueAsBytes(node));
    out.write(NEWLINE);
    out.flush();
  }

  /** Writes all nodes in order. */
  public void writeAll(List<DigestNode> nodes, OutputStream out) throws IOException {
    for (DigestNode node : nodes) {
      write(node, out);
    }
  }

  /**
   * Returns a sink that writes each node it receives to {@code out}. I/O failures surface as
   * {@link UncheckedIOException}.
   */
  public Consumer<DigestNode> sinkFor(OutputStream out) {
    return node -> {
      try {
        write(node, out);
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to write digest node", e);
      }
    };
  }

  /** Reads JSON Lines back into nodes. Blank lines and unknown properties are ignored. */
  public List<DigestNode> readAll(Reader in) throws IOException {
    try (MappingIterator<DigestNode> iterator =
        objectMapper
            .readerFor(DigestNode.class)
            .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .readValues(in)) {
      return iterator.readAll();
    }
  }
}
