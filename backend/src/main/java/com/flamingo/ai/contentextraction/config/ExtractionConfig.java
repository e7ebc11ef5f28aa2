package com.flamingo.ai.contentextraction.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the section chunking and digest pipeline. */
@Configuration
@ConfigurationProperties(prefix = "extraction")
@Getter
@Setter
public class ExtractionConfig {

  private Chunking chunking = new Chunking();
  private Digest digest = new Digest();
  private Batch batch = new Batch();

  @Getter
  @Setter
  public static class Chunking {
    /** Tags whose elements never contribute to a node's own text. */
    private List<String> excludedTags =
        new ArrayList<>(List.of("script", "style", "noscript", "meta", "link", "title", "base"));

    /** A div only qualifies as the root region when its text is longer than this. */
    private int minRootContentLength = 100;

    private int maxMarkupLength = 5_000_000;
  }

  @Getter
  @Setter
  public static class Digest {
    /** Lines of child text kept in a digest when the parent has text of its own. */
    private int parentTextLineCap = 1;

    private String ellipsis = "...";
    private String coveredTopicsLabel = "Covered topics in this subsection:";

    /** Optional BLAKE2b key (UTF-8, at most 64 bytes). Empty means unkeyed. */
    private String hashKey = "";
  }

  @Getter
  @Setter
  public static class Batch {
    private int maxDocuments = 50;
  }
}
