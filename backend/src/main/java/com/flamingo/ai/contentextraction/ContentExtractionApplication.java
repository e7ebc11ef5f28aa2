package com.flamingo.ai.contentextraction;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the content extraction service. */
@SpringBootApplication
public class ContentExtractionApplication {

  public static void main(String[] args) {
    SpringApplication.run(ContentExtractionApplication.class, args);
  }
}
