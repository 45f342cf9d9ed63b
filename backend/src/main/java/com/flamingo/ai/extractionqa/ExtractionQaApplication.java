package com.flamingo.ai.extractionqa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the extraction quality-assurance service. */
@SpringBootApplication
public class ExtractionQaApplication {

  public static void main(String[] args) {
    SpringApplication.run(ExtractionQaApplication.class, args);
  }
}
