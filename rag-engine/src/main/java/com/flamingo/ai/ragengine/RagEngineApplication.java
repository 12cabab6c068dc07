package com.flamingo.ai.ragengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Retrieval-augmented question answering engine. */
@SpringBootApplication
public class RagEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(RagEngineApplication.class, args);
  }
}
