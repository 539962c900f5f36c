package com.flamingo.ai.newsrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the news RAG service. */
@SpringBootApplication
public class NewsRagApplication {

  public static void main(String[] args) {
    SpringApplication.run(NewsRagApplication.class, args);
  }
}
