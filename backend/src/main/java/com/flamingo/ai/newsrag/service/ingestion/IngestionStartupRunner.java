package com.flamingo.ai.newsrag.service.ingestion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Starts a background ingestion pass once the application is up. */
@Component
@ConditionalOnProperty(name = "rag.ingestion.run-on-startup", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class IngestionStartupRunner implements ApplicationRunner {

  private final NewsIngestionService newsIngestionService;

  @Override
  public void run(ApplicationArguments args) {
    log.info("Scheduling startup ingestion");
    newsIngestionService.runAsync();
  }
}
