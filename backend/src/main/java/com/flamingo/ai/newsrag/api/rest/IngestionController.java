package com.flamingo.ai.newsrag.api.rest;

import com.flamingo.ai.newsrag.api.dto.response.IngestionResponse;
import com.flamingo.ai.newsrag.service.ingestion.ArticleSource;
import com.flamingo.ai.newsrag.service.ingestion.IngestionReport;
import com.flamingo.ai.newsrag.service.ingestion.NewsIngestionService;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for news ingestion. */
@RestController
@RequestMapping("/api/ingestion")
@RequiredArgsConstructor
@Slf4j
public class IngestionController {

  private final NewsIngestionService newsIngestionService;
  private final ArticleSource articleSource;
  private final Clock clock;

  /** Runs one ingestion pass and returns its summary. */
  @PostMapping("/run")
  public ResponseEntity<IngestionResponse> run() {
    log.info("Manual ingestion requested");
    IngestionReport report = newsIngestionService.run();
    return ResponseEntity.ok(IngestionResponse.fromReport(report, clock.instant()));
  }

  /** Lists the configured news sources. */
  @GetMapping("/sources")
  public ResponseEntity<Map<String, Object>> sources() {
    List<String> sources = articleSource.describeSources();
    Map<String, Object> body = new HashMap<>();
    body.put("sources", sources);
    body.put("count", sources.size());
    body.put("timestamp", clock.instant());
    return ResponseEntity.ok(body);
  }
}
