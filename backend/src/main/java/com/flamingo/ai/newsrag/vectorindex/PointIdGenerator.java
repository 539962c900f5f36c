package com.flamingo.ai.newsrag.vectorindex;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/**
 * Strictly increasing point ids, seeded from the clock in microsecond resolution so ids keep
 * growing across restarts. Safe for concurrent ingestion.
 */
@Component
public class PointIdGenerator {

  private final Clock clock;
  private final AtomicLong last = new AtomicLong();

  public PointIdGenerator() {
    this(Clock.systemUTC());
  }

  PointIdGenerator(Clock clock) {
    this.clock = clock;
  }

  public long nextId() {
    long now = clock.millis() * 1000;
    return last.accumulateAndGet(now, (previous, candidate) -> Math.max(previous + 1, candidate));
  }
}
