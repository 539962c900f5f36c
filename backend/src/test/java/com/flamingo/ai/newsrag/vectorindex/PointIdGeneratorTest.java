package com.flamingo.ai.newsrag.vectorindex;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PointIdGenerator Tests")
class PointIdGeneratorTest {

  @Test
  @DisplayName("Should produce strictly increasing ids when the clock stands still")
  void shouldIncreaseIds_whenClockIsFixed() {
    Instant now = Instant.parse("2024-11-05T10:00:00Z");
    PointIdGenerator generator = new PointIdGenerator(Clock.fixed(now, ZoneOffset.UTC));

    long first = generator.nextId();
    long second = generator.nextId();
    long third = generator.nextId();

    assertThat(first).isEqualTo(now.toEpochMilli() * 1000);
    assertThat(second).isEqualTo(first + 1);
    assertThat(third).isEqualTo(first + 2);
  }

  @Test
  @DisplayName("Should never hand out the same id to concurrent callers")
  void shouldGenerateUniqueIds_whenCalledConcurrently() throws Exception {
    PointIdGenerator generator =
        new PointIdGenerator(Clock.fixed(Instant.EPOCH.plusSeconds(60), ZoneOffset.UTC));
    Set<Long> ids = Collections.synchronizedSet(new HashSet<>());
    ExecutorService executor = Executors.newFixedThreadPool(4);

    for (int i = 0; i < 1000; i++) {
      executor.submit(() -> ids.add(generator.nextId()));
    }
    executor.shutdown();
    assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

    assertThat(ids).hasSize(1000);
  }
}
