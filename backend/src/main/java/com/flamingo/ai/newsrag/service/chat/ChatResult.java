package com.flamingo.ai.newsrag.service.chat;

import com.flamingo.ai.newsrag.domain.SourceReference;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Buffered answer to one chat message. */
public record ChatResult(
    UUID sessionId, String message, List<SourceReference> sources, Instant timestamp) {}
