package com.flamingo.ai.newsrag.conversation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.newsrag.config.RagConfig;
import com.flamingo.ai.newsrag.domain.ChatSession;
import com.flamingo.ai.newsrag.domain.ConversationMessage;
import com.flamingo.ai.newsrag.exception.ConversationStoreException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Redis layout: hash {@code session:{id}} holding id, createdAt and messagesCount with the session
 * TTL, and list {@code messages:{id}} of JSON messages, newest first, with the history TTL.
 */
@Slf4j
public class RedisConversationStore implements ConversationStore {

  static final String SESSION_PREFIX = "session:";
  static final String MESSAGES_PREFIX = "messages:";

  private static final String FIELD_ID = "id";
  private static final String FIELD_CREATED_AT = "createdAt";
  private static final String FIELD_MESSAGES_COUNT = "messagesCount";

  // HINCRBY on an expired hash would recreate it without TTL or createdAt
  static final RedisScript<Long> INCREMENT_IF_PRESENT =
      new DefaultRedisScript<>(
          "if redis.call('EXISTS', KEYS[1]) == 1 then"
              + " return redis.call('HINCRBY', KEYS[1], ARGV[1], 1) end"
              + " return -1",
          Long.class);

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final RagConfig.Conversation config;
  private final Clock clock;

  public RedisConversationStore(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      RagConfig ragConfig,
      Clock clock) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.config = ragConfig.getConversation();
    this.clock = clock;
  }

  @Override
  public ChatSession createSession(UUID sessionId) {
    ChatSession session =
        ChatSession.builder().id(sessionId).createdAt(clock.instant()).messagesCount(0).build();
    String key = sessionKey(sessionId);
    Map<String, String> fields = new HashMap<>();
    fields.put(FIELD_ID, sessionId.toString());
    fields.put(FIELD_CREATED_AT, session.getCreatedAt().toString());
    fields.put(FIELD_MESSAGES_COUNT, "0");
    try {
      redisTemplate.opsForHash().putAll(key, fields);
      redisTemplate.expire(key, config.getSessionTtl());
    } catch (DataAccessException e) {
      throw new ConversationStoreException("Failed to create session " + sessionId, e);
    }
    log.debug("Created session {}", sessionId);
    return session;
  }

  @Override
  public Optional<ChatSession> getSession(UUID sessionId) {
    Map<Object, Object> fields;
    try {
      HashOperations<String, Object, Object> hashOps = redisTemplate.opsForHash();
      fields = hashOps.entries(sessionKey(sessionId));
    } catch (DataAccessException e) {
      throw new ConversationStoreException("Failed to read session " + sessionId, e);
    }
    if (fields == null || fields.isEmpty()) {
      return Optional.empty();
    }
    Object createdAt = fields.get(FIELD_CREATED_AT);
    Object count = fields.get(FIELD_MESSAGES_COUNT);
    return Optional.of(
        ChatSession.builder()
            .id(sessionId)
            .createdAt(createdAt != null ? Instant.parse(createdAt.toString()) : null)
            .messagesCount(count != null ? Long.parseLong(count.toString()) : 0)
            .build());
  }

  @Override
  public void deleteSession(UUID sessionId) {
    try {
      redisTemplate.delete(List.of(sessionKey(sessionId), messagesKey(sessionId)));
    } catch (DataAccessException e) {
      throw new ConversationStoreException("Failed to delete session " + sessionId, e);
    }
    log.debug("Deleted session {}", sessionId);
  }

  @Override
  public void appendMessage(UUID sessionId, ConversationMessage message) {
    if (message.getTimestamp() == null) {
      message.setTimestamp(clock.instant());
    }
    String messagesKey = messagesKey(sessionId);
    String sessionKey = sessionKey(sessionId);
    try {
      redisTemplate.opsForList().leftPush(messagesKey, objectMapper.writeValueAsString(message));
      redisTemplate.opsForList().trim(messagesKey, 0, config.getMaxStoredMessages() - 1L);
      Long count =
          redisTemplate.execute(INCREMENT_IF_PRESENT, List.of(sessionKey), FIELD_MESSAGES_COUNT);
      if (count == null || count < 0) {
        log.debug("Session {} is gone, message stored without counting", sessionId);
      }
      redisTemplate.expire(messagesKey, config.getHistoryTtl());
    } catch (JsonProcessingException e) {
      throw new ConversationStoreException("Failed to serialize message for " + sessionId, e);
    } catch (DataAccessException e) {
      throw new ConversationStoreException("Failed to append message to " + sessionId, e);
    }
  }

  @Override
  public List<ConversationMessage> getMessages(UUID sessionId, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    List<String> raw;
    try {
      raw = redisTemplate.opsForList().range(messagesKey(sessionId), 0, limit - 1L);
    } catch (DataAccessException e) {
      throw new ConversationStoreException("Failed to read messages for " + sessionId, e);
    }
    if (raw == null || raw.isEmpty()) {
      return List.of();
    }
    List<ConversationMessage> messages = new ArrayList<>(raw.size());
    for (String json : raw) {
      try {
        messages.add(objectMapper.readValue(json, ConversationMessage.class));
      } catch (JsonProcessingException e) {
        log.warn("Skipping unreadable message in {}: {}", messagesKey(sessionId), e.getMessage());
      }
    }
    Collections.reverse(messages);
    return messages;
  }

  @Override
  public boolean isAvailable() {
    try {
      var connectionFactory = redisTemplate.getConnectionFactory();
      if (connectionFactory == null) {
        return false;
      }
      try (var connection = connectionFactory.getConnection()) {
        return "PONG".equalsIgnoreCase(connection.ping());
      }
    } catch (RuntimeException e) {
      log.warn("Redis ping failed: {}", e.getMessage());
      return false;
    }
  }

  static String sessionKey(UUID sessionId) {
    return SESSION_PREFIX + sessionId;
  }

  static String messagesKey(UUID sessionId) {
    return MESSAGES_PREFIX + sessionId;
  }
}
