package com.flamingo.ai.newsrag.conversation;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.newsrag.config.RagConfig;
import com.flamingo.ai.newsrag.domain.ChatSession;
import com.flamingo.ai.newsrag.domain.ConversationMessage;
import com.flamingo.ai.newsrag.domain.MessageRole;
import com.flamingo.ai.newsrag.domain.SourceReference;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryConversationStore Tests")
class InMemoryConversationStoreTest {

  private static final Instant START = Instant.parse("2024-11-05T10:00:00Z");

  private MutableClock clock;
  private InMemoryConversationStore store;
  private UUID sessionId;

  @BeforeEach
  void setUp() {
    RagConfig config = new RagConfig();
    config.getConversation().setSessionTtl(Duration.ofHours(24));
    config.getConversation().setHistoryTtl(Duration.ofHours(1));
    config.getConversation().setMaxStoredMessages(5);
    clock = new MutableClock(START);
    store = new InMemoryConversationStore(config, clock);
    sessionId = UUID.randomUUID();
  }

  @Test
  @DisplayName("Should create a session with zero messages")
  void shouldCreateSession_whenRequested() {
    ChatSession session = store.createSession(sessionId);

    assertThat(session.getId()).isEqualTo(sessionId);
    assertThat(session.getCreatedAt()).isEqualTo(START);
    assertThat(session.getMessagesCount()).isZero();
    assertThat(store.getSession(sessionId)).contains(session);
  }

  @Test
  @DisplayName("Should return messages oldest first and honour the limit")
  void shouldReturnMessagesInOrder_whenReadingHistory() {
    // Given
    store.createSession(sessionId);
    store.appendMessage(sessionId, ConversationMessage.user("q1", null));
    store.appendMessage(
        sessionId,
        ConversationMessage.assistant(
            "a1", List.of(new SourceReference("T", "https://example.com/t", 0.9)), null));
    store.appendMessage(sessionId, ConversationMessage.user("q2", null));

    // When
    List<ConversationMessage> all = store.getMessages(sessionId, 10);
    List<ConversationMessage> lastTwo = store.getMessages(sessionId, 2);

    // Then
    assertThat(all).extracting(ConversationMessage::getContent).containsExactly("q1", "a1", "q2");
    assertThat(all.get(1).getRole()).isEqualTo(MessageRole.ASSISTANT);
    assertThat(all.get(1).getSources()).hasSize(1);
    assertThat(all.get(0).getTimestamp()).isEqualTo(START);
    assertThat(lastTwo).extracting(ConversationMessage::getContent).containsExactly("a1", "q2");
    assertThat(store.getMessages(sessionId, 0)).isEmpty();
    assertThat(store.getSession(sessionId).orElseThrow().getMessagesCount()).isEqualTo(3);
  }

  @Test
  @DisplayName("Should keep only the newest messages beyond the stored maximum")
  void shouldTrimOldest_whenExceedingMaxStoredMessages() {
    store.createSession(sessionId);
    for (int i = 1; i <= 7; i++) {
      store.appendMessage(sessionId, ConversationMessage.user("m" + i, null));
    }

    assertThat(store.getMessages(sessionId, 50))
        .extracting(ConversationMessage::getContent)
        .containsExactly("m3", "m4", "m5", "m6", "m7");
    assertThat(store.getSession(sessionId).orElseThrow().getMessagesCount()).isEqualTo(7);
  }

  @Test
  @DisplayName("Should expire history independently of the session")
  void shouldExpireHistory_whenHistoryTtlElapses() {
    // Given
    store.createSession(sessionId);
    store.appendMessage(sessionId, ConversationMessage.user("hello", null));

    // When
    clock.advance(Duration.ofMinutes(61));

    // Then
    assertThat(store.getMessages(sessionId, 10)).isEmpty();
    assertThat(store.getSession(sessionId)).isPresent();
  }

  @Test
  @DisplayName("Should refresh the history expiry on every append")
  void shouldExtendHistory_whenMessageAppended() {
    store.createSession(sessionId);
    store.appendMessage(sessionId, ConversationMessage.user("first", null));
    clock.advance(Duration.ofMinutes(50));
    store.appendMessage(sessionId, ConversationMessage.user("second", null));
    clock.advance(Duration.ofMinutes(50));

    assertThat(store.getMessages(sessionId, 10)).hasSize(2);
  }

  @Test
  @DisplayName("Should expire the session after its TTL")
  void shouldExpireSession_whenSessionTtlElapses() {
    store.createSession(sessionId);

    clock.advance(Duration.ofHours(24));

    assertThat(store.getSession(sessionId)).isEmpty();
  }

  @Test
  @DisplayName("Should keep the session expiry anchored at creation when messages arrive")
  void shouldNotExtendSession_whenMessageAppended() {
    store.createSession(sessionId);
    clock.advance(Duration.ofHours(23));
    store.appendMessage(sessionId, ConversationMessage.user("late", null));

    clock.advance(Duration.ofHours(1));

    assertThat(store.getSession(sessionId)).isEmpty();
    assertThat(store.getMessages(sessionId, 10)).hasSize(1);
  }

  @Test
  @DisplayName("Should drop abandoned sessions and history without reading them again")
  void shouldEvictExpiredEntries_whenSessionAbandoned() {
    // Given
    store.createSession(sessionId);
    store.appendMessage(sessionId, ConversationMessage.user("hello", null));
    assertThat(store.sessionEntries()).isEqualTo(1);
    assertThat(store.messageListEntries()).isEqualTo(1);

    // When
    clock.advance(Duration.ofHours(25));
    store.evictExpired();

    // Then
    assertThat(store.sessionEntries()).isZero();
    assertThat(store.messageListEntries()).isZero();
  }

  @Test
  @DisplayName("Should store messages for a session that does not exist")
  void shouldStoreMessages_whenSessionMissing() {
    store.appendMessage(sessionId, ConversationMessage.user("orphan", null));

    assertThat(store.getMessages(sessionId, 10)).hasSize(1);
    assertThat(store.getSession(sessionId)).isEmpty();
  }

  @Test
  @DisplayName("Should remove session and history on delete")
  void shouldRemoveEverything_whenDeleted() {
    store.createSession(sessionId);
    store.appendMessage(sessionId, ConversationMessage.user("bye", null));

    store.deleteSession(sessionId);

    assertThat(store.getSession(sessionId)).isEmpty();
    assertThat(store.getMessages(sessionId, 10)).isEmpty();
  }
}
