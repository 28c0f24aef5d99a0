package com.flamingo.ai.agentchat.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.agentchat.domain.enums.MessageRole;
import com.flamingo.ai.agentchat.domain.model.ContentPart;
import com.flamingo.ai.agentchat.domain.model.Message;
import com.flamingo.ai.agentchat.domain.model.MessageImage;
import com.flamingo.ai.agentchat.domain.model.ToolCall;
import com.flamingo.ai.agentchat.domain.model.ToolExecutionResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConversationStateRepositoryTest {

  private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

  private InMemoryKeyValueStore store;
  private ObjectMapper objectMapper;
  private ConversationStateRepository repository;

  @BeforeEach
  void setUp() {
    store = new InMemoryKeyValueStore();
    objectMapper = new ObjectMapper().findAndRegisterModules();
    repository = new ConversationStateRepository(store, objectMapper);
  }

  @Test
  void shouldRestoreTranscript_withToolCallsAndTimestamps() {
    // Given
    ToolCall call =
        ToolCall.running("t1", "read_file", "{\"path\":\"a\"}", NOW)
            .finish(new ToolExecutionResult(true, "hello", null), NOW.plusSeconds(1));
    List<Message> transcript =
        List.of(
            Message.builder()
                .id("u1")
                .role(MessageRole.USER)
                .content("Read a")
                .images(new ArrayList<>(List.of(new MessageImage("aGk=", "image/png"))))
                .timestamp(NOW)
                .build(),
            Message.builder()
                .id("a1")
                .role(MessageRole.ASSISTANT)
                .content("Done.")
                .contentParts(
                    new ArrayList<>(
                        List.of(new ContentPart.ToolUse(call), new ContentPart.Text("Done."))))
                .toolCalls(new ArrayList<>(List.of(call)))
                .timestamp(NOW)
                .build());

    // When
    repository.saveTranscript(transcript);
    List<Message> restored = repository.loadTranscript();

    // Then
    assertThat(restored).isEqualTo(transcript);
  }

  @Test
  void shouldStoreMessagesInDisplayFormat() throws Exception {
    repository.saveTranscript(
        List.of(
            Message.builder()
                .id("a1")
                .role(MessageRole.ASSISTANT)
                .thinking(true)
                .timestamp(NOW)
                .build()));

    String stored = store.get(ConversationStateRepository.MESSAGES_KEY).orElseThrow();
    JsonNode node = objectMapper.readTree(stored).get(0);
    assertThat(node.get("role").asText()).isEqualTo("assistant");
    assertThat(node.get("isThinking").asBoolean()).isTrue();
  }

  @Test
  void shouldClearSessionId_whenSavedAsNull() {
    repository.saveSessionId("s1");
    assertThat(repository.loadSessionId()).contains("s1");

    repository.saveSessionId(null);

    assertThat(repository.loadSessionId()).isEmpty();
  }

  @Test
  void shouldReturnEmptyTranscript_whenStoredValueCorrupt() {
    store.put(ConversationStateRepository.MESSAGES_KEY, "{not json");

    assertThat(repository.loadTranscript()).isEmpty();
  }
}
