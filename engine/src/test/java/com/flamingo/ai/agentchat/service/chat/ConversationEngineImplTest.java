package com.flamingo.ai.agentchat.service.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.agentchat.channel.EventChannelRegistry;
import com.flamingo.ai.agentchat.client.AgentBackendClient;
import com.flamingo.ai.agentchat.client.dto.SendMessageRequest;
import com.flamingo.ai.agentchat.config.AgentChatConfig;
import com.flamingo.ai.agentchat.domain.enums.MessageRole;
import com.flamingo.ai.agentchat.domain.enums.ToolCallStatus;
import com.flamingo.ai.agentchat.domain.event.FileWriteProposedEvent;
import com.flamingo.ai.agentchat.domain.event.NotificationEvent;
import com.flamingo.ai.agentchat.domain.event.TranscriptUpdatedEvent;
import com.flamingo.ai.agentchat.domain.model.ContentPart;
import com.flamingo.ai.agentchat.domain.model.Message;
import com.flamingo.ai.agentchat.domain.model.MessageImage;
import com.flamingo.ai.agentchat.domain.model.Topic;
import com.flamingo.ai.agentchat.exception.AgentBackendException;
import com.flamingo.ai.agentchat.exception.GenerationInProgressException;
import com.flamingo.ai.agentchat.exception.SessionCreationException;
import com.flamingo.ai.agentchat.persistence.ConversationStateRepository;
import com.flamingo.ai.agentchat.persistence.InMemoryKeyValueStore;
import com.flamingo.ai.agentchat.persistence.PreferenceRepository;
import com.flamingo.ai.agentchat.service.audio.AudioCueDispatcher;
import com.flamingo.ai.agentchat.service.provider.ProviderCatalog;
import com.flamingo.ai.agentchat.service.session.SessionRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ConversationEngineImpl")
class ConversationEngineImplTest {

  private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");
  private static final String SESSION_ID = "session-1";

  @Mock private SessionRegistry sessionRegistry;
  @Mock private AgentBackendClient backendClient;
  @Mock private AudioCueDispatcher audioCueDispatcher;
  @Mock private ApplicationEventPublisher eventPublisher;

  private ObjectMapper objectMapper;
  private SimpleMeterRegistry meterRegistry;
  private Clock clock;
  private EventChannelRegistry channelRegistry;
  private ConversationStateRepository stateRepository;
  private PreferenceRepository preferenceRepository;
  private ProviderCatalog providerCatalog;

  private ConversationEngineImpl engine;

  @BeforeEach
  void setUp() {
    objectMapper = new ObjectMapper().findAndRegisterModules();
    meterRegistry = new SimpleMeterRegistry();
    clock = Clock.fixed(NOW, ZoneOffset.UTC);
    channelRegistry = new EventChannelRegistry();
    stateRepository = new ConversationStateRepository(new InMemoryKeyValueStore(), objectMapper);
    preferenceRepository = new PreferenceRepository(new InMemoryKeyValueStore(), objectMapper);

    AgentChatConfig config = new AgentChatConfig();
    config.getProviders().put("claude", List.of("claude-sonnet-4-5", "claude-opus-4-1"));
    config.getProviders().put("openai", List.of("gpt-4o", "gpt-4o-mini"));
    providerCatalog = new ProviderCatalog(config);

    lenient().when(backendClient.sendMessageStream(any())).thenReturn(Mono.never());
    lenient().when(sessionRegistry.create(any(), any(), any(), any())).thenReturn(SESSION_ID);

    engine = newEngine();
  }

  private ConversationEngineImpl newEngine() {
    return new ConversationEngineImpl(
        sessionRegistry,
        backendClient,
        channelRegistry,
        new StreamEventParser(objectMapper, meterRegistry),
        new ContentAssembler(clock),
        new FileWriteIntentDetector(objectMapper),
        audioCueDispatcher,
        stateRepository,
        preferenceRepository,
        providerCatalog,
        eventPublisher,
        meterRegistry,
        clock);
  }

  private String send(String text) {
    engine.sendMessage(text, List.of(), SendFlags.NONE);
    return engine.getInFlightMessage().map(Message::getId).orElseThrow();
  }

  private boolean emit(String placeholderId, String payload) {
    return channelRegistry.publish(ConversationEngineImpl.CHANNEL_PREFIX + placeholderId, payload);
  }

  private static String textDelta(String text) {
    return "{\"type\":\"text_delta\",\"text\":\"" + text + "\"}";
  }

  private static final String FINAL_DONE = "{\"type\":\"final_done\"}";

  private Message assistant() {
    List<Message> messages = engine.getMessages();
    return messages.get(messages.size() - 1);
  }

  private List<NotificationEvent> notifications() {
    ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
    verify(eventPublisher, atLeastOnce()).publishEvent(captor.capture());
    return captor.getAllValues().stream()
        .filter(NotificationEvent.class::isInstance)
        .map(NotificationEvent.class::cast)
        .toList();
  }

  private double counter(String name) {
    return meterRegistry.counter(name).count();
  }

  @Nested
  @DisplayName("sending")
  class Sending {

    @Test
    void shouldAddUserMessageAndThinkingPlaceholder_whenSending() {
      // When
      engine.sendMessage("Hello", List.of(), new SendFlags(true, false));

      // Then
      List<Message> messages = engine.getMessages();
      assertThat(messages).hasSize(2);
      assertThat(messages.get(0).getRole()).isEqualTo(MessageRole.USER);
      assertThat(messages.get(0).getContent()).isEqualTo("Hello");
      assertThat(messages.get(0).getImages()).isNull();
      assertThat(messages.get(1).getRole()).isEqualTo(MessageRole.ASSISTANT);
      assertThat(messages.get(1).isThinking()).isTrue();
      assertThat(messages.get(1).getThinkingLabel()).isEqualTo("Searching the web...");
      assertThat(messages.get(1).getContent()).isEmpty();
      assertThat(engine.isSending()).isTrue();
      assertThat(engine.hasActiveSubscription()).isTrue();
      assertThat(counter("chat.generations.started")).isEqualTo(1.0);
    }

    @Test
    void shouldOpenSessionAndStream_whenNoSessionIsActive() {
      // When
      String placeholderId = send("Hello");

      // Then
      verify(sessionRegistry).create("claude", "claude-sonnet-4-5", null, null);
      assertThat(engine.getActiveSessionId()).contains(SESSION_ID);
      assertThat(stateRepository.loadSessionId()).contains(SESSION_ID);

      ArgumentCaptor<SendMessageRequest> request =
          ArgumentCaptor.forClass(SendMessageRequest.class);
      verify(backendClient).sendMessageStream(request.capture());
      assertThat(request.getValue().getMessage()).isEqualTo("Hello");
      assertThat(request.getValue().getEventName()).isEqualTo("agent_stream_" + placeholderId);
      assertThat(request.getValue().getSessionId()).isEqualTo(SESSION_ID);
      assertThat(request.getValue().getProviderType()).isEqualTo("claude");
      assertThat(request.getValue().getModel()).isEqualTo("claude-sonnet-4-5");
      assertThat(request.getValue().getImages()).isNull();
      assertThat(channelRegistry.isOpen("agent_stream_" + placeholderId)).isTrue();
    }

    @Test
    void shouldForwardImages_whenAttached() {
      engine.sendMessage(
          "What is this?", List.of(new MessageImage("aGVsbG8=", "image/png")), SendFlags.NONE);

      ArgumentCaptor<SendMessageRequest> request =
          ArgumentCaptor.forClass(SendMessageRequest.class);
      verify(backendClient).sendMessageStream(request.capture());
      assertThat(request.getValue().getImages())
          .singleElement()
          .satisfies(
              image -> {
                assertThat(image.data()).isEqualTo("aGVsbG8=");
                assertThat(image.mediaType()).isEqualTo("image/png");
              });
      assertThat(engine.getMessages().get(0).getImages()).hasSize(1);
    }

    @Test
    void shouldReuseActiveSession_whenSendingAgain() {
      String first = send("one");
      emit(first, FINAL_DONE);

      String second = send("two");

      verify(sessionRegistry, times(1)).create(any(), any(), any(), any());
      assertThat(second).isNotEqualTo(first);
      assertThat(engine.getMessages()).hasSize(4);
    }

    @Test
    void shouldRejectSend_whenGenerationInProgress() {
      String placeholderId = send("one");

      assertThatThrownBy(() -> engine.sendMessage("two", List.of(), SendFlags.NONE))
          .isInstanceOf(GenerationInProgressException.class)
          .hasMessageContaining(placeholderId);
      assertThat(engine.getMessages()).hasSize(2);
    }

    @Test
    void shouldPublishTranscriptUpdates_whenSending() {
      send("Hello");

      ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
      verify(eventPublisher, atLeastOnce()).publishEvent(captor.capture());
      TranscriptUpdatedEvent last =
          captor.getAllValues().stream()
              .filter(TranscriptUpdatedEvent.class::isInstance)
              .map(TranscriptUpdatedEvent.class::cast)
              .reduce((a, b) -> b)
              .orElseThrow();
      assertThat(last.messages()).hasSize(2);
      assertThat(last.sending()).isTrue();
    }
  }

  @Nested
  @DisplayName("streaming")
  class Streaming {

    @Test
    void shouldConcatenateTextAndFinish_whenFinalDoneArrives() {
      // Given
      String placeholderId = send("Hi");

      // When
      emit(placeholderId, textDelta("Hel"));

      // Then
      assertThat(assistant().getContent()).isEqualTo("Hel");
      assertThat(assistant().isThinking()).isTrue();
      assertThat(assistant().getThinkingLabel()).isNull();

      // When
      emit(placeholderId, textDelta("lo"));
      emit(placeholderId, FINAL_DONE);

      // Then
      Message message = assistant();
      assertThat(message.getContent()).isEqualTo("Hello");
      assertThat(message.getContentParts()).containsExactly(new ContentPart.Text("Hello"));
      assertThat(message.isThinking()).isFalse();
      assertThat(engine.isSending()).isFalse();
      assertThat(engine.hasActiveSubscription()).isFalse();
      assertThat(channelRegistry.isOpen("agent_stream_" + placeholderId)).isFalse();
      assertThat(counter("chat.generations.completed")).isEqualTo(1.0);
      verify(audioCueDispatcher, times(2)).onTextDelta();
    }

    @Test
    void shouldUseNoResponseMarker_whenFinishedWithoutText() {
      String placeholderId = send("Hi");

      emit(placeholderId, FINAL_DONE);

      assertThat(assistant().getContent()).isEqualTo(ConversationEngineImpl.NO_RESPONSE);
      assertThat(assistant().isThinking()).isFalse();
    }

    @Test
    void shouldKeepStreamingAcrossTurns_whenToolLoopRuns() {
      // Given
      String placeholderId = send("Read a.txt");

      // When
      emit(placeholderId, textDelta("Checking."));
      emit(
          placeholderId,
          "{\"type\":\"tool_start\",\"tool_id\":\"t1\",\"tool_name\":\"read_file\","
              + "\"arguments\":{\"path\":\"a.txt\"}}");
      emit(
          placeholderId,
          "{\"type\":\"tool_end\",\"tool_id\":\"t1\",\"result\":{\"success\":true,"
              + "\"output\":\"hello\"}}");
      emit(
          placeholderId,
          "{\"type\":\"done\",\"usage\":{\"input_tokens\":10,\"output_tokens\":5}}");

      // Then
      assertThat(engine.isSending()).isTrue();
      assertThat(assistant().isThinking()).isTrue();
      assertThat(channelRegistry.isOpen("agent_stream_" + placeholderId)).isTrue();

      // When
      emit(placeholderId, textDelta(" It says hello."));
      emit(placeholderId, FINAL_DONE);

      // Then
      Message message = assistant();
      assertThat(message.getContent()).isEqualTo("Checking. It says hello.");
      assertThat(message.getContentParts()).hasSize(3);
      assertThat(message.getContentParts().get(0)).isEqualTo(new ContentPart.Text("Checking."));
      assertThat(message.getContentParts().get(1)).isInstanceOf(ContentPart.ToolUse.class);
      assertThat(message.getContentParts().get(2))
          .isEqualTo(new ContentPart.Text(" It says hello."));
      assertThat(message.getToolCalls())
          .singleElement()
          .satisfies(
              call -> {
                assertThat(call.id()).isEqualTo("t1");
                assertThat(call.status()).isEqualTo(ToolCallStatus.COMPLETED);
                assertThat(call.result().output()).isEqualTo("hello");
              });
      assertThat(engine.isSending()).isFalse();
      verify(audioCueDispatcher).onToolStart();
    }

    @Test
    void shouldIgnoreToolEnd_whenToolIsUnknown() {
      String placeholderId = send("Hi");

      emit(
          placeholderId,
          "{\"type\":\"tool_end\",\"tool_id\":\"ghost\",\"result\":{\"success\":true}}");

      assertThat(assistant().getContentParts()).isEmpty();
      assertThat(assistant().getToolCalls()).isEmpty();
      assertThat(engine.isSending()).isTrue();
    }

    @Test
    void shouldIgnoreMalformedEvents_andKeepChannelOpen() {
      String placeholderId = send("Hi");

      emit(placeholderId, "garbage");
      emit(placeholderId, "{\"type\":\"mystery\"}");
      emit(placeholderId, textDelta("ok"));

      assertThat(assistant().getContent()).isEqualTo("ok");
      assertThat(engine.isSending()).isTrue();
      assertThat(counter("chat.events.malformed")).isEqualTo(2.0);
    }

    @Test
    void shouldKeepPartialText_whenErrorEventArrives() {
      String placeholderId = send("Hi");

      emit(placeholderId, textDelta("Partial"));
      emit(placeholderId, "{\"type\":\"error\",\"message\":\"overloaded\"}");

      assertThat(assistant().getContent()).isEqualTo("Partial");
      assertThat(assistant().isThinking()).isFalse();
      assertThat(engine.isSending()).isFalse();
      assertThat(counter("chat.generations.failed")).isEqualTo(1.0);
      assertThat(notifications())
          .contains(NotificationEvent.error("Response error: overloaded"));
    }

    @Test
    void shouldShowErrorText_whenErrorEventArrivesBeforeAnyText() {
      String placeholderId = send("Hi");

      emit(placeholderId, "{\"type\":\"error\",\"message\":\"overloaded\"}");

      assertThat(assistant().getContent()).isEqualTo("Error: overloaded");
    }

    @Test
    void shouldProposeFileWrite_whenWriteToolStarts() {
      String placeholderId = send("Write it down");

      emit(
          placeholderId,
          "{\"type\":\"tool_start\",\"tool_id\":\"w1\",\"tool_name\":\"write_file\","
              + "\"arguments\":{\"path\":\"notes.md\",\"content\":\"# Notes\"}}");

      verify(eventPublisher)
          .publishEvent(new FileWriteProposedEvent(placeholderId, "w1", "notes.md", "# Notes"));
    }
  }

  @Nested
  @DisplayName("stopping")
  class Stopping {

    @Test
    void shouldDetachAndIgnoreLaterEvents_whenStopped() {
      // Given
      String placeholderId = send("Hi");
      emit(placeholderId, textDelta("Par"));

      // When
      engine.stopSending();

      // Then
      assertThat(engine.isSending()).isFalse();
      assertThat(engine.hasActiveSubscription()).isFalse();
      assertThat(assistant().isThinking()).isFalse();
      assertThat(assistant().getContent()).isEqualTo("Par");
      assertThat(emit(placeholderId, textDelta("tial"))).isFalse();
      assertThat(assistant().getContent()).isEqualTo("Par");
      assertThat(counter("chat.generations.stopped")).isEqualTo(1.0);
    }

    @Test
    void shouldMarkPlaceholderStopped_whenStoppedBeforeAnyText() {
      send("Hi");

      engine.stopSending();

      assertThat(assistant().getContent()).isEqualTo(ConversationEngineImpl.STOPPED);
    }

    @Test
    void shouldBeNoOp_whenStoppingTwiceOrWithNothingInFlight() {
      engine.stopSending();
      assertThat(engine.isSending()).isFalse();

      send("Hi");
      engine.stopSending();
      engine.stopSending();

      assertThat(engine.isSending()).isFalse();
      assertThat(counter("chat.generations.stopped")).isEqualTo(1.0);
    }

    @Test
    void shouldAbandonSend_whenStoppedWhileSessionIsOpening() {
      // Given
      when(sessionRegistry.create(any(), any(), any(), any()))
          .thenAnswer(
              invocation -> {
                engine.stopSending();
                return SESSION_ID;
              });

      // When
      engine.sendMessage("Hi", List.of(), SendFlags.NONE);

      // Then
      verify(backendClient, never()).sendMessageStream(any());
      assertThat(engine.isSending()).isFalse();
      assertThat(assistant().getContent()).isEqualTo(ConversationEngineImpl.STOPPED);
      assertThat(engine.getActiveSessionId()).contains(SESSION_ID);
    }
  }

  @Nested
  @DisplayName("failures")
  class Failures {

    @Test
    void shouldRemovePlaceholder_whenSessionCannotBeCreated() {
      // Given
      when(sessionRegistry.create(any(), any(), any(), any()))
          .thenThrow(new SessionCreationException("claude", new RuntimeException("refused")));

      // When
      engine.sendMessage("Hi", List.of(), SendFlags.NONE);

      // Then
      assertThat(engine.getMessages())
          .singleElement()
          .extracting(Message::getRole)
          .isEqualTo(MessageRole.USER);
      assertThat(engine.isSending()).isFalse();
      assertThat(engine.getActiveSessionId()).isEmpty();
      verify(backendClient, never()).sendMessageStream(any());
      assertThat(notifications()).contains(NotificationEvent.error("Failed to initialize session"));
    }

    @Test
    void shouldKeepSwitchedTopic_whenTopicChangesWhileSessionOpens() {
      // Given
      List<Message> history =
          List.of(
              Message.builder()
                  .id("session-2-0")
                  .role(MessageRole.USER)
                  .content("old question")
                  .timestamp(NOW)
                  .build());
      when(sessionRegistry.fetchHistory("session-2")).thenReturn(history);
      when(sessionRegistry.create(any(), any(), any(), any()))
          .thenAnswer(
              invocation -> {
                engine.switchTopic("session-2");
                return SESSION_ID;
              });

      // When
      engine.sendMessage("Hi", List.of(), SendFlags.NONE);

      // Then
      assertThat(engine.getActiveSessionId()).contains("session-2");
      assertThat(engine.getMessages()).isEqualTo(history);
      assertThat(engine.isSending()).isFalse();
      assertThat(engine.getInFlightMessage()).isEmpty();
      verify(backendClient, never()).sendMessageStream(any());
      assertThat(stateRepository.loadSessionId()).contains("session-2");
      assertThat(notifications())
          .contains(NotificationEvent.error("Topic changed before the message was sent"));
    }

    @Test
    void shouldRemovePlaceholder_whenTransportFailsBeforeContent() {
      when(backendClient.sendMessageStream(any()))
          .thenReturn(Mono.error(new AgentBackendException("connection refused")));

      engine.sendMessage("Hi", List.of(), SendFlags.NONE);

      assertThat(engine.getMessages()).hasSize(1);
      assertThat(engine.isSending()).isFalse();
      assertThat(engine.hasActiveSubscription()).isFalse();
      assertThat(notifications())
          .anySatisfy(n -> assertThat(n.level()).isEqualTo(NotificationEvent.Level.ERROR));
    }

    @Test
    void shouldKeepPartialContent_whenTransportFailsMidStream() {
      // Given
      Sinks.Empty<Void> transport = Sinks.empty();
      when(backendClient.sendMessageStream(any())).thenReturn(transport.asMono());
      String placeholderId = send("Hi");
      emit(placeholderId, textDelta("Partial"));

      // When
      transport.tryEmitError(new AgentBackendException("connection reset"));

      // Then
      assertThat(engine.getMessages()).hasSize(2);
      assertThat(assistant().getContent()).isEqualTo("Partial");
      assertThat(assistant().isThinking()).isFalse();
      assertThat(engine.isSending()).isFalse();
    }

    @Test
    void shouldStayOpen_whenTransportCompletesWithoutFinalDone() {
      Sinks.Empty<Void> transport = Sinks.empty();
      when(backendClient.sendMessageStream(any())).thenReturn(transport.asMono());
      String placeholderId = send("Hi");

      transport.tryEmitEmpty();

      assertThat(engine.isSending()).isTrue();
      assertThat(emit(placeholderId, FINAL_DONE)).isTrue();
      assertThat(engine.isSending()).isFalse();
    }
  }

  @Nested
  @DisplayName("topics")
  class Topics {

    private final List<Message> otherHistory =
        List.of(
            Message.builder()
                .id("session-2-0")
                .role(MessageRole.USER)
                .content("old question")
                .timestamp(NOW)
                .build(),
            Message.builder()
                .id("session-2-1")
                .role(MessageRole.ASSISTANT)
                .content("old answer")
                .timestamp(NOW)
                .build());

    @Test
    void shouldNotTouchNewTranscript_whenSwitchingAwayMidGeneration() {
      // Given
      when(sessionRegistry.fetchHistory("session-2")).thenReturn(otherHistory);
      String placeholderId = send("Hi");
      emit(placeholderId, textDelta("A"));

      // When
      engine.switchTopic("session-2");
      emit(placeholderId, textDelta("B"));
      emit(placeholderId, FINAL_DONE);

      // Then
      assertThat(engine.getMessages()).isEqualTo(otherHistory);
      assertThat(engine.getActiveSessionId()).contains("session-2");
      assertThat(engine.isSending()).isFalse();
      assertThat(channelRegistry.isOpen("agent_stream_" + placeholderId)).isFalse();
    }

    @Test
    void shouldDoNothing_whenSwitchingToActiveTopic() {
      send("Hi");

      engine.switchTopic(SESSION_ID);

      verify(sessionRegistry, never()).fetchHistory(any());
      assertThat(engine.getMessages()).hasSize(2);
    }

    @Test
    void shouldSwitchWithEmptyTranscript_whenHistoryUnavailable() {
      when(sessionRegistry.fetchHistory("session-2"))
          .thenThrow(new AgentBackendException("timeout"));

      engine.switchTopic("session-2");

      assertThat(engine.getMessages()).isEmpty();
      assertThat(engine.getActiveSessionId()).contains("session-2");
      assertThat(notifications())
          .contains(NotificationEvent.error("Failed to load conversation history"));
    }

    @Test
    void shouldClearConversation_whenDeletingActiveTopic() {
      when(sessionRegistry.fetchHistory("session-2")).thenReturn(otherHistory);
      engine.switchTopic("session-2");

      engine.deleteTopic("session-2");

      verify(sessionRegistry).delete("session-2");
      assertThat(engine.getMessages()).isEmpty();
      assertThat(engine.getActiveSessionId()).isEmpty();
      assertThat(notifications()).contains(NotificationEvent.success("Topic deleted"));
    }

    @Test
    void shouldKeepState_whenDeleteFails() {
      when(sessionRegistry.fetchHistory("session-2")).thenReturn(otherHistory);
      engine.switchTopic("session-2");
      doThrow(new AgentBackendException("gone")).when(sessionRegistry).delete("session-2");

      engine.deleteTopic("session-2");

      assertThat(engine.getMessages()).hasSize(2);
      assertThat(engine.getActiveSessionId()).contains("session-2");
      assertThat(notifications()).contains(NotificationEvent.error("Failed to delete topic"));
    }

    @Test
    void shouldCacheTopics_whenLoaded() {
      Topic topic = new Topic("session-2", "New topic", NOW, 0);
      when(sessionRegistry.list()).thenReturn(List.of(topic));

      assertThat(engine.loadTopics()).containsExactly(topic);
      assertThat(engine.getTopics()).containsExactly(topic);
    }

    @Test
    void shouldForgetSession_whenClearingMessages() {
      String placeholderId = send("Hi");
      emit(placeholderId, FINAL_DONE);

      engine.clearMessages();

      assertThat(engine.getMessages()).isEmpty();
      assertThat(engine.getActiveSessionId()).isEmpty();
      assertThat(stateRepository.loadSessionId()).isEmpty();
    }
  }

  @Nested
  @DisplayName("local edits and settings")
  class LocalEditsAndSettings {

    @Test
    void shouldEditAndDeleteMessagesLocally() {
      String placeholderId = send("Hi");
      emit(placeholderId, textDelta("Hello"));
      emit(placeholderId, FINAL_DONE);
      String userId = engine.getMessages().get(0).getId();

      engine.editMessage(userId, "Hi there");
      engine.deleteMessage(placeholderId);

      assertThat(engine.getMessages())
          .singleElement()
          .extracting(Message::getContent)
          .isEqualTo("Hi there");
    }

    @Test
    void shouldFallBackToProvidersFirstModel_whenModelNotOffered() {
      engine.setProvider("openai");

      assertThat(engine.getProviderId()).isEqualTo("openai");
      assertThat(engine.getModel()).isEqualTo("gpt-4o");
      assertThat(preferenceRepository.getProvider("claude")).isEqualTo("openai");
      assertThat(preferenceRepository.getModel("")).isEqualTo("gpt-4o");
    }

    @Test
    void shouldKeepModel_whenProviderOffersIt() {
      engine.setModel("claude-opus-4-1");

      engine.setProvider("claude");

      assertThat(engine.getModel()).isEqualTo("claude-opus-4-1");
    }

    @Test
    void shouldOpenNewSessionWithPrompt_whenSystemPromptChanges() {
      // Given
      String placeholderId = send("Hi");
      emit(placeholderId, FINAL_DONE);

      // When
      engine.setSystemPrompt("Answer briefly.");

      // Then
      assertThat(engine.getActiveSessionId()).isEmpty();

      send("Again");
      verify(sessionRegistry).create(eq("claude"), any(), eq("Answer briefly."), isNull());
    }

    @Test
    void shouldKeepSession_whenSystemPromptUnchanged() {
      engine.setSystemPrompt("Answer briefly.");
      String placeholderId = send("Hi");
      emit(placeholderId, FINAL_DONE);

      engine.setSystemPrompt("Answer briefly.");

      assertThat(engine.getActiveSessionId()).contains(SESSION_ID);
    }

    @Test
    void shouldKeepTranscript_whenSessionInvalidated() {
      String placeholderId = send("Hi");
      emit(placeholderId, FINAL_DONE);

      engine.invalidateSession();

      assertThat(engine.getActiveSessionId()).isEmpty();
      assertThat(engine.getMessages()).hasSize(2);
    }
  }

  @Nested
  @DisplayName("restoring state")
  class RestoringState {

    @Test
    void shouldRestoreTranscriptAndSession_whenEngineRecreated() {
      // Given
      String placeholderId = send("Read a.txt");
      emit(placeholderId, textDelta("Checking."));
      emit(
          placeholderId,
          "{\"type\":\"tool_start\",\"tool_id\":\"t1\",\"tool_name\":\"read_file\","
              + "\"arguments\":\"{}\"}");
      emit(
          placeholderId,
          "{\"type\":\"tool_end\",\"tool_id\":\"t1\",\"result\":{\"success\":true,"
              + "\"output\":\"hello\"}}");
      emit(placeholderId, FINAL_DONE);
      List<Message> before = engine.getMessages();

      // When
      ConversationEngineImpl restored = newEngine();

      // Then
      assertThat(restored.getMessages()).isEqualTo(before);
      assertThat(restored.getActiveSessionId()).contains(SESSION_ID);
      assertThat(restored.isSending()).isFalse();
    }

    @Test
    void shouldClearThinkingFlag_whenRestoredMidGeneration() {
      String placeholderId = send("Hi");
      emit(placeholderId, textDelta("Half"));

      ConversationEngineImpl restored = newEngine();

      Message placeholder = restored.getMessages().get(1);
      assertThat(placeholder.isThinking()).isFalse();
      assertThat(placeholder.getContent()).isEqualTo("Half");
      assertThat(restored.isSending()).isFalse();
    }

    @Test
    void shouldRestorePreferences_whenEngineRecreated() {
      engine.setProvider("openai");
      engine.setModel("gpt-4o-mini");

      ConversationEngineImpl restored = newEngine();

      assertThat(restored.getProviderId()).isEqualTo("openai");
      assertThat(restored.getModel()).isEqualTo("gpt-4o-mini");
    }
  }
}
