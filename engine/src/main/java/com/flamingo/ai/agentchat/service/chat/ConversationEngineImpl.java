package com.flamingo.ai.agentchat.service.chat;

import com.flamingo.ai.agentchat.channel.ChannelSubscription;
import com.flamingo.ai.agentchat.channel.EventChannelRegistry;
import com.flamingo.ai.agentchat.client.AgentBackendClient;
import com.flamingo.ai.agentchat.client.dto.ImagePayload;
import com.flamingo.ai.agentchat.client.dto.SendMessageRequest;
import com.flamingo.ai.agentchat.domain.enums.MessageRole;
import com.flamingo.ai.agentchat.domain.event.FileWriteProposedEvent;
import com.flamingo.ai.agentchat.domain.event.NotificationEvent;
import com.flamingo.ai.agentchat.domain.event.StreamEvent;
import com.flamingo.ai.agentchat.domain.event.TranscriptUpdatedEvent;
import com.flamingo.ai.agentchat.domain.model.Message;
import com.flamingo.ai.agentchat.domain.model.MessageImage;
import com.flamingo.ai.agentchat.domain.model.Topic;
import com.flamingo.ai.agentchat.exception.AgentBackendException;
import com.flamingo.ai.agentchat.exception.GenerationInProgressException;
import com.flamingo.ai.agentchat.persistence.ConversationStateRepository;
import com.flamingo.ai.agentchat.persistence.PreferenceRepository;
import com.flamingo.ai.agentchat.service.audio.AudioCueDispatcher;
import com.flamingo.ai.agentchat.service.provider.ProviderCatalog;
import com.flamingo.ai.agentchat.service.session.SessionRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Implementation of the ConversationEngine.
 *
 * <p>All state is guarded by {@code lock}. Network calls (session creation, history, deletion) run
 * outside it; channel events arrive on transport threads and are applied under it one at a time.
 * At most one {@link Generation} is current; a generation that was stopped or finished is closed
 * and ignores any event that still reaches it.
 */
@Service
@Slf4j
public class ConversationEngineImpl implements ConversationEngine {

  static final String CHANNEL_PREFIX = "agent_stream_";
  static final String NO_RESPONSE = "(No response)";
  static final String STOPPED = "(Generation stopped)";
  static final String ERROR_PREFIX = "Error: ";

  private final SessionRegistry sessionRegistry;
  private final AgentBackendClient backendClient;
  private final EventChannelRegistry channelRegistry;
  private final StreamEventParser eventParser;
  private final ContentAssembler contentAssembler;
  private final FileWriteIntentDetector writeIntentDetector;
  private final AudioCueDispatcher audioCueDispatcher;
  private final ConversationStateRepository stateRepository;
  private final PreferenceRepository preferenceRepository;
  private final ProviderCatalog providerCatalog;
  private final ApplicationEventPublisher eventPublisher;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  private final Object lock = new Object();
  private final List<Message> transcript = new ArrayList<>();
  private String activeSessionId;
  private Generation currentGeneration;
  private List<Topic> topics = List.of();
  private String providerId;
  private String model;
  private String systemPrompt;

  public ConversationEngineImpl(
      SessionRegistry sessionRegistry,
      AgentBackendClient backendClient,
      EventChannelRegistry channelRegistry,
      StreamEventParser eventParser,
      ContentAssembler contentAssembler,
      FileWriteIntentDetector writeIntentDetector,
      AudioCueDispatcher audioCueDispatcher,
      ConversationStateRepository stateRepository,
      PreferenceRepository preferenceRepository,
      ProviderCatalog providerCatalog,
      ApplicationEventPublisher eventPublisher,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.sessionRegistry = sessionRegistry;
    this.backendClient = backendClient;
    this.channelRegistry = channelRegistry;
    this.eventParser = eventParser;
    this.contentAssembler = contentAssembler;
    this.writeIntentDetector = writeIntentDetector;
    this.audioCueDispatcher = audioCueDispatcher;
    this.stateRepository = stateRepository;
    this.preferenceRepository = preferenceRepository;
    this.providerCatalog = providerCatalog;
    this.eventPublisher = eventPublisher;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
    restoreState();
  }

  private void restoreState() {
    for (Message message : stateRepository.loadTranscript()) {
      // no generation survives a reload, so nothing can finish a restored placeholder
      if (message.isThinking()) {
        message.setThinking(false);
        message.setThinkingLabel(null);
      }
      transcript.add(message);
    }
    activeSessionId = stateRepository.loadSessionId().orElse(null);
    providerId = preferenceRepository.getProvider(providerCatalog.defaultProvider());
    model =
        providerCatalog.resolveModel(
            providerId, preferenceRepository.getModel(providerCatalog.defaultModel()));
    log.info(
        "Restored {} messages, session={}, provider={}, model={}",
        transcript.size(),
        activeSessionId,
        providerId,
        model);
  }

  // ==================== Sending ====================

  @Override
  public void sendMessage(String text, List<MessageImage> images, SendFlags flags) {
    SendFlags sendFlags = flags != null ? flags : SendFlags.NONE;
    List<MessageImage> attached = images != null ? List.copyOf(images) : List.of();

    Generation generation;
    synchronized (lock) {
      if (currentGeneration != null) {
        throw new GenerationInProgressException(currentGeneration.placeholderId());
      }
      Instant now = clock.instant();
      Message userMessage =
          Message.builder()
              .id(newId())
              .role(MessageRole.USER)
              .content(text)
              .images(attached.isEmpty() ? null : new ArrayList<>(attached))
              .timestamp(now)
              .build();
      Message placeholder =
          Message.builder()
              .id(newId())
              .role(MessageRole.ASSISTANT)
              .content("")
              .thinking(true)
              .thinkingLabel(sendFlags.thinkingLabel())
              .timestamp(now)
              .build();

      transcript.add(userMessage);
      transcript.add(placeholder.copy());
      generation = new Generation(placeholder, CHANNEL_PREFIX + placeholder.getId());
      currentGeneration = generation;
      meterRegistry.counter("chat.generations.started").increment();
      transcriptChanged();
    }

    String sessionId;
    try {
      sessionId = ensureSession();
    } catch (RuntimeException e) {
      log.error(
          "Failed to establish session for message {}: {}",
          generation.placeholderId(),
          e.getMessage(),
          e);
      synchronized (lock) {
        abandon(generation);
      }
      notify(NotificationEvent.error("Failed to initialize session"));
      return;
    }
    if (sessionId == null) {
      synchronized (lock) {
        if (currentGeneration != generation) {
          return;
        }
        abandon(generation);
      }
      notify(NotificationEvent.error("Topic changed before the message was sent"));
      return;
    }

    SendMessageRequest request;
    synchronized (lock) {
      if (currentGeneration != generation) {
        log.info("Generation {} was stopped before streaming began", generation.placeholderId());
        return;
      }
      ChannelSubscription subscription =
          channelRegistry.subscribe(
              generation.channelName(), payload -> onChannelEvent(generation, payload));
      generation.attach(sessionId, subscription);
      request =
          SendMessageRequest.builder()
              .message(text)
              .eventName(generation.channelName())
              .sessionId(sessionId)
              .model(model == null || model.isBlank() ? null : model)
              .images(toPayload(attached))
              .providerType(providerId)
              .build();
    }

    log.info(
        "Sending message on {} (session={}, provider={}, model={})",
        request.getEventName(),
        sessionId,
        request.getProviderType(),
        request.getModel());
    try {
      backendClient
          .sendMessageStream(request)
          .subscribe(
              null,
              error -> onTransportFailure(generation, error),
              () -> onTransportComplete(generation));
    } catch (RuntimeException e) {
      onTransportFailure(generation, e);
    }
  }

  /**
   * Returns the active session id, opening a session when there is none. Returns {@code null} when
   * another topic became active while the session was being opened.
   */
  private String ensureSession() {
    String provider;
    String sessionModel;
    String prompt;
    synchronized (lock) {
      if (activeSessionId != null) {
        return activeSessionId;
      }
      provider = providerId;
      sessionModel = model;
      prompt = systemPrompt;
    }

    String created = sessionRegistry.create(provider, sessionModel, prompt, null);
    boolean superseded;
    synchronized (lock) {
      superseded = activeSessionId != null && !activeSessionId.equals(created);
      if (superseded) {
        log.warn(
            "Session {} opened after switching to {}, dropping the send", created, activeSessionId);
      } else {
        activeSessionId = created;
        persistState();
      }
    }
    loadTopics();
    return superseded ? null : created;
  }

  private void onChannelEvent(Generation generation, String payload) {
    Optional<StreamEvent> parsed = eventParser.parse(payload);
    if (parsed.isEmpty()) {
      return;
    }
    StreamEvent event = parsed.get();

    NotificationEvent notification = null;
    synchronized (lock) {
      if (generation.isClosed()) {
        log.debug(
            "Ignoring {} on released channel {}",
            event.getClass().getSimpleName(),
            generation.channelName());
        return;
      }
      notification = apply(generation, event);
      mirror(generation);
    }
    if (notification != null) {
      notify(notification);
    }
  }

  /** Applies one event to the generation's message; returns a notification to raise, if any. */
  private NotificationEvent apply(Generation generation, StreamEvent event) {
    Message message = generation.message();
    message.setContentParts(
        contentAssembler.reduce(message.getContentParts(), event, generation.tracker()));
    message.setToolCalls(new ArrayList<>(generation.tracker().toolCalls()));

    if (event instanceof StreamEvent.TextDelta delta) {
      generation.appendText(delta.text());
      message.setContent(generation.accumulatedText());
      message.setThinkingLabel(null);
      audioCueDispatcher.onTextDelta();
    } else if (event instanceof StreamEvent.ToolStart start) {
      log.debug(
          "Tool start {} ({}) on {}", start.toolName(), start.toolId(), generation.channelName());
      audioCueDispatcher.onToolStart();
      writeIntentDetector
          .detect(start)
          .ifPresent(
              intent ->
                  eventPublisher.publishEvent(
                      new FileWriteProposedEvent(
                          message.getId(), start.toolId(), intent.path(), intent.content())));
    } else if (event instanceof StreamEvent.ToolEnd end) {
      log.debug("Tool end {} on {}", end.toolId(), generation.channelName());
    } else if (event instanceof StreamEvent.Done done) {
      // one turn ended; the tool loop may continue on the same channel
      generation.recordUsage(done.usage());
      if (!generation.accumulatedText().isEmpty()) {
        message.setContent(generation.accumulatedText());
      }
      log.debug("Turn finished on {}, waiting for more events", generation.channelName());
    } else if (event instanceof StreamEvent.FinalDone finalDone) {
      generation.recordUsage(finalDone.usage());
      String text = generation.accumulatedText();
      finish(generation, text.isEmpty() ? NO_RESPONSE : text);
      meterRegistry.counter("chat.generations.completed").increment();
      log.info(
          "Generation {} completed: {} chars, {} tool calls, usage={}",
          generation.placeholderId(),
          text.length(),
          generation.tracker().toolCalls().size(),
          generation.lastUsage());
    } else if (event instanceof StreamEvent.StreamError error) {
      String text = generation.accumulatedText();
      finish(generation, text.isEmpty() ? ERROR_PREFIX + error.message() : text);
      meterRegistry.counter("chat.generations.failed").increment();
      log.error("Generation {} failed: {}", generation.placeholderId(), error.message());
      return NotificationEvent.error("Response error: " + error.message());
    } else {
      log.warn("Unhandled stream event {}", event);
    }
    return null;
  }

  /** Ends a generation: the message stops thinking, the channel is released. */
  private void finish(Generation generation, String content) {
    Message message = generation.message();
    message.setThinking(false);
    message.setThinkingLabel(null);
    message.setContent(content);
    generation.close();
    if (currentGeneration == generation) {
      currentGeneration = null;
    }
  }

  /** Drops a generation that never produced anything, taking its placeholder out again. */
  private void abandon(Generation generation) {
    generation.close();
    transcript.removeIf(m -> m.getId().equals(generation.placeholderId()));
    if (currentGeneration == generation) {
      currentGeneration = null;
    }
    meterRegistry.counter("chat.generations.failed").increment();
    transcriptChanged();
  }

  private void onTransportFailure(Generation generation, Throwable error) {
    log.error(
        "Streaming request on {} failed: {}", generation.channelName(), error.getMessage(), error);
    synchronized (lock) {
      if (generation.isClosed()) {
        log.debug(
            "Generation {} already closed, ignoring transport failure", generation.placeholderId());
        return;
      }
      if (generation.hasContent()) {
        finish(generation, generation.accumulatedText());
        meterRegistry.counter("chat.generations.failed").increment();
        mirror(generation);
      } else {
        abandon(generation);
      }
    }
    String reason =
        error instanceof AgentBackendException backendError
            ? backendError.getUserMessage()
            : error.getMessage();
    notify(NotificationEvent.error("Failed to send message: " + reason));
  }

  private void onTransportComplete(Generation generation) {
    synchronized (lock) {
      if (!generation.isClosed()) {
        log.warn(
            "Stream {} ended without final_done; response stays open until stopped",
            generation.channelName());
      }
    }
  }

  @Override
  public void stopSending() {
    synchronized (lock) {
      Generation generation = currentGeneration;
      if (generation == null) {
        log.debug("stopSending called with nothing in flight");
        return;
      }
      generation.close();
      Message message = generation.message();
      message.setThinking(false);
      message.setThinkingLabel(null);
      if (message.getContent() == null || message.getContent().isEmpty()) {
        message.setContent(STOPPED);
      }
      currentGeneration = null;
      meterRegistry.counter("chat.generations.stopped").increment();
      log.info("Stopped generation {}", generation.placeholderId());
      mirror(generation);
    }
    notify(NotificationEvent.info("Generation stopped"));
  }

  // ==================== Topics ====================

  @Override
  public void switchTopic(String sessionId) {
    synchronized (lock) {
      if (Objects.equals(sessionId, activeSessionId)) {
        return;
      }
    }

    List<Message> history;
    boolean loaded = true;
    try {
      history = sessionRegistry.fetchHistory(sessionId);
    } catch (RuntimeException e) {
      log.error("Failed to load history of session {}: {}", sessionId, e.getMessage());
      history = List.of();
      loaded = false;
    }

    synchronized (lock) {
      transcript.clear();
      transcript.addAll(history);
      activeSessionId = sessionId;
      log.info("Switched to session {} with {} messages", sessionId, history.size());
      transcriptChanged();
    }
    notify(
        loaded
            ? NotificationEvent.info("Switched topic")
            : NotificationEvent.error("Failed to load conversation history"));
  }

  @Override
  public void deleteTopic(String sessionId) {
    try {
      sessionRegistry.delete(sessionId);
    } catch (RuntimeException e) {
      log.error("Failed to delete session {}: {}", sessionId, e.getMessage());
      notify(NotificationEvent.error("Failed to delete topic"));
      return;
    }

    synchronized (lock) {
      topics = topics.stream().filter(t -> !t.id().equals(sessionId)).toList();
      if (sessionId.equals(activeSessionId)) {
        activeSessionId = null;
        transcript.clear();
        transcriptChanged();
      }
    }
    notify(NotificationEvent.success("Topic deleted"));
  }

  @Override
  public List<Topic> loadTopics() {
    List<Topic> loaded = sessionRegistry.list();
    synchronized (lock) {
      topics = List.copyOf(loaded);
      return topics;
    }
  }

  @Override
  public void clearMessages() {
    synchronized (lock) {
      transcript.clear();
      activeSessionId = null;
      transcriptChanged();
    }
    notify(NotificationEvent.success("New topic created"));
  }

  @Override
  public void deleteMessage(String messageId) {
    synchronized (lock) {
      if (transcript.removeIf(m -> m.getId().equals(messageId))) {
        transcriptChanged();
      }
    }
  }

  @Override
  public void editMessage(String messageId, String content) {
    synchronized (lock) {
      for (Message message : transcript) {
        if (message.getId().equals(messageId)) {
          message.setContent(content);
          transcriptChanged();
          return;
        }
      }
    }
  }

  // ==================== Provider, model, prompt ====================

  @Override
  public void setProvider(String providerId) {
    synchronized (lock) {
      this.providerId = providerId;
      String resolved = providerCatalog.resolveModel(providerId, model);
      if (!Objects.equals(resolved, model)) {
        log.info("Model {} is not offered by {}, switching to {}", model, providerId, resolved);
        model = resolved;
      }
      preferenceRepository.saveProvider(providerId);
      preferenceRepository.saveModel(model);
    }
  }

  @Override
  public void setModel(String model) {
    synchronized (lock) {
      this.model = model;
      preferenceRepository.saveModel(model);
    }
  }

  @Override
  public void setSystemPrompt(String systemPrompt) {
    synchronized (lock) {
      if (Objects.equals(this.systemPrompt, systemPrompt)) {
        return;
      }
      this.systemPrompt = systemPrompt;
      if (activeSessionId != null) {
        log.info("System prompt changed, dropping session {}", activeSessionId);
        activeSessionId = null;
        persistState();
      }
    }
  }

  @Override
  public void invalidateSession() {
    synchronized (lock) {
      activeSessionId = null;
      persistState();
    }
  }

  // ==================== Accessors ====================

  @Override
  public List<Message> getMessages() {
    synchronized (lock) {
      return snapshot();
    }
  }

  @Override
  public boolean isSending() {
    synchronized (lock) {
      return currentGeneration != null;
    }
  }

  @Override
  public Optional<String> getActiveSessionId() {
    synchronized (lock) {
      return Optional.ofNullable(activeSessionId);
    }
  }

  @Override
  public List<Topic> getTopics() {
    synchronized (lock) {
      return topics;
    }
  }

  @Override
  public String getProviderId() {
    synchronized (lock) {
      return providerId;
    }
  }

  @Override
  public String getModel() {
    synchronized (lock) {
      return model;
    }
  }

  @Override
  public Optional<Message> getInFlightMessage() {
    synchronized (lock) {
      return Optional.ofNullable(currentGeneration).map(g -> g.message().copy());
    }
  }

  @Override
  public boolean hasActiveSubscription() {
    synchronized (lock) {
      return currentGeneration != null && currentGeneration.hasSubscription();
    }
  }

  // ==================== Internals (call with lock held) ====================

  /** Copies the generation's message into the transcript if it is still shown there. */
  private void mirror(Generation generation) {
    String id = generation.placeholderId();
    for (int i = 0; i < transcript.size(); i++) {
      if (transcript.get(i).getId().equals(id)) {
        transcript.set(i, generation.message().copy());
        break;
      }
    }
    transcriptChanged();
  }

  private void transcriptChanged() {
    persistState();
    eventPublisher.publishEvent(
        new TranscriptUpdatedEvent(snapshot(), activeSessionId, currentGeneration != null));
  }

  private void persistState() {
    stateRepository.saveTranscript(transcript);
    stateRepository.saveSessionId(activeSessionId);
  }

  private List<Message> snapshot() {
    return transcript.stream().map(Message::copy).toList();
  }

  private void notify(NotificationEvent notification) {
    eventPublisher.publishEvent(notification);
  }

  private static List<ImagePayload> toPayload(List<MessageImage> images) {
    if (images.isEmpty()) {
      return null;
    }
    return images.stream().map(i -> new ImagePayload(i.data(), i.mediaType())).toList();
  }

  private static String newId() {
    return UUID.randomUUID().toString();
  }
}
