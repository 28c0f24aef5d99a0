package com.flamingo.ai.agentchat.service.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.agentchat.client.AgentBackendClient;
import com.flamingo.ai.agentchat.client.dto.AgentHistoryMessage;
import com.flamingo.ai.agentchat.client.dto.CreateSessionRequest;
import com.flamingo.ai.agentchat.client.dto.SessionInfo;
import com.flamingo.ai.agentchat.client.dto.SkillInfo;
import com.flamingo.ai.agentchat.domain.enums.MessageRole;
import com.flamingo.ai.agentchat.domain.model.Message;
import com.flamingo.ai.agentchat.domain.model.Topic;
import com.flamingo.ai.agentchat.exception.SessionCreationException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of the SessionRegistry backed by the agent process. */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionRegistryImpl implements SessionRegistry {

  static final String NEW_TOPIC_TITLE = "New topic";

  private static final DateTimeFormatter TITLE_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

  private final AgentBackendClient backendClient;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Override
  @Timed(value = "session.list", description = "Time to list sessions")
  public List<Topic> list() {
    try {
      return backendClient.listSessions().stream().map(this::toTopic).toList();
    } catch (RuntimeException e) {
      log.error("Failed to list sessions: {}", e.getMessage());
      return List.of();
    }
  }

  @Override
  @Timed(value = "session.create", description = "Time to create a session")
  public String create(
      String providerId, String model, String systemPrompt, List<SkillInfo> skills) {
    log.info("Creating session for provider {} with model {}", providerId, model);

    CreateSessionRequest request =
        CreateSessionRequest.builder()
            .providerType(providerId)
            .model(model == null || model.isBlank() ? null : model)
            .systemPrompt(systemPrompt)
            .skills(skills == null || skills.isEmpty() ? null : skills)
            .build();

    String sessionId;
    try {
      sessionId = backendClient.createSession(request);
    } catch (RuntimeException e) {
      meterRegistry.counter("session.create.failed").increment();
      throw new SessionCreationException(providerId, e);
    }

    meterRegistry.counter("session.created").increment();
    log.info("Created session with ID: {}", sessionId);
    return sessionId;
  }

  @Override
  @Timed(value = "session.history", description = "Time to fetch session history")
  public List<Message> fetchHistory(String sessionId) {
    List<AgentHistoryMessage> stored = backendClient.getSessionMessages(sessionId);
    List<Message> history = new ArrayList<>(stored.size());

    for (int index = 0; index < stored.size(); index++) {
      AgentHistoryMessage raw = stored.get(index);
      Optional<MessageRole> role = MessageRole.lookup(raw.role());
      if (role.isEmpty()) {
        log.trace("Skipping {} message {} of session {}", raw.role(), index, sessionId);
        continue;
      }
      history.add(
          Message.builder()
              .id(sessionId + "-" + index)
              .role(role.get())
              .content(extractText(raw.content()))
              .thinking(false)
              .timestamp(parseInstant(raw.timestamp()))
              .build());
    }

    log.debug(
        "Loaded {} of {} stored messages for session {}",
        history.size(),
        stored.size(),
        sessionId);
    return history;
  }

  @Override
  @Timed(value = "session.delete", description = "Time to delete a session")
  public void delete(String sessionId) {
    backendClient.deleteSession(sessionId);
    log.info("Deleted session: {}", sessionId);
    meterRegistry.counter("session.deleted").increment();
  }

  private Topic toTopic(SessionInfo info) {
    Instant createdAt = parseInstant(info.createdAt());
    int count = info.messagesCount();
    return new Topic(info.sessionId(), titleFor(createdAt, count), createdAt, count);
  }

  private String titleFor(Instant createdAt, int messageCount) {
    if (messageCount == 0) {
      return NEW_TOPIC_TITLE;
    }
    return "Topic " + TITLE_FORMAT.format(createdAt.atZone(clock.getZone()));
  }

  /** Joins text blocks with newlines; plain string content is taken as is. */
  static String extractText(JsonNode content) {
    if (content == null || content.isNull() || content.isMissingNode()) {
      return "";
    }
    if (content.isTextual()) {
      return content.asText();
    }
    if (content.isArray()) {
      return StreamSupport.stream(content.spliterator(), false)
          .filter(block -> "text".equals(block.path("type").asText()))
          .map(block -> block.path("text").asText(""))
          .collect(Collectors.joining("\n"));
    }
    return "";
  }

  private Instant parseInstant(String value) {
    if (value == null || value.isBlank()) {
      return clock.instant();
    }
    try {
      return OffsetDateTime.parse(value).toInstant();
    } catch (DateTimeParseException e) {
      log.debug("Unparsable timestamp '{}', using current time", value);
      return clock.instant();
    }
  }
}
