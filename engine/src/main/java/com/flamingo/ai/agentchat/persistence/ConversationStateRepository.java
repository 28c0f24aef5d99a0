package com.flamingo.ai.agentchat.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.agentchat.domain.model.Message;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Current session id and transcript, kept for reloads within one run of the application. */
public class ConversationStateRepository extends JsonStateRepository {

  static final String SESSION_ID_KEY = "agent_curr_sessionId";
  static final String MESSAGES_KEY = "agent_messages";

  private static final TypeReference<String> STRING = new TypeReference<>() {};
  private static final TypeReference<List<Message>> MESSAGES = new TypeReference<>() {};

  public ConversationStateRepository(KeyValueStore store, ObjectMapper objectMapper) {
    super(store, objectMapper);
  }

  public Optional<String> loadSessionId() {
    return Optional.ofNullable(read(SESSION_ID_KEY, STRING, null));
  }

  /** Stores the active session id, or clears it when {@code sessionId} is null. */
  public void saveSessionId(String sessionId) {
    write(SESSION_ID_KEY, sessionId);
  }

  public List<Message> loadTranscript() {
    return read(MESSAGES_KEY, MESSAGES, new ArrayList<>());
  }

  public void saveTranscript(List<Message> messages) {
    write(MESSAGES_KEY, messages);
  }
}
