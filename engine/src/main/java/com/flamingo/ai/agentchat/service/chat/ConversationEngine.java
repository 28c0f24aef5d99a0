package com.flamingo.ai.agentchat.service.chat;

import com.flamingo.ai.agentchat.domain.model.Message;
import com.flamingo.ai.agentchat.domain.model.MessageImage;
import com.flamingo.ai.agentchat.domain.model.Topic;
import java.util.List;
import java.util.Optional;

/**
 * Drives one conversation with the agent: sends messages, folds the streamed response into the
 * transcript and manages the active session (topic).
 */
public interface ConversationEngine {

  /**
   * Sends a user message. The user message and an assistant placeholder are added before any
   * network call; the response then streams into the placeholder asynchronously.
   *
   * @param text the message text
   * @param images attached images, may be empty
   * @param flags per-send options
   * @throws com.flamingo.ai.agentchat.exception.GenerationInProgressException if a response is
   *     still streaming
   */
  void sendMessage(String text, List<MessageImage> images, SendFlags flags);

  /** Detaches from the in-flight response. No-op when nothing is streaming. */
  void stopSending();

  /**
   * Makes another session the active one and loads its history. Does not stop a response that is
   * still streaming for the previous session.
   */
  void switchTopic(String sessionId);

  void deleteTopic(String sessionId);

  /** Refreshes the cached topic list from the agent. */
  List<Topic> loadTopics();

  /** Starts a new conversation: empties the transcript and forgets the active session. */
  void clearMessages();

  void deleteMessage(String messageId);

  void editMessage(String messageId, String content);

  void setProvider(String providerId);

  void setModel(String model);

  /**
   * Sets the system prompt used for new sessions. A different prompt cannot apply to an existing
   * session, so the active session is dropped and the next send opens a new one.
   */
  void setSystemPrompt(String systemPrompt);

  /** Forgets the active session without touching the transcript. */
  void invalidateSession();

  List<Message> getMessages();

  boolean isSending();

  Optional<String> getActiveSessionId();

  List<Topic> getTopics();

  String getProviderId();

  String getModel();

  /** The message of the response currently streaming, even if it is no longer in the transcript. */
  Optional<Message> getInFlightMessage();

  /** Whether the in-flight response still holds a channel listener. */
  boolean hasActiveSubscription();
}
