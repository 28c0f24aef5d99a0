package com.flamingo.ai.agentchat.service.session;

import com.flamingo.ai.agentchat.client.dto.SkillInfo;
import com.flamingo.ai.agentchat.domain.model.Message;
import com.flamingo.ai.agentchat.domain.model.Topic;
import java.util.List;

/** CRUD over the agent's conversation sessions. */
public interface SessionRegistry {

  /**
   * Lists known sessions. Never fails: an unreachable agent yields an empty list.
   *
   * @return topics in the order the agent reports them
   */
  List<Topic> list();

  /**
   * Opens a new session.
   *
   * @param providerId provider the session starts with
   * @param model model the session starts with, may be null
   * @param systemPrompt instructions for the session, may be null
   * @param skills skills to advertise, may be null
   * @return the new session id
   * @throws com.flamingo.ai.agentchat.exception.SessionCreationException if the agent refuses
   */
  String create(String providerId, String model, String systemPrompt, List<SkillInfo> skills);

  /**
   * Fetches the stored messages of a session, normalized for display.
   *
   * @param sessionId the session ID
   * @return user and assistant messages with plain text content
   * @throws com.flamingo.ai.agentchat.exception.AgentBackendException if the fetch fails
   */
  List<Message> fetchHistory(String sessionId);

  /**
   * Deletes a session on the agent.
   *
   * @param sessionId the session ID
   */
  void delete(String sessionId);
}
