package com.flamingo.ai.agentchat.client;

import com.flamingo.ai.agentchat.client.dto.AgentHistoryMessage;
import com.flamingo.ai.agentchat.client.dto.CreateSessionRequest;
import com.flamingo.ai.agentchat.client.dto.ProcessStatus;
import com.flamingo.ai.agentchat.client.dto.SendMessageRequest;
import com.flamingo.ai.agentchat.client.dto.SessionInfo;
import java.util.List;
import reactor.core.publisher.Mono;

/**
 * Operations exposed by the local agent process. Request/response calls block and throw {@link
 * com.flamingo.ai.agentchat.exception.AgentBackendException} on failure.
 */
public interface AgentBackendClient {

  ProcessStatus startProcess();

  ProcessStatus stopProcess();

  ProcessStatus getProcessStatus();

  /**
   * Opens a new session.
   *
   * @param request provider, model and optional system prompt for the session
   * @return the id of the new session
   */
  String createSession(CreateSessionRequest request);

  List<SessionInfo> listSessions();

  List<AgentHistoryMessage> getSessionMessages(String sessionId);

  void deleteSession(String sessionId);

  /**
   * Issues a streaming send. Events for the generation are published on the channel named by
   * {@link SendMessageRequest#getEventName()}; the returned Mono only reports transport completion
   * or failure.
   *
   * @param request the message and its routing
   * @return completes when the agent closes the stream
   */
  Mono<Void> sendMessageStream(SendMessageRequest request);
}
