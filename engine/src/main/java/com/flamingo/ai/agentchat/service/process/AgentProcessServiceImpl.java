package com.flamingo.ai.agentchat.service.process;

import com.flamingo.ai.agentchat.client.AgentBackendClient;
import com.flamingo.ai.agentchat.client.dto.ProcessStatus;
import com.flamingo.ai.agentchat.domain.event.NotificationEvent;
import com.flamingo.ai.agentchat.exception.AgentBackendException;
import com.flamingo.ai.agentchat.service.chat.ConversationEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/** Implementation of AgentProcessService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentProcessServiceImpl implements AgentProcessService {

  private final AgentBackendClient backendClient;
  private final ConversationEngine conversationEngine;
  private final ApplicationEventPublisher eventPublisher;

  @Override
  public ProcessStatus start() {
    try {
      ProcessStatus status = backendClient.startProcess();
      log.info("Agent process started: running={}", status.running());
      eventPublisher.publishEvent(NotificationEvent.success("Agent started"));
      return status;
    } catch (AgentBackendException e) {
      log.error("Failed to start agent process: {}", e.getMessage(), e);
      eventPublisher.publishEvent(NotificationEvent.error("Failed to start agent"));
      throw e;
    }
  }

  @Override
  public ProcessStatus stop() {
    try {
      ProcessStatus status = backendClient.stopProcess();
      conversationEngine.invalidateSession();
      log.info("Agent process stopped, active session dropped");
      eventPublisher.publishEvent(NotificationEvent.success("Agent stopped"));
      return status;
    } catch (AgentBackendException e) {
      log.error("Failed to stop agent process: {}", e.getMessage(), e);
      eventPublisher.publishEvent(NotificationEvent.error("Failed to stop agent"));
      throw e;
    }
  }

  @Override
  public ProcessStatus status() {
    try {
      return backendClient.getProcessStatus();
    } catch (AgentBackendException e) {
      log.warn("Could not query agent process status: {}", e.getMessage());
      return ProcessStatus.stopped();
    }
  }
}
