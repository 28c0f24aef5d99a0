package com.flamingo.ai.agentchat.service.process;

import com.flamingo.ai.agentchat.client.dto.ProcessStatus;

/** Lifecycle of the local agent process. */
public interface AgentProcessService {

  /** Starts the agent process; failures are reported as a notification. */
  ProcessStatus start();

  /** Stops the agent process. A stopped process takes its sessions with it. */
  ProcessStatus stop();

  /** Current state of the agent process; {@code running=false} when it cannot be queried. */
  ProcessStatus status();
}
