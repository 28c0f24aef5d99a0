package com.flamingo.ai.agentchat.client.dto;

/** Running state of the agent process. */
public record ProcessStatus(boolean running) {

  public static ProcessStatus stopped() {
    return new ProcessStatus(false);
  }
}
