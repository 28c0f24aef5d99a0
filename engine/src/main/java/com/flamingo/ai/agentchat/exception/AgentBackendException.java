package com.flamingo.ai.agentchat.exception;

/** Exception thrown when a call to the agent backend fails. */
public class AgentBackendException extends RuntimeException {

  private final String userMessage;

  public AgentBackendException(String message) {
    super(message);
    this.userMessage = "The agent is not reachable. Please check that it is running.";
  }

  public AgentBackendException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "The agent is not reachable. Please check that it is running.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
