package com.flamingo.ai.agentchat.exception;

/** Exception thrown when the agent could not open a session for a new conversation. */
public class SessionCreationException extends AgentBackendException {

  private final String providerId;

  public SessionCreationException(String providerId, Throwable cause) {
    super("Failed to create session for provider " + providerId, cause);
    this.providerId = providerId;
  }

  public String getProviderId() {
    return providerId;
  }
}
