package com.flamingo.ai.agentchat.exception;

/** Exception thrown when a local key-value store cannot be read or written. */
public class StateStoreException extends RuntimeException {

  public StateStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
