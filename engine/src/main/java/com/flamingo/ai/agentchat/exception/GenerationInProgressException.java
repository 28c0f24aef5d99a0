package com.flamingo.ai.agentchat.exception;

/** Exception thrown when a message is sent while another generation is still streaming. */
public class GenerationInProgressException extends RuntimeException {

  private final String placeholderId;

  public GenerationInProgressException(String placeholderId) {
    super("A response is still being generated for message: " + placeholderId);
    this.placeholderId = placeholderId;
  }

  public String getPlaceholderId() {
    return placeholderId;
  }
}
