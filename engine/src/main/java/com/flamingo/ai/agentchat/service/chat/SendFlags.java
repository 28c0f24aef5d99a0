package com.flamingo.ai.agentchat.service.chat;

/**
 * Per-send options chosen by the user.
 *
 * @param webSearch the agent may search the web
 * @param thinking the agent should reason at length before answering
 */
public record SendFlags(boolean webSearch, boolean thinking) {

  public static final SendFlags NONE = new SendFlags(false, false);

  /** Status text for the placeholder until the first text arrives. */
  public String thinkingLabel() {
    if (thinking && webSearch) {
      return "Deep thinking + web search...";
    }
    if (thinking) {
      return "Deep thinking...";
    }
    if (webSearch) {
      return "Searching the web...";
    }
    return "Thinking...";
  }
}
