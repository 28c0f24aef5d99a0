package com.flamingo.ai.agentchat.service.chat;

import com.flamingo.ai.agentchat.channel.ChannelSubscription;
import com.flamingo.ai.agentchat.domain.model.Message;
import com.flamingo.ai.agentchat.domain.model.TokenUsage;

/**
 * State of one in-flight response: its own working copy of the placeholder message, the tool calls
 * seen so far and the channel handle. Guarded by the engine lock.
 */
final class Generation {

  private final Message message;
  private final String channelName;
  private final ToolCallTracker tracker = new ToolCallTracker();
  private final StringBuilder text = new StringBuilder();
  private String sessionId;
  private ChannelSubscription subscription;
  private TokenUsage lastUsage;
  private boolean closed;

  Generation(Message placeholder, String channelName) {
    this.message = placeholder;
    this.channelName = channelName;
  }

  String placeholderId() {
    return message.getId();
  }

  Message message() {
    return message;
  }

  String channelName() {
    return channelName;
  }

  ToolCallTracker tracker() {
    return tracker;
  }

  String sessionId() {
    return sessionId;
  }

  void attach(String sessionId, ChannelSubscription subscription) {
    this.sessionId = sessionId;
    this.subscription = subscription;
  }

  boolean hasSubscription() {
    return subscription != null;
  }

  void appendText(String fragment) {
    text.append(fragment);
  }

  String accumulatedText() {
    return text.toString();
  }

  boolean hasContent() {
    return text.length() > 0 || !message.getContentParts().isEmpty();
  }

  void recordUsage(TokenUsage usage) {
    if (usage != null) {
      lastUsage = usage;
    }
  }

  TokenUsage lastUsage() {
    return lastUsage;
  }

  boolean isClosed() {
    return closed;
  }

  /** Marks the generation finished and releases its channel. Safe to call repeatedly. */
  void close() {
    closed = true;
    ChannelSubscription current = subscription;
    subscription = null;
    if (current != null) {
      current.unsubscribe();
    }
  }
}
