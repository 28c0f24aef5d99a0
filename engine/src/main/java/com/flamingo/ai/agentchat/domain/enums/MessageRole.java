package com.flamingo.ai.agentchat.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

/** Defines the role of a transcript message sender. */
public enum MessageRole {
  /** Message typed by the user. */
  USER,

  /** Message generated by the agent. */
  ASSISTANT;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static MessageRole fromWireName(String value) {
    return MessageRole.valueOf(value.toUpperCase(Locale.ROOT));
  }

  /** Resolves a role name as stored by the agent, empty for roles the transcript does not show. */
  public static Optional<MessageRole> lookup(String value) {
    if (value == null) {
      return Optional.empty();
    }
    for (MessageRole role : values()) {
      if (role.wireName().equalsIgnoreCase(value)) {
        return Optional.of(role);
      }
    }
    return Optional.empty();
  }
}
