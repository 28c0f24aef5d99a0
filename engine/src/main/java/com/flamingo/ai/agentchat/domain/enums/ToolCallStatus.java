package com.flamingo.ai.agentchat.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Lifecycle state of a tool invocation. */
public enum ToolCallStatus {
  RUNNING,
  COMPLETED,
  FAILED;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static ToolCallStatus fromWireName(String value) {
    return ToolCallStatus.valueOf(value.toUpperCase(Locale.ROOT));
  }

  public boolean isTerminal() {
    return this != RUNNING;
  }
}
