package com.flamingo.ai.agentchat.domain.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** One interleaved unit of an assistant message: a text span or a tool invocation. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = ContentPart.Text.class, name = "text"),
  @JsonSubTypes.Type(value = ContentPart.ToolUse.class, name = "tool_use")
})
public sealed interface ContentPart permits ContentPart.Text, ContentPart.ToolUse {

  /** A run of streamed text. */
  record Text(String text) implements ContentPart {}

  /** A tool invocation shown inline at the point it started. */
  record ToolUse(ToolCall toolCall) implements ContentPart {}
}
