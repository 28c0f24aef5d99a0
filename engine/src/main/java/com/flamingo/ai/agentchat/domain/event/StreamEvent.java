package com.flamingo.ai.agentchat.domain.event;

import com.flamingo.ai.agentchat.domain.model.TokenUsage;
import com.flamingo.ai.agentchat.domain.model.ToolExecutionResult;

/**
 * Typed event delivered on a generation's channel.
 *
 * <p>{@link Done} ends one model turn only; the tool loop may keep emitting on the same channel.
 * Only {@link FinalDone} and {@link StreamError} end a generation.
 */
public sealed interface StreamEvent
    permits StreamEvent.TextDelta,
        StreamEvent.ToolStart,
        StreamEvent.ToolEnd,
        StreamEvent.Done,
        StreamEvent.FinalDone,
        StreamEvent.StreamError {

  default boolean isTerminal() {
    return this instanceof FinalDone || this instanceof StreamError;
  }

  record TextDelta(String text) implements StreamEvent {}

  record ToolStart(String toolId, String toolName, String arguments) implements StreamEvent {}

  record ToolEnd(String toolId, ToolExecutionResult result) implements StreamEvent {}

  record Done(TokenUsage usage) implements StreamEvent {}

  record FinalDone(TokenUsage usage) implements StreamEvent {}

  record StreamError(String message) implements StreamEvent {}
}
