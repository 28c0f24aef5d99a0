package com.flamingo.ai.agentchat.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.agentchat.domain.enums.ToolCallStatus;
import java.time.Instant;

/**
 * A tool invocation observed in a streamed response.
 *
 * @param id identifier unique within its message
 * @param name tool name as reported by the agent
 * @param arguments serialized parameters, opaque to the engine
 * @param status lifecycle state
 * @param result execution result, present once terminal
 * @param startTime when the start event was applied
 * @param endTime when the end event was applied
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolCall(
    String id,
    String name,
    String arguments,
    ToolCallStatus status,
    ToolExecutionResult result,
    Instant startTime,
    Instant endTime) {

  public static ToolCall running(String id, String name, String arguments, Instant startTime) {
    return new ToolCall(id, name, arguments, ToolCallStatus.RUNNING, null, startTime, null);
  }

  /** Returns the terminal copy of this call for the given result. */
  public ToolCall finish(ToolExecutionResult result, Instant endTime) {
    ToolCallStatus terminal =
        result != null && result.success() ? ToolCallStatus.COMPLETED : ToolCallStatus.FAILED;
    return new ToolCall(id, name, arguments, terminal, result, startTime, endTime);
  }

  @JsonIgnore
  public boolean isFinished() {
    return status != null && status.isTerminal();
  }
}
