package com.flamingo.ai.agentchat.service.chat;

import com.flamingo.ai.agentchat.domain.model.ToolCall;
import com.flamingo.ai.agentchat.domain.model.ToolExecutionResult;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Tool calls of one assistant message. A call starts {@code running} and moves exactly once to
 * {@code completed} or {@code failed}; later end events for it are ignored. Ids are only unique
 * within a message, so every generation gets its own tracker.
 *
 * <p>Not thread-safe; the engine applies events under its lock.
 */
@Slf4j
public class ToolCallTracker {

  private final Map<String, ToolCall> calls = new LinkedHashMap<>();

  /**
   * Registers a running call.
   *
   * @return the new call, or empty if a call with this id already exists
   */
  public Optional<ToolCall> start(String toolId, String name, String arguments, Instant startTime) {
    if (calls.containsKey(toolId)) {
      log.debug("Tool call {} already started, ignoring duplicate", toolId);
      return Optional.empty();
    }
    ToolCall call = ToolCall.running(toolId, name, arguments, startTime);
    calls.put(toolId, call);
    return Optional.of(call);
  }

  /**
   * Moves a running call to its terminal state.
   *
   * @return the finished call, or empty if the id is unknown or the call already finished
   */
  public Optional<ToolCall> finish(String toolId, ToolExecutionResult result, Instant endTime) {
    ToolCall current = calls.get(toolId);
    if (current == null) {
      log.debug("Tool end for unknown call {}, ignoring", toolId);
      return Optional.empty();
    }
    if (current.isFinished()) {
      log.debug("Tool call {} already {}, ignoring end", toolId, current.status());
      return Optional.empty();
    }
    ToolCall finished = current.finish(result, endTime);
    calls.put(toolId, finished);
    return Optional.of(finished);
  }

  public Optional<ToolCall> find(String toolId) {
    return Optional.ofNullable(calls.get(toolId));
  }

  /** Calls in start order. */
  public List<ToolCall> toolCalls() {
    return List.copyOf(calls.values());
  }
}
