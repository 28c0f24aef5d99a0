package com.flamingo.ai.agentchat.service.chat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.agentchat.domain.event.StreamEvent;
import com.flamingo.ai.agentchat.domain.model.TokenUsage;
import com.flamingo.ai.agentchat.domain.model.ToolExecutionResult;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns raw channel payloads into {@link StreamEvent}s. Anything that cannot be parsed, or carries
 * an unknown {@code type}, is logged and dropped instead of failing the channel.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StreamEventParser {

  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  public Optional<StreamEvent> parse(String payload) {
    JsonNode node;
    try {
      node = objectMapper.readTree(payload);
    } catch (JsonProcessingException e) {
      return drop("unparsable payload", payload);
    }
    if (node == null || !node.isObject()) {
      return drop("payload is not an object", payload);
    }

    String type = node.path("type").asText("");
    return switch (type) {
      case "text_delta" -> textDelta(node, payload);
      case "tool_start" -> toolStart(node, payload);
      case "tool_end" -> toolEnd(node, payload);
      case "done" -> Optional.of(new StreamEvent.Done(usage(node)));
      case "final_done" -> Optional.of(new StreamEvent.FinalDone(usage(node)));
      case "error" ->
          Optional.of(new StreamEvent.StreamError(node.path("message").asText("Unknown error")));
      default -> drop("unknown event type '" + type + "'", payload);
    };
  }

  private Optional<StreamEvent> textDelta(JsonNode node, String payload) {
    JsonNode text = node.get("text");
    if (text == null || !text.isTextual()) {
      return drop("text_delta without text", payload);
    }
    return Optional.of(new StreamEvent.TextDelta(text.asText()));
  }

  private Optional<StreamEvent> toolStart(JsonNode node, String payload) {
    String toolId = node.path("tool_id").asText(null);
    String toolName = node.path("tool_name").asText(null);
    if (toolId == null || toolName == null) {
      return drop("tool_start without tool_id or tool_name", payload);
    }
    return Optional.of(
        new StreamEvent.ToolStart(toolId, toolName, arguments(node.get("arguments"))));
  }

  private Optional<StreamEvent> toolEnd(JsonNode node, String payload) {
    String toolId = node.path("tool_id").asText(null);
    JsonNode result = node.get("result");
    if (toolId == null || result == null || !result.isObject()) {
      return drop("tool_end without tool_id or result", payload);
    }
    ToolExecutionResult executionResult =
        new ToolExecutionResult(
            result.path("success").asBoolean(false),
            result.path("output").asText(null),
            result.path("error").asText(null));
    return Optional.of(new StreamEvent.ToolEnd(toolId, executionResult));
  }

  /** Arguments are opaque: strings pass through, structured values keep their JSON text. */
  private static String arguments(JsonNode arguments) {
    if (arguments == null || arguments.isNull()) {
      return null;
    }
    return arguments.isTextual() ? arguments.asText() : arguments.toString();
  }

  private TokenUsage usage(JsonNode node) {
    JsonNode usage = node.get("usage");
    if (usage == null || !usage.isObject()) {
      return null;
    }
    return new TokenUsage(
        usage.path("input_tokens").asInt(0), usage.path("output_tokens").asInt(0));
  }

  private Optional<StreamEvent> drop(String reason, String payload) {
    meterRegistry.counter("chat.events.malformed").increment();
    log.warn("Dropping stream event ({}): {}", reason, abbreviate(payload));
    return Optional.empty();
  }

  private static String abbreviate(String payload) {
    if (payload == null) {
      return "null";
    }
    return payload.length() <= 200 ? payload : payload.substring(0, 200) + "...";
  }
}
