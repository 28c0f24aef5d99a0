package com.flamingo.ai.agentchat.service.chat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.agentchat.domain.event.StreamEvent;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Recognizes write/create tool calls whose arguments name a file and its content, so the file can
 * be shown before the tool finishes. Best effort: unreadable arguments yield nothing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FileWriteIntentDetector {

  private final ObjectMapper objectMapper;

  /** Path and content a tool is about to write. */
  public record FileWriteIntent(String path, String content) {}

  public Optional<FileWriteIntent> detect(StreamEvent.ToolStart start) {
    String name = start.toolName() == null ? "" : start.toolName().toLowerCase(Locale.ROOT);
    if (!name.contains("write") && !name.contains("create")) {
      return Optional.empty();
    }
    String arguments = start.arguments();
    if (arguments == null || arguments.isBlank()) {
      return Optional.empty();
    }

    JsonNode node;
    try {
      node = objectMapper.readTree(arguments);
    } catch (JsonProcessingException e) {
      log.warn(
          "Could not parse arguments of tool {} ({}): {}",
          start.toolName(),
          start.toolId(),
          e.getOriginalMessage());
      return Optional.empty();
    }

    String path = firstText(node, "path", "file_path", "filePath");
    String content = firstText(node, "content", "text");
    if (path == null || content == null || content.isEmpty()) {
      return Optional.empty();
    }
    log.debug("Tool {} proposes writing {}", start.toolId(), path);
    return Optional.of(new FileWriteIntent(path, content));
  }

  private static String firstText(JsonNode node, String... fields) {
    for (String field : fields) {
      JsonNode value = node.get(field);
      if (value != null && value.isTextual() && !value.asText().isEmpty()) {
        return value.asText();
      }
    }
    return null;
  }
}
