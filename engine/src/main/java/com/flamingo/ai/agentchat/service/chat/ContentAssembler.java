package com.flamingo.ai.agentchat.service.chat;

import com.flamingo.ai.agentchat.domain.event.StreamEvent;
import com.flamingo.ai.agentchat.domain.model.ContentPart;
import com.flamingo.ai.agentchat.domain.model.ToolCall;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Folds stream events into the ordered content parts of the message being generated. Input lists
 * are never modified; tool events additionally update the message's {@link ToolCallTracker}.
 */
@Component
@RequiredArgsConstructor
public class ContentAssembler {

  private final Clock clock;

  /**
   * Applies one event.
   *
   * @param parts current parts
   * @param event incoming event
   * @param tracker tool calls of the same message
   * @return the new parts, or {@code parts} itself when the event changes nothing
   */
  public List<ContentPart> reduce(
      List<ContentPart> parts, StreamEvent event, ToolCallTracker tracker) {
    if (event instanceof StreamEvent.TextDelta delta) {
      return appendText(parts, delta.text());
    }
    if (event instanceof StreamEvent.ToolStart start) {
      return tracker
          .start(start.toolId(), start.toolName(), start.arguments(), clock.instant())
          .map(call -> append(parts, new ContentPart.ToolUse(call)))
          .orElse(parts);
    }
    if (event instanceof StreamEvent.ToolEnd end) {
      return tracker
          .finish(end.toolId(), end.result(), clock.instant())
          .map(call -> replaceToolUse(parts, call))
          .orElse(parts);
    }
    return parts;
  }

  /** Extends the trailing text part, or opens a new one after a tool part. */
  static List<ContentPart> appendText(List<ContentPart> parts, String text) {
    if (text == null || text.isEmpty()) {
      return parts;
    }
    List<ContentPart> updated = new ArrayList<>(parts);
    int last = updated.size() - 1;
    if (last >= 0 && updated.get(last) instanceof ContentPart.Text tail) {
      updated.set(last, new ContentPart.Text(tail.text() + text));
    } else {
      updated.add(new ContentPart.Text(text));
    }
    return updated;
  }

  private static List<ContentPart> append(List<ContentPart> parts, ContentPart part) {
    List<ContentPart> updated = new ArrayList<>(parts);
    updated.add(part);
    return updated;
  }

  private static List<ContentPart> replaceToolUse(List<ContentPart> parts, ToolCall call) {
    List<ContentPart> updated = new ArrayList<>(parts.size());
    boolean replaced = false;
    for (ContentPart part : parts) {
      if (part instanceof ContentPart.ToolUse use && use.toolCall().id().equals(call.id())) {
        updated.add(new ContentPart.ToolUse(call));
        replaced = true;
      } else {
        updated.add(part);
      }
    }
    return replaced ? updated : parts;
  }
}
