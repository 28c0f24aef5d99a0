package com.flamingo.ai.agentchat.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.agentchat.domain.enums.MessageRole;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One transcript entry.
 *
 * <p>Assistant messages are created as an empty placeholder with {@code thinking = true} and grow
 * while their generation streams. Content parts and tool calls are immutable values, so {@link
 * #copy()} only needs fresh lists.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

  private String id;

  private MessageRole role;

  @Builder.Default private String content = "";

  /** Interleaved text and tool parts in emission order; empty for user messages. */
  @Builder.Default private List<ContentPart> contentParts = new ArrayList<>();

  private List<MessageImage> images;

  @JsonProperty("isThinking")
  private boolean thinking;

  /** Short status shown while thinking, cleared on the first text fragment. */
  private String thinkingLabel;

  @Builder.Default private List<ToolCall> toolCalls = new ArrayList<>();

  private Instant timestamp;

  /** Returns a copy that can be handed out without exposing this instance's lists. */
  public Message copy() {
    return toBuilder()
        .contentParts(new ArrayList<>(contentParts))
        .toolCalls(new ArrayList<>(toolCalls))
        .images(images != null ? new ArrayList<>(images) : null)
        .build();
  }
}
