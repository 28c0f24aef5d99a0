package com.flamingo.ai.agentchat.api.dto.request;

import com.flamingo.ai.agentchat.domain.model.MessageImage;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for sending a chat message. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

  @NotBlank(message = "Message is required")
  @Size(max = 100000, message = "Message must not exceed 100000 characters")
  private String message;

  private List<MessageImage> images;

  /** Lets the agent search the web for this message. */
  private boolean webSearch;

  /** Asks the agent for extended reasoning on this message. */
  private boolean thinking;
}
