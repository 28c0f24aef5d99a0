package com.flamingo.ai.agentchat.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for replacing the content of a message. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EditMessageRequest {

  @NotNull(message = "Content is required")
  private String content;
}
