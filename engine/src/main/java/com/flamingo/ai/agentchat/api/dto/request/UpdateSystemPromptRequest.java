package com.flamingo.ai.agentchat.api.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for the system prompt; a null prompt means none. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateSystemPromptRequest {

  private String systemPrompt;
}
