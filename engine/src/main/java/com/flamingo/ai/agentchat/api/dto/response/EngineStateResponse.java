package com.flamingo.ai.agentchat.api.dto.response;

import com.flamingo.ai.agentchat.service.chat.ConversationEngine;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO describing the engine's current state. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngineStateResponse {

  private String activeSessionId;
  private boolean sending;
  private String providerId;
  private String model;
  private int messageCount;

  public static EngineStateResponse from(ConversationEngine engine) {
    return EngineStateResponse.builder()
        .activeSessionId(engine.getActiveSessionId().orElse(null))
        .sending(engine.isSending())
        .providerId(engine.getProviderId())
        .model(engine.getModel())
        .messageCount(engine.getMessages().size())
        .build();
  }
}
