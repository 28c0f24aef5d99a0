package com.flamingo.ai.agentchat.client.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Body of a streaming send; events come back on the channel named by {@code eventName}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SendMessageRequest {

  private String message;

  @JsonProperty("event_name")
  private String eventName;

  @JsonProperty("session_id")
  private String sessionId;

  private String model;

  private List<ImagePayload> images;

  @JsonProperty("provider_type")
  private String providerType;
}
