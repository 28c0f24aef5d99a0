package com.flamingo.ai.agentchat.client.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request body for opening a new agent session. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CreateSessionRequest {

  @JsonProperty("provider_type")
  private String providerType;

  private String model;

  /** Instructions fixed for the lifetime of the session. */
  @JsonProperty("system_prompt")
  private String systemPrompt;

  private List<SkillInfo> skills;
}
