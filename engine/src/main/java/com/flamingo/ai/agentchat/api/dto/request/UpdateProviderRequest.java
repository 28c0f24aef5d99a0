package com.flamingo.ai.agentchat.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for choosing the provider of future sessions. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateProviderRequest {

  @NotBlank(message = "Provider is required")
  private String providerId;
}
