package com.flamingo.ai.agentchat.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for choosing the model. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateModelRequest {

  @NotBlank(message = "Model is required")
  private String model;
}
