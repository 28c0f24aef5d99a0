package com.flamingo.ai.agentchat.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Token counts reported with turn completion events. */
public record TokenUsage(
    @JsonProperty("input_tokens") int inputTokens,
    @JsonProperty("output_tokens") int outputTokens) {}
