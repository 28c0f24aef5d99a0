package com.flamingo.ai.agentchat.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Image sent along with a message. */
public record ImagePayload(String data, @JsonProperty("media_type") String mediaType) {}
