package com.flamingo.ai.agentchat.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Session summary as listed by the agent. */
public record SessionInfo(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("messages_count") int messagesCount) {}
