package com.flamingo.ai.agentchat.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Response of the session creation call. */
public record CreateSessionResponse(@JsonProperty("session_id") String sessionId) {}
