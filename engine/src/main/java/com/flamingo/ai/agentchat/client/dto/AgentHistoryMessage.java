package com.flamingo.ai.agentchat.client.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Stored session message. {@code content} is either a JSON string or an array of typed content
 * blocks, depending on how the agent recorded it.
 */
public record AgentHistoryMessage(String role, JsonNode content, String timestamp) {}
