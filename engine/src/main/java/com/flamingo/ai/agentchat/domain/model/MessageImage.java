package com.flamingo.ai.agentchat.domain.model;

/** Image attached to a user message, base64 data tagged with its media type. */
public record MessageImage(String data, String mediaType) {}
