package com.flamingo.ai.agentchat.domain.model;

import java.time.Instant;

/** A persisted conversation thread as listed for topic selection. */
public record Topic(String id, String title, Instant createdAt, int messageCount) {}
