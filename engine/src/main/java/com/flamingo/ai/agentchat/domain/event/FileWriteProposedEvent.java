package com.flamingo.ai.agentchat.domain.event;

/**
 * Raised when a write-style tool starts, before its result is known, so the display layer can show
 * the proposed file early.
 */
public record FileWriteProposedEvent(
    String messageId, String toolId, String path, String content) {}
