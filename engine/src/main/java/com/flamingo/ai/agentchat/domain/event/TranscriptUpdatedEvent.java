package com.flamingo.ai.agentchat.domain.event;

import com.flamingo.ai.agentchat.domain.model.Message;
import java.util.List;

/** Published after every transcript mutation with a snapshot of the visible conversation. */
public record TranscriptUpdatedEvent(
    List<Message> messages, String activeSessionId, boolean sending) {}
