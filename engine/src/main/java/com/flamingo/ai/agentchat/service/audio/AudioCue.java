package com.flamingo.ai.agentchat.service.audio;

/** Sounds the engine can trigger. */
public enum AudioCue {
  TOOL_CALL,
  TYPEWRITER
}
