package com.flamingo.ai.agentchat.service.audio;

/**
 * Receives the engine's audio triggers. Called synchronously from event handling, so
 * implementations must return quickly and own any throttling.
 */
public interface AudioCueDispatcher {

  void onToolStart();

  void onTextDelta();
}
