package com.flamingo.ai.agentchat.service.audio;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Default player for hosts without audio output. */
@Component
@Slf4j
public class LoggingAudioCuePlayer implements AudioCuePlayer {

  @Override
  public void play(AudioCue cue) {
    log.debug("Audio cue: {}", cue);
  }
}
