package com.flamingo.ai.agentchat.service.audio;

import com.flamingo.ai.agentchat.config.AgentChatConfig;
import com.flamingo.ai.agentchat.persistence.PreferenceRepository;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Plays cues when sound is enabled in the user's preferences. Typewriter cues are limited to one
 * per configured interval; tool cues always play.
 */
@Component
@Slf4j
public class ThrottledAudioCueDispatcher implements AudioCueDispatcher {

  private final PreferenceRepository preferenceRepository;
  private final AudioCuePlayer player;
  private final Clock clock;
  private final long typewriterIntervalMs;
  private final AtomicLong lastTypewriterMillis = new AtomicLong(Long.MIN_VALUE);

  public ThrottledAudioCueDispatcher(
      PreferenceRepository preferenceRepository,
      AudioCuePlayer player,
      AgentChatConfig config,
      Clock clock) {
    this.preferenceRepository = preferenceRepository;
    this.player = player;
    this.clock = clock;
    this.typewriterIntervalMs = config.getAudio().getTypewriterIntervalMs();
  }

  @Override
  public void onToolStart() {
    if (preferenceRepository.isSoundEnabled()) {
      play(AudioCue.TOOL_CALL);
    }
  }

  @Override
  public void onTextDelta() {
    if (!preferenceRepository.isSoundEnabled()) {
      return;
    }
    long now = clock.millis();
    long last = lastTypewriterMillis.get();
    if (last != Long.MIN_VALUE && now - last < typewriterIntervalMs) {
      return;
    }
    if (lastTypewriterMillis.compareAndSet(last, now)) {
      play(AudioCue.TYPEWRITER);
    }
  }

  private void play(AudioCue cue) {
    try {
      player.play(cue);
    } catch (RuntimeException e) {
      log.warn("Failed to play {} cue: {}", cue, e.getMessage());
    }
  }
}
