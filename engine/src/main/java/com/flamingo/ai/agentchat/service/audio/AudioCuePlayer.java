package com.flamingo.ai.agentchat.service.audio;

/** Plays a cue on the host's audio output. */
public interface AudioCuePlayer {

  void play(AudioCue cue);
}
