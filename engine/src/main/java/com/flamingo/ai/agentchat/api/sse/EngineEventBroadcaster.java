package com.flamingo.ai.agentchat.api.sse;

import com.flamingo.ai.agentchat.api.dto.response.EngineEventResponse;
import com.flamingo.ai.agentchat.domain.event.FileWriteProposedEvent;
import com.flamingo.ai.agentchat.domain.event.NotificationEvent;
import com.flamingo.ai.agentchat.domain.event.TranscriptUpdatedEvent;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/** Fans engine application events out to every connected SSE client. */
@Component
@Slf4j
public class EngineEventBroadcaster {

  private static final Duration EMIT_TIMEOUT = Duration.ofMillis(100);

  private final Sinks.Many<EngineEventResponse> sink =
      Sinks.many().multicast().directBestEffort();

  @EventListener
  public void onTranscriptUpdated(TranscriptUpdatedEvent event) {
    emit(EngineEventResponse.transcript(event));
  }

  @EventListener
  public void onNotification(NotificationEvent event) {
    emit(EngineEventResponse.notification(event));
  }

  @EventListener
  public void onFileWriteProposed(FileWriteProposedEvent event) {
    emit(EngineEventResponse.fileWrite(event));
  }

  /** Events published from now on; nothing is replayed. */
  public Flux<EngineEventResponse> events() {
    return sink.asFlux();
  }

  private void emit(EngineEventResponse response) {
    try {
      sink.emitNext(response, Sinks.EmitFailureHandler.busyLooping(EMIT_TIMEOUT));
    } catch (Sinks.EmissionException e) {
      log.warn("Dropped {} event: {}", response.getEventType(), e.getReason());
    }
  }
}
