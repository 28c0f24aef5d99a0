package com.flamingo.ai.agentchat.api.sse;

import com.flamingo.ai.agentchat.api.dto.response.EngineEventResponse;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/** Controller streaming engine events to the display layer with Server-Sent Events. */
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
@Slf4j
public class ConversationEventsController {

  private final EngineEventBroadcaster broadcaster;
  private final MeterRegistry meterRegistry;

  private final AtomicInteger activeConnections = new AtomicInteger(0);

  /**
   * Streams transcript updates, notifications and file write previews.
   *
   * @return a Flux of SSE events
   */
  @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<EngineEventResponse> streamEvents() {
    log.info("Display client connected to event stream");
    activeConnections.incrementAndGet();
    meterRegistry.gauge("sse.connections.active", activeConnections);

    return broadcaster
        .events()
        .doOnError(
            e -> {
              log.error("Event stream error: {}", e.getMessage());
              meterRegistry.counter("sse.errors").increment();
            })
        .doFinally(
            signal -> {
              activeConnections.decrementAndGet();
              log.debug("Display client disconnected ({})", signal);
            });
  }
}
