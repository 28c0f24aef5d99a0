package com.flamingo.ai.agentchat.channel;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Sinks;

/**
 * In-process publish/subscribe keyed by channel name. Each channel carries the raw event
 * payloads of one generation to exactly one listener, in publication order.
 */
@Component
@Slf4j
public class EventChannelRegistry {

  private final Map<String, Sinks.Many<String>> channels = new ConcurrentHashMap<>();

  /**
   * Opens a channel and attaches its listener.
   *
   * @param channelName unique channel name
   * @param listener receives raw payloads; exceptions are logged and do not close the channel
   * @return the subscription handle that must be released when the generation ends
   * @throws IllegalStateException if the channel already has a listener
   */
  public ChannelSubscription subscribe(String channelName, Consumer<String> listener) {
    Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer();
    if (channels.putIfAbsent(channelName, sink) != null) {
      throw new IllegalStateException("Channel already has a listener: " + channelName);
    }

    Disposable disposable =
        sink.asFlux()
            .subscribe(
                payload -> {
                  try {
                    listener.accept(payload);
                  } catch (RuntimeException e) {
                    log.error("Listener on channel {} failed: {}", channelName, e.getMessage(), e);
                  }
                },
                error -> log.error("Channel {} terminated with error", channelName, error));

    log.debug("Subscribed to channel {}", channelName);
    return new ChannelSubscription(
        channelName,
        disposable,
        () -> {
          channels.remove(channelName, sink);
          sink.tryEmitComplete();
          log.debug("Released channel {}", channelName);
        });
  }

  /**
   * Delivers a payload to the channel's listener.
   *
   * @return false if nobody listens on the channel any more
   */
  public boolean publish(String channelName, String payload) {
    Sinks.Many<String> sink = channels.get(channelName);
    if (sink == null) {
      log.debug("No listener on channel {}, dropping event", channelName);
      return false;
    }
    Sinks.EmitResult result = sink.tryEmitNext(payload);
    if (result.isFailure()) {
      log.warn("Failed to emit on channel {}: {}", channelName, result);
      return false;
    }
    return true;
  }

  public boolean isOpen(String channelName) {
    return channels.containsKey(channelName);
  }
}
