package com.flamingo.ai.agentchat.channel;

import java.util.concurrent.atomic.AtomicReference;
import reactor.core.Disposable;

/**
 * Handle to a live channel listener. Releasing it is idempotent: the handle is cleared before the
 * underlying subscription is disposed, so a second release or an event racing the first one finds
 * nothing to act on.
 */
public final class ChannelSubscription {

  private final String channelName;
  private final AtomicReference<Disposable> handle;
  private final Runnable onRelease;

  ChannelSubscription(String channelName, Disposable disposable, Runnable onRelease) {
    this.channelName = channelName;
    this.handle = new AtomicReference<>(disposable);
    this.onRelease = onRelease;
  }

  public String getChannelName() {
    return channelName;
  }

  public boolean isActive() {
    return handle.get() != null;
  }

  /**
   * Detaches the listener.
   *
   * @return true if this call released the subscription, false if it was already released
   */
  public boolean unsubscribe() {
    Disposable disposable = handle.getAndSet(null);
    if (disposable == null) {
      return false;
    }
    onRelease.run();
    disposable.dispose();
    return true;
  }
}
