package com.flamingo.ai.agentchat.domain.event;

/** Transient user-facing notification. */
public record NotificationEvent(Level level, String message) {

  /** Severity used by the display layer to style the notification. */
  public enum Level {
    INFO,
    SUCCESS,
    ERROR
  }

  public static NotificationEvent info(String message) {
    return new NotificationEvent(Level.INFO, message);
  }

  public static NotificationEvent success(String message) {
    return new NotificationEvent(Level.SUCCESS, message);
  }

  public static NotificationEvent error(String message) {
    return new NotificationEvent(Level.ERROR, message);
  }
}
