package com.flamingo.ai.agentchat.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the conversation engine. */
@Configuration
@ConfigurationProperties(prefix = "agent-chat")
@Getter
@Setter
public class AgentChatConfig {

  private Backend backend = new Backend();
  private Preferences preferences = new Preferences();
  private Audio audio = new Audio();

  /** Models offered per provider id, first entry is the provider's default. */
  private Map<String, List<String>> providers = new LinkedHashMap<>();

  @Getter
  @Setter
  public static class Backend {
    private String baseUrl = "http://127.0.0.1:8999";
    private int connectTimeoutMs = 5000;

    /** Timeout for request/response calls; streaming calls are not bounded. */
    private int responseTimeoutMs = 30000;

    private int maxInMemorySize = 2 * 1024 * 1024;
  }

  @Getter
  @Setter
  public static class Preferences {
    private String defaultProvider = "claude";

    /** Falls back to the first model configured for the default provider when blank. */
    private String defaultModel;

    private String storeFile = System.getProperty("user.home") + "/.agent-chat/preferences.json";
  }

  @Getter
  @Setter
  public static class Audio {
    private long typewriterIntervalMs = 120;
  }
}
