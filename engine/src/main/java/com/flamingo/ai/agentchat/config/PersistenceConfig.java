package com.flamingo.ai.agentchat.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.agentchat.persistence.ConversationStateRepository;
import com.flamingo.ai.agentchat.persistence.FileKeyValueStore;
import com.flamingo.ai.agentchat.persistence.InMemoryKeyValueStore;
import com.flamingo.ai.agentchat.persistence.PreferenceRepository;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the two local state scopes: durable preferences and per-run conversation state. */
@Configuration
@Slf4j
public class PersistenceConfig {

  @Bean
  public PreferenceRepository preferenceRepository(
      AgentChatConfig config, ObjectMapper objectMapper) {
    Path file = Path.of(config.getPreferences().getStoreFile());
    log.info("Preferences stored in {}", file.toAbsolutePath());
    return new PreferenceRepository(new FileKeyValueStore(file, objectMapper), objectMapper);
  }

  @Bean
  public ConversationStateRepository conversationStateRepository(ObjectMapper objectMapper) {
    return new ConversationStateRepository(new InMemoryKeyValueStore(), objectMapper);
  }
}
