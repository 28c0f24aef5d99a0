package com.flamingo.ai.agentchat.service.provider;

import com.flamingo.ai.agentchat.config.AgentChatConfig;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Models available per provider and the rules for keeping a model selection compatible. */
@Component
@RequiredArgsConstructor
public class ProviderCatalog {

  private final AgentChatConfig config;

  public String defaultProvider() {
    return config.getPreferences().getDefaultProvider();
  }

  /** Configured default model, else the first model of the default provider, else empty. */
  public String defaultModel() {
    String configured = config.getPreferences().getDefaultModel();
    if (configured != null && !configured.isBlank()) {
      return configured;
    }
    List<String> models = modelsFor(defaultProvider());
    return models.isEmpty() ? "" : models.get(0);
  }

  public List<String> modelsFor(String providerId) {
    List<String> models = config.getProviders().get(providerId);
    return models != null ? List.copyOf(models) : List.of();
  }

  /**
   * Keeps {@code currentModel} when the provider lists it (or lists nothing), otherwise falls back
   * to the provider's first model.
   */
  public String resolveModel(String providerId, String currentModel) {
    List<String> models = modelsFor(providerId);
    if (models.isEmpty() || models.contains(currentModel)) {
      return currentModel;
    }
    return models.get(0);
  }
}
