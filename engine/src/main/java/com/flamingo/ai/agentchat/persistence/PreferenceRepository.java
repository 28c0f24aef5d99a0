package com.flamingo.ai.agentchat.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/** User preferences that survive application restarts. */
public class PreferenceRepository extends JsonStateRepository {

  static final String PROVIDER_KEY = "agent_pref_provider";
  static final String MODEL_KEY = "agent_pref_model";
  static final String SOUND_ENABLED_KEY = "agent_sound_enabled";

  private static final TypeReference<String> STRING = new TypeReference<>() {};
  private static final TypeReference<Boolean> BOOLEAN = new TypeReference<>() {};

  public PreferenceRepository(KeyValueStore store, ObjectMapper objectMapper) {
    super(store, objectMapper);
  }

  public String getProvider(String defaultProvider) {
    return read(PROVIDER_KEY, STRING, defaultProvider);
  }

  public void saveProvider(String providerId) {
    write(PROVIDER_KEY, providerId);
  }

  public String getModel(String defaultModel) {
    return read(MODEL_KEY, STRING, defaultModel);
  }

  public void saveModel(String model) {
    write(MODEL_KEY, model);
  }

  public boolean isSoundEnabled() {
    return read(SOUND_ENABLED_KEY, BOOLEAN, Boolean.FALSE);
  }

  public void setSoundEnabled(boolean enabled) {
    write(SOUND_ENABLED_KEY, enabled);
  }
}
