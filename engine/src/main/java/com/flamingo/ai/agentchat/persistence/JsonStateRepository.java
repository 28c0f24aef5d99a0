package com.flamingo.ai.agentchat.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * Base for typed repositories over a {@link KeyValueStore}. Values are stored as JSON; every read
 * or write failure is logged and absorbed so local state never breaks the conversation.
 */
@Slf4j
public abstract class JsonStateRepository {

  protected final KeyValueStore store;
  protected final ObjectMapper objectMapper;

  protected JsonStateRepository(KeyValueStore store, ObjectMapper objectMapper) {
    this.store = store;
    this.objectMapper = objectMapper;
  }

  protected <T> T read(String key, TypeReference<T> type, T defaultValue) {
    try {
      String stored = store.get(key).orElse(null);
      if (stored == null || stored.isEmpty()) {
        return defaultValue;
      }
      T value = objectMapper.readValue(stored, type);
      return value != null ? value : defaultValue;
    } catch (JsonProcessingException | RuntimeException e) {
      log.warn("Failed to read '{}' from local state, using default: {}", key, e.getMessage());
      return defaultValue;
    }
  }

  protected void write(String key, Object value) {
    try {
      if (value == null) {
        store.remove(key);
      } else {
        store.put(key, objectMapper.writeValueAsString(value));
      }
    } catch (JsonProcessingException | RuntimeException e) {
      log.warn("Failed to write '{}' to local state: {}", key, e.getMessage());
    }
  }
}
