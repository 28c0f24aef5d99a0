package com.flamingo.ai.agentchat.persistence;

import java.util.Optional;

/** Minimal string key-value store backing the engine's local state. */
public interface KeyValueStore {

  /**
   * Reads a stored value.
   *
   * @param key the key
   * @return the value, or empty when absent
   * @throws com.flamingo.ai.agentchat.exception.StateStoreException if the store cannot be read
   */
  Optional<String> get(String key);

  /**
   * Stores a value, replacing any previous one.
   *
   * @throws com.flamingo.ai.agentchat.exception.StateStoreException if the store cannot be written
   */
  void put(String key, String value);

  void remove(String key);
}
