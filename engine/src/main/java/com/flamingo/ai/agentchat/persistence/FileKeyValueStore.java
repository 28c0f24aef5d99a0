package com.flamingo.ai.agentchat.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.agentchat.exception.StateStoreException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Durable store kept as a single JSON object on disk.
 *
 * <p>The file is read once on first access and rewritten on every change through a temporary file
 * and an atomic move. An unreadable file is renamed to {@code <name>.corrupt} and the store starts
 * empty.
 */
@Slf4j
public class FileKeyValueStore implements KeyValueStore {

  private static final TypeReference<LinkedHashMap<String, String>> MAP_TYPE =
      new TypeReference<>() {};

  private final Path file;
  private final ObjectMapper objectMapper;
  private Map<String, String> values;

  public FileKeyValueStore(Path file, ObjectMapper objectMapper) {
    this.file = file;
    this.objectMapper = objectMapper;
  }

  @Override
  public synchronized Optional<String> get(String key) {
    return Optional.ofNullable(values().get(key));
  }

  @Override
  public synchronized void put(String key, String value) {
    values().put(key, value);
    flush();
  }

  @Override
  public synchronized void remove(String key) {
    if (values().remove(key) != null) {
      flush();
    }
  }

  private Map<String, String> values() {
    if (values == null) {
      values = load();
    }
    return values;
  }

  private Map<String, String> load() {
    if (!Files.exists(file)) {
      log.debug("No preference file at {}, starting empty", file);
      return new LinkedHashMap<>();
    }
    try {
      return objectMapper.readValue(file.toFile(), MAP_TYPE);
    } catch (IOException e) {
      log.warn("Unreadable preference file {}, starting empty: {}", file, e.getMessage());
      moveAside();
      return new LinkedHashMap<>();
    }
  }

  private void moveAside() {
    Path corrupt = file.resolveSibling(file.getFileName() + ".corrupt");
    try {
      Files.move(file, corrupt, StandardCopyOption.REPLACE_EXISTING);
      log.info("Kept unreadable preference file as {}", corrupt);
    } catch (IOException e) {
      log.warn("Could not move {} aside, it will be overwritten: {}", file, e.getMessage());
    }
  }

  private void flush() {
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
      objectMapper.writeValue(tmp.toFile(), values);
      Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new StateStoreException("Failed to write " + file, e);
    }
  }
}
