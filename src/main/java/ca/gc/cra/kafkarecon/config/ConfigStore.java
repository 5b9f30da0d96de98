package ca.gc.cra.kafkarecon.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Mutable client configuration shared by one recon session.
 * <p><strong>Why:</strong> Operators build up a connection profile from several files (brokers, TLS material,
 * consumer options) before connecting.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Merge loaded documents with override-wins semantics, all or nothing.</li>
 *   <li>Expose ordered entries for display and defensive snapshots for client construction.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owned by a single session.</p>
 *
 * @since 0.1.0
 */
public final class ConfigStore {
  private static final Logger log = LoggerFactory.getLogger(ConfigStore.class);

  private final Map<String, Object> entries = new LinkedHashMap<>();
  private final JsonConfigLoader loader;

  /**
   * Creates an empty store backed by the default JSON loader.
   */
  public ConfigStore() {
    this(new JsonConfigLoader());
  }

  ConfigStore(JsonConfigLoader loader) {
    this.loader = Objects.requireNonNull(loader, "loader");
  }

  /**
   * Loads a JSON document and merges every key into the store.
   *
   * @param path configuration file
   * @return the entries read from the file, for display
   * @throws ConfigLoadException when the file cannot be loaded; the store is unchanged
   */
  public Map<String, Object> load(Path path) throws ConfigLoadException {
    Map<String, Object> delta = loader.load(path);
    for (String key : ConfigMerger.changedKeys(entries, delta)) {
      log.debug("Configuration file {} overrides key: {}", path, key);
    }
    ConfigMerger.overlay(entries, delta);
    log.debug("Merged {} keys from {}", delta.size(), path);
    return Collections.unmodifiableMap(delta);
  }

  /**
   * Returns the current entries in insertion order.
   *
   * @return immutable list of key/value pairs; empty when nothing was loaded
   */
  public List<Map.Entry<String, Object>> describe() {
    List<Map.Entry<String, Object>> pairs = new ArrayList<>(entries.size());
    for (Map.Entry<String, Object> entry : entries.entrySet()) {
      pairs.add(Map.entry(entry.getKey(), entry.getValue()));
    }
    return List.copyOf(pairs);
  }

  /**
   * Returns a detached, mutable copy of the current entries.
   *
   * @return snapshot that callers may change without affecting the store
   */
  public Map<String, Object> snapshot() {
    return new LinkedHashMap<>(entries);
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public int size() {
    return entries.size();
  }
}
