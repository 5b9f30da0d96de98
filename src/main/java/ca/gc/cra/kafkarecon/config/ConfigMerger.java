package ca.gc.cra.kafkarecon.config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Map-union helpers with override-wins semantics for client configuration.
 *
 * <p>None of the methods mutate their source arguments; {@link #overlay(Map, Map)} mutates only its target.</p>
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds a new map holding every entry of {@code base} replaced or extended by {@code overrides}.
   *
   * @param base starting entries; not modified
   * @param overrides entries that win on key collisions; not modified
   * @return new mutable map preserving {@code base} order followed by new keys from {@code overrides}
   */
  public static Map<String, Object> union(Map<String, ?> base, Map<String, ?> overrides) {
    Map<String, Object> merged = new LinkedHashMap<>(base == null ? Map.of() : base);
    if (overrides != null) {
      merged.putAll(overrides);
    }
    return merged;
  }

  /**
   * Copies every entry of {@code source} into {@code target}, replacing existing values.
   *
   * @param target map to mutate
   * @param source entries to apply; not modified
   */
  public static void overlay(Map<String, Object> target, Map<String, ?> source) {
    Objects.requireNonNull(target, "target");
    if (source != null) {
      target.putAll(source);
    }
  }

  /**
   * Selects the entries of {@code source} whose keys appear in {@code keys}.
   *
   * @param source map to read; not modified
   * @param keys allow-listed keys in output order
   * @return new mutable map with the allowed entries that are present in {@code source}
   */
  public static Map<String, Object> project(Map<String, ?> source, Collection<String> keys) {
    Map<String, Object> projected = new LinkedHashMap<>();
    if (source == null || keys == null) {
      return projected;
    }
    for (String key : keys) {
      if (source.containsKey(key)) {
        projected.put(key, source.get(key));
      }
    }
    return projected;
  }

  /**
   * Lists keys of {@code overrides} that already exist in {@code base} with a different value.
   *
   * @param base current entries
   * @param overrides incoming entries
   * @return keys whose value changes when {@code overrides} is applied
   */
  public static List<String> changedKeys(Map<String, ?> base, Map<String, ?> overrides) {
    List<String> changed = new ArrayList<>();
    if (base == null || overrides == null) {
      return changed;
    }
    for (Map.Entry<String, ?> entry : overrides.entrySet()) {
      if (base.containsKey(entry.getKey()) && !Objects.equals(base.get(entry.getKey()), entry.getValue())) {
        changed.add(entry.getKey());
      }
    }
    return changed;
  }
}
