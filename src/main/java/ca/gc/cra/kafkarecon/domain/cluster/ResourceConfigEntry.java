package ca.gc.cra.kafkarecon.domain.cluster;

import java.util.Objects;

/**
 * One named setting of a cluster resource.
 *
 * @param name configuration name
 * @param value configured value; {@code null} when unset or withheld by the broker
 * @param source provenance tag reported by the broker (e.g. {@code STATIC_BROKER_CONFIG})
 * @param readOnly whether the setting cannot be changed dynamically
 * @param sensitive whether the broker treats the value as a secret
 * @since 0.1.0
 */
public record ResourceConfigEntry(
    String name,
    String value,
    String source,
    boolean readOnly,
    boolean sensitive) {

  public ResourceConfigEntry {
    Objects.requireNonNull(name, "name");
    source = source == null ? "UNKNOWN" : source;
  }
}
