package ca.gc.cra.kafkarecon.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void unionPrefersOverridesWithoutMutatingInputs() {
    Map<String, Object> base = new LinkedHashMap<>(Map.of("group.id", "recon", "bootstrap.servers", "a:9092"));
    Map<String, Object> overrides = Map.of("bootstrap.servers", "b:9092", "enable.partition.eof", true);

    Map<String, Object> merged = ConfigMerger.union(base, overrides);

    assertEquals("b:9092", merged.get("bootstrap.servers"));
    assertEquals("recon", merged.get("group.id"));
    assertEquals(true, merged.get("enable.partition.eof"));
    assertEquals("a:9092", base.get("bootstrap.servers"));
    assertEquals(2, base.size());
  }

  @Test
  void projectKeepsOnlyAllowedKeysThatArePresent() {
    Map<String, Object> source = Map.of(
        "security.protocol", "SSL",
        "ssl.key.location", "/k.pem",
        "group.id", "recon",
        "auto.offset.reset", "earliest");

    Map<String, Object> admin = ConfigMerger.project(source, ClientConfigKeys.ADMIN_KEYS);

    assertEquals(Map.of("security.protocol", "SSL", "ssl.key.location", "/k.pem"), admin);
  }

  @Test
  void changedKeysIgnoresNewAndEqualValues() {
    Map<String, Object> base = Map.of("a", "1", "b", "2");
    Map<String, Object> incoming = Map.of("a", "1", "b", "3", "c", "4");

    assertEquals(List.of("b"), ConfigMerger.changedKeys(base, incoming));
    assertTrue(ConfigMerger.changedKeys(null, incoming).isEmpty());
  }

  @Test
  void overlayReplacesExistingValues() {
    Map<String, Object> target = new LinkedHashMap<>(Map.of("a", "1"));

    ConfigMerger.overlay(target, Map.of("a", "2", "b", "3"));

    assertEquals(Map.of("a", "2", "b", "3"), target);
  }
}
