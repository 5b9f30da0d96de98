package ca.gc.cra.kafkarecon.config;

import ca.gc.cra.kafkarecon.validation.Numbers;
import ca.gc.cra.kafkarecon.validation.Strings;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads the {@link ReconPolicy} from YAML.
 *
 * <p>Defaults ship on the classpath as {@value #DEFAULTS_RESOURCE}; an operator file only needs the keys it
 * changes under its {@code discovery} section.</p>
 */
public final class YamlPolicyLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlPolicyLoader.class);
  static final String DEFAULTS_RESOURCE = "/kafkarecon-policy.yaml";
  private static final String SECTION = "discovery";

  private YamlPolicyLoader() {}

  /**
   * Loads the classpath defaults, falling back to {@link ReconPolicy#defaults()} when the resource is absent.
   *
   * @return default policy
   * @throws IllegalArgumentException when the bundled document is invalid
   */
  public static ReconPolicy loadDefaults() {
    try (InputStream in = YamlPolicyLoader.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
      if (in == null) {
        log.debug("No {} on classpath; using built-in policy", DEFAULTS_RESOURCE);
        return ReconPolicy.defaults();
      }
      return parse(new InputStreamReader(in, StandardCharsets.UTF_8), ReconPolicy.defaults(), DEFAULTS_RESOURCE);
    } catch (IOException ex) {
      log.warn("Unable to read {}; using built-in policy", DEFAULTS_RESOURCE, ex);
      return ReconPolicy.defaults();
    }
  }

  /**
   * Loads an operator policy file on top of the classpath defaults.
   *
   * @param path YAML document location
   * @return merged policy
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure or a value is invalid
   */
  public static ReconPolicy load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    ReconPolicy base = loadDefaults();
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return parse(reader, base, path.toString());
    }
  }

  static ReconPolicy parse(Reader reader, ReconPolicy base, String origin) {
    Object document;
    try {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML policy at " + origin, ex);
    }
    if (document == null) {
      return base;
    }
    Map<String, Object> root = asMap(document, "root");
    Object section = findSection(root, SECTION);
    if (section == null) {
      return base;
    }
    Map<String, Object> discovery = asMap(section, SECTION);

    Duration timeout = base.requestTimeout();
    int nameWidth = base.nameWidth();
    int valueWidth = base.valueWidth();
    Set<String> allowList = base.brokerConfigAllowList();
    for (Map.Entry<String, Object> entry : discovery.entrySet()) {
      String key = entry.getKey();
      Object value = entry.getValue();
      switch (key) {
        case "requestTimeoutMs" -> timeout = Duration.ofMillis(Numbers.requireLong(key, value));
        case "nameWidth" -> nameWidth = (int) Numbers.requireRange(key, Numbers.requireLong(key, value),
            1, ReconPolicy.MAX_WIDTH);
        case "valueWidth" -> valueWidth = (int) Numbers.requireRange(key, Numbers.requireLong(key, value),
            1, ReconPolicy.MAX_WIDTH);
        case "brokerConfigAllowList" -> allowList = toNames(key, value);
        default -> throw new IllegalArgumentException("Unknown discovery policy key: " + key);
      }
    }
    return new ReconPolicy(timeout, nameWidth, valueWidth, allowList);
  }

  private static Set<String> toNames(String key, Object value) {
    Set<String> names = new LinkedHashSet<>();
    if (value instanceof Iterable<?> items) {
      for (Object item : items) {
        names.add(Strings.requireNonBlank(key, String.valueOf(item)));
      }
    } else if (value instanceof String text) {
      for (String token : text.split(",")) {
        if (!token.isBlank()) {
          names.add(Strings.requireNonBlank(key, token));
        }
      }
    } else {
      throw new IllegalArgumentException(key + " must be a list of configuration names");
    }
    return names;
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String key) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(key)) {
        return entry.getValue();
      }
    }
    return null;
  }
}
