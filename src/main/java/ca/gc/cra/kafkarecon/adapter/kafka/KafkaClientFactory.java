package ca.gc.cra.kafkarecon.adapter.kafka;

import static ca.gc.cra.kafkarecon.config.ClientConfigKeys.BOOTSTRAP_SERVERS;
import static ca.gc.cra.kafkarecon.config.ClientConfigKeys.ENABLE_PARTITION_EOF;

import ca.gc.cra.kafkarecon.application.port.AdminPort;
import ca.gc.cra.kafkarecon.application.port.ClientCreationException;
import ca.gc.cra.kafkarecon.application.port.ClientFactory;
import ca.gc.cra.kafkarecon.application.port.ConsumerPort;
import ca.gc.cra.kafkarecon.logging.Logs;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.config.SslConfigs;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ClientFactory} that builds Kafka admin and consumer clients.
 * <p><strong>Why:</strong> Client configuration files are written in librdkafka's vocabulary; the Java clients need
 * string properties, inline PEM material, and no librdkafka-only switches.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Join list values with commas and stringify scalars.</li>
 *   <li>Translate PEM file locations through {@link PemTlsMaterial}.</li>
 *   <li>Drop {@code enable.partition.eof}, which the Java consumer does not support.</li>
 *   <li>Map construction failures to {@link ClientCreationException}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class KafkaClientFactory implements ClientFactory {
  private static final Logger log = LoggerFactory.getLogger(KafkaClientFactory.class);
  private static final Set<String> INLINE_MATERIAL_KEYS = Set.of(
      SslConfigs.SSL_TRUSTSTORE_CERTIFICATES_CONFIG,
      SslConfigs.SSL_KEYSTORE_CERTIFICATE_CHAIN_CONFIG,
      SslConfigs.SSL_KEYSTORE_KEY_CONFIG);

  @Override
  public AdminPort createAdmin(Map<String, Object> config) throws ClientCreationException {
    Properties props = toProperties(config);
    String bootstrap = props.getProperty(BOOTSTRAP_SERVERS);
    try {
      return new KafkaAdminAdapter(Admin.create(props), bootstrap);
    } catch (KafkaException ex) {
      throw new ClientCreationException(KafkaErrors.describe(ex), ex);
    }
  }

  @Override
  public ConsumerPort createConsumer(Map<String, Object> config) throws ClientCreationException {
    Properties props = toProperties(config);
    String bootstrap = props.getProperty(BOOTSTRAP_SERVERS);
    ClusterIdListener clusterIds = new ClusterIdListener();
    try {
      KafkaConsumer<byte[], byte[]> consumer =
          new KafkaConsumer<>(props, clusterIds, new ByteArrayDeserializer());
      return new KafkaConsumerAdapter(consumer, clusterIds, bootstrap);
    } catch (KafkaException ex) {
      throw new ClientCreationException(KafkaErrors.describe(ex), ex);
    }
  }

  /**
   * Converts a configuration map into Java client properties.
   *
   * @param config projected client configuration; must contain {@code bootstrap.servers}
   * @return client properties
   * @throws ClientCreationException when TLS material is unusable or no bootstrap address is present
   */
  static Properties toProperties(Map<String, Object> config) throws ClientCreationException {
    Objects.requireNonNull(config, "config");
    Properties props = new Properties();
    for (Map.Entry<String, Object> entry : config.entrySet()) {
      String key = entry.getKey();
      if (ENABLE_PARTITION_EOF.equals(key) || PemTlsMaterial.LOCATION_KEYS.contains(key)) {
        continue;
      }
      if (entry.getValue() == null) {
        continue;
      }
      props.put(key, stringify(entry.getValue()));
    }
    if (props.getProperty(BOOTSTRAP_SERVERS, "").isBlank()) {
      throw new ClientCreationException(BOOTSTRAP_SERVERS + " is required");
    }
    PemTlsMaterial.apply(config, props);
    if (log.isDebugEnabled()) {
      log.debug("Client properties: {}", props.stringPropertyNames().stream()
          .sorted()
          .map(key -> key + "=" + (isMaterial(key) ? Logs.redact(key) : Logs.displayValue(key, props.get(key))))
          .collect(Collectors.joining(", ")));
    }
    return props;
  }

  static String stringify(Object value) {
    if (value instanceof List<?> list) {
      return list.stream().map(String::valueOf).collect(Collectors.joining(","));
    }
    return String.valueOf(value);
  }

  private static boolean isMaterial(String key) {
    return INLINE_MATERIAL_KEYS.contains(key);
  }
}
