package ca.gc.cra.kafkarecon.adapter.kafka;

import static ca.gc.cra.kafkarecon.config.ClientConfigKeys.SSL_CA_LOCATION;
import static ca.gc.cra.kafkarecon.config.ClientConfigKeys.SSL_CERTIFICATE_LOCATION;
import static ca.gc.cra.kafkarecon.config.ClientConfigKeys.SSL_KEY_LOCATION;

import ca.gc.cra.kafkarecon.application.port.ClientCreationException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import org.apache.kafka.common.config.SslConfigs;

/**
 * Translates PEM file locations ({@code ssl.ca.location}, {@code ssl.certificate.location},
 * {@code ssl.key.location}) into the Java client's inline PEM store settings.
 */
final class PemTlsMaterial {
  static final String PEM = "PEM";
  static final Set<String> LOCATION_KEYS = Set.of(SSL_CA_LOCATION, SSL_CERTIFICATE_LOCATION, SSL_KEY_LOCATION);

  private PemTlsMaterial() {
    // Utility
  }

  /**
   * Adds trust and key store properties for every configured PEM location.
   *
   * @param config client configuration possibly holding PEM locations
   * @param props client properties to extend
   * @throws ClientCreationException when a file cannot be read or only one of certificate and key is given
   */
  static void apply(Map<String, Object> config, Properties props) throws ClientCreationException {
    Object ca = config.get(SSL_CA_LOCATION);
    if (ca != null) {
      props.put(SslConfigs.SSL_TRUSTSTORE_TYPE_CONFIG, PEM);
      props.put(SslConfigs.SSL_TRUSTSTORE_CERTIFICATES_CONFIG, read(SSL_CA_LOCATION, ca));
    }

    Object certificate = config.get(SSL_CERTIFICATE_LOCATION);
    Object key = config.get(SSL_KEY_LOCATION);
    if ((certificate == null) != (key == null)) {
      throw new ClientCreationException(
          SSL_CERTIFICATE_LOCATION + " and " + SSL_KEY_LOCATION + " must be configured together");
    }
    if (certificate != null) {
      props.put(SslConfigs.SSL_KEYSTORE_TYPE_CONFIG, PEM);
      props.put(SslConfigs.SSL_KEYSTORE_CERTIFICATE_CHAIN_CONFIG, read(SSL_CERTIFICATE_LOCATION, certificate));
      props.put(SslConfigs.SSL_KEYSTORE_KEY_CONFIG, read(SSL_KEY_LOCATION, key));
    }
  }

  private static String read(String key, Object location) throws ClientCreationException {
    Path path = Path.of(String.valueOf(location));
    try {
      return Files.readString(path, StandardCharsets.US_ASCII).trim();
    } catch (IOException | RuntimeException ex) {
      throw new ClientCreationException("Could not read " + key + " " + path + " (" + ex.getMessage() + ")", ex);
    }
  }
}
