package ca.gc.cra.kafkarecon.config;

import java.util.List;

/**
 * Well-known client configuration keys read by the connection manager.
 *
 * <p>Key names follow the librdkafka spelling used by existing recon configuration files; the Kafka
 * adapter translates the TLS material paths for the Java client.</p>
 */
public final class ClientConfigKeys {
  public static final String BOOTSTRAP_SERVERS = "bootstrap.servers";
  public static final String GROUP_ID = "group.id";
  public static final String SECURITY_PROTOCOL = "security.protocol";
  public static final String SSL_CA_LOCATION = "ssl.ca.location";
  public static final String SSL_CERTIFICATE_LOCATION = "ssl.certificate.location";
  public static final String SSL_KEY_LOCATION = "ssl.key.location";
  public static final String ENABLE_PARTITION_EOF = "enable.partition.eof";

  /** Keys copied into the admin client configuration; everything else stays with the consumer. */
  public static final List<String> ADMIN_KEYS = List.of(
      SECURITY_PROTOCOL,
      SSL_CA_LOCATION,
      SSL_CERTIFICATE_LOCATION,
      SSL_KEY_LOCATION);

  private ClientConfigKeys() {}
}
