package ca.gc.cra.kafkarecon.domain.cluster;

import java.util.Objects;

/**
 * One cluster member as advertised in a metadata response.
 *
 * @param id broker id, unique within a snapshot
 * @param host advertised host name or address
 * @param port advertised port
 * @since 0.1.0
 */
public record BrokerRecord(int id, String host, int port) {

  public BrokerRecord {
    Objects.requireNonNull(host, "host");
  }

  /**
   * Returns the advertised endpoint in {@code host:port} form.
   *
   * @return endpoint string
   */
  public String endpoint() {
    return host + ':' + port;
  }
}
