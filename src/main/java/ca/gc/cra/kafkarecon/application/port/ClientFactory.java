package ca.gc.cra.kafkarecon.application.port;

import java.util.Map;

/**
 * Builds client handles from already-projected configuration maps.
 *
 * <p>The connection manager decides which keys each client receives; factories only translate and construct.</p>
 *
 * @since 0.1.0
 */
public interface ClientFactory {

  /**
   * Creates an administrative client.
   *
   * @param config admin configuration including {@code bootstrap.servers}
   * @return live admin handle
   * @throws ClientCreationException when the client cannot be constructed
   */
  AdminPort createAdmin(Map<String, Object> config) throws ClientCreationException;

  /**
   * Creates a consumer client.
   *
   * @param config consumer configuration including {@code bootstrap.servers} and {@code group.id}
   * @return live consumer handle
   * @throws ClientCreationException when the client cannot be constructed
   */
  ConsumerPort createConsumer(Map<String, Object> config) throws ClientCreationException;
}
