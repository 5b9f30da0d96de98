package ca.gc.cra.kafkarecon.application.support;

import ca.gc.cra.kafkarecon.application.port.AdminPort;
import ca.gc.cra.kafkarecon.application.port.ClientCreationException;
import ca.gc.cra.kafkarecon.application.port.ClientFactory;
import ca.gc.cra.kafkarecon.application.port.ConsumerPort;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Records the configuration each client was built with and hands out fakes. */
public final class FakeClientFactory implements ClientFactory {
  public final List<Map<String, Object>> adminConfigs = new ArrayList<>();
  public final List<Map<String, Object>> consumerConfigs = new ArrayList<>();
  public final List<FakeAdminPort> admins = new ArrayList<>();
  public final List<FakeConsumerPort> consumers = new ArrayList<>();
  public String adminFailure;
  public String consumerFailure;

  @Override
  public AdminPort createAdmin(Map<String, Object> config) throws ClientCreationException {
    adminConfigs.add(Map.copyOf(config));
    if (adminFailure != null) {
      throw new ClientCreationException(adminFailure);
    }
    FakeAdminPort admin = new FakeAdminPort();
    admins.add(admin);
    return admin;
  }

  @Override
  public ConsumerPort createConsumer(Map<String, Object> config) throws ClientCreationException {
    consumerConfigs.add(Map.copyOf(config));
    if (consumerFailure != null) {
      throw new ClientCreationException(consumerFailure);
    }
    FakeConsumerPort consumer = new FakeConsumerPort();
    consumers.add(consumer);
    return consumer;
  }
}
