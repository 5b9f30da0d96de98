package ca.gc.cra.kafkarecon.application.port;

/**
 * Consumer client capability; topology is available as a side effect of consumer metadata.
 *
 * @since 0.1.0
 */
public interface ConsumerPort extends TopologySource {
}
