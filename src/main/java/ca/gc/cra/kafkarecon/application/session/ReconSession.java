package ca.gc.cra.kafkarecon.application.session;

import ca.gc.cra.kafkarecon.application.port.AdminPort;
import ca.gc.cra.kafkarecon.application.port.ConsumerPort;
import ca.gc.cra.kafkarecon.application.port.TopologySource;
import ca.gc.cra.kafkarecon.config.ConfigStore;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Context of one operator session: configuration, client handle slots, and the label of the
 * broker currently targeted.
 * <p><strong>Why:</strong> Connect, discover, and disconnect share state; holding it in an explicit object makes the
 * lifecycle (create empty, connect, disconnect, close at exit) a contract instead of a global.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hold the admin and consumer slots independently; either, both, or neither may be filled.</li>
 *   <li>Reject overlapping operations so a reconnect can never race an in-flight discovery.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Operations wrapped in {@link #exclusive(String, Supplier)} are mutually
 * exclusive; a second caller fails fast rather than waiting.</p>
 *
 * @since 0.1.0
 */
public final class ReconSession implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ReconSession.class);

  /** Broker label shown while no handle is present. */
  public static final String NOT_CONNECTED = "not connected";

  private final ConfigStore config;
  private final ReentrantLock operationLock = new ReentrantLock();
  private AdminPort admin;
  private ConsumerPort consumer;
  private String brokerLabel = NOT_CONNECTED;

  /**
   * Creates a session with an empty configuration.
   */
  public ReconSession() {
    this(new ConfigStore());
  }

  /**
   * Creates a session around an existing store.
   *
   * @param config configuration store shared with the shell
   */
  public ReconSession(ConfigStore config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  /**
   * Runs {@code action} while holding the session's operation lock.
   *
   * @param operation name used in the rejection message
   * @param action work to run
   * @param <T> result type
   * @return the action's result
   * @throws IllegalStateException when another thread is running an operation on this session
   */
  public <T> T exclusive(String operation, Supplier<T> action) {
    if (!operationLock.tryLock()) {
      throw new IllegalStateException(
          "session busy: cannot run " + operation + " while another operation is in progress");
    }
    try {
      return action.get();
    } finally {
      operationLock.unlock();
    }
  }

  public ConfigStore config() {
    return config;
  }

  public Optional<AdminPort> admin() {
    return Optional.ofNullable(admin);
  }

  public Optional<ConsumerPort> consumer() {
    return Optional.ofNullable(consumer);
  }

  /**
   * Indicates whether at least one handle is present.
   *
   * @return {@code true} when an admin or consumer handle is held
   */
  public boolean isConnected() {
    return admin != null || consumer != null;
  }

  /**
   * Returns the label of the broker targeted by the current handles.
   *
   * @return resolved bootstrap address, or {@link #NOT_CONNECTED}
   */
  public String brokerLabel() {
    return brokerLabel;
  }

  /**
   * Stores a freshly built admin handle.
   *
   * @param handle admin client
   * @param resolvedBroker bootstrap address the handle was built against
   */
  public void attachAdmin(AdminPort handle, String resolvedBroker) {
    this.admin = Objects.requireNonNull(handle, "handle");
    this.brokerLabel = Objects.requireNonNull(resolvedBroker, "resolvedBroker");
  }

  /**
   * Stores a freshly built consumer handle.
   *
   * @param handle consumer client
   * @param resolvedBroker bootstrap address the handle was built against
   */
  public void attachConsumer(ConsumerPort handle, String resolvedBroker) {
    this.consumer = Objects.requireNonNull(handle, "handle");
    this.brokerLabel = Objects.requireNonNull(resolvedBroker, "resolvedBroker");
  }

  /**
   * Empties the admin slot without closing the handle.
   *
   * @return the handle that was held, if any
   */
  public Optional<AdminPort> detachAdmin() {
    Optional<AdminPort> previous = Optional.ofNullable(admin);
    admin = null;
    resetLabelWhenEmpty();
    return previous;
  }

  /**
   * Empties the consumer slot without closing the handle.
   *
   * @return the handle that was held, if any
   */
  public Optional<ConsumerPort> detachConsumer() {
    Optional<ConsumerPort> previous = Optional.ofNullable(consumer);
    consumer = null;
    resetLabelWhenEmpty();
    return previous;
  }

  /**
   * Closes any handles still held; used when the process exits.
   *
   * <p>Handles in use by a running operation are left to it: closing is skipped while the
   * operation lock is held by another thread.</p>
   */
  @Override
  public void close() {
    if (!operationLock.tryLock()) {
      log.debug("Session busy; leaving client handles to the running operation");
      return;
    }
    try {
      detachAdmin().ifPresent(handle -> closeQuietly("admin", handle));
      detachConsumer().ifPresent(handle -> closeQuietly("consumer", handle));
    } finally {
      operationLock.unlock();
    }
  }

  private void resetLabelWhenEmpty() {
    if (!isConnected()) {
      brokerLabel = NOT_CONNECTED;
    }
  }

  private static void closeQuietly(String kind, TopologySource handle) {
    try {
      handle.close();
      log.debug("Closed {} client on session shutdown", kind);
    } catch (RuntimeException ex) {
      log.warn("Failed to close {} client on session shutdown", kind, ex);
    }
  }
}
