package ca.gc.cra.kafkarecon.application.support;

import ca.gc.cra.kafkarecon.application.port.MetricsPort;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** In-memory metrics sink. */
public final class RecordingMetrics implements MetricsPort {
  private final Map<String, Integer> counters = new ConcurrentHashMap<>();
  public final List<String> observations = new ArrayList<>();

  @Override
  public void increment(String key) {
    counters.merge(key, 1, Integer::sum);
  }

  @Override
  public void observe(String key, long value) {
    observations.add(key);
  }

  public int count(String key) {
    return counters.getOrDefault(key, 0);
  }
}
