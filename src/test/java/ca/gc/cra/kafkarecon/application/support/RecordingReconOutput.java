package ca.gc.cra.kafkarecon.application.support;

import ca.gc.cra.kafkarecon.application.port.ReconOutput;
import java.util.ArrayList;
import java.util.List;

/** Records output events as tagged lines: {@code +msg}, {@code -msg}, {@code table:<headers>}, {@code blank}. */
public final class RecordingReconOutput implements ReconOutput {
  public final List<String> events = new ArrayList<>();
  public final List<List<List<Object>>> tables = new ArrayList<>();

  @Override
  public void success(String message) {
    events.add("+" + message);
  }

  @Override
  public void failure(String message) {
    events.add("-" + message);
  }

  @Override
  public void table(List<String> headers, List<List<Object>> rows) {
    events.add("table:" + String.join("|", headers));
    tables.add(List.copyOf(rows));
  }

  @Override
  public void blank() {
    events.add("blank");
  }

  public List<String> messages() {
    return events.stream().filter(e -> !e.equals("blank")).toList();
  }

  public boolean hasSuccess(String message) {
    return events.contains("+" + message);
  }

  public boolean hasFailure(String message) {
    return events.contains("-" + message);
  }

  public boolean anyTable() {
    return events.stream().anyMatch(e -> e.startsWith("table:"));
  }
}
