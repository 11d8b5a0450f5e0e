package ca.gc.cra.glyphforge.application.pipeline;

import ca.gc.cra.glyphforge.application.port.MetricsPort;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double capturing metric usage for assertions; safe for concurrent callers.
 */
final class RecordingMetricsPort implements MetricsPort {
  private final Map<String, AtomicInteger> counters = new ConcurrentHashMap<>();
  private final Map<String, List<Long>> observations = new ConcurrentHashMap<>();

  @Override
  public void increment(String key) {
    counters.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
  }

  @Override
  public void observe(String key, long value) {
    observations.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(value);
  }

  int count(String key) {
    AtomicInteger counter = counters.get(key);
    return counter == null ? 0 : counter.get();
  }

  List<Long> observed(String key) {
    return observations.getOrDefault(key, Collections.emptyList());
  }
}
