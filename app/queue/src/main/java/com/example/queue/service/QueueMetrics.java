package com.example.queue.service;

import com.example.queue.repository.MessageRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
public class QueueMetrics {

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> messageCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> rejectedCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> storageErrorCounters = new ConcurrentHashMap<>();

  public QueueMetrics(MeterRegistry meterRegistry, MessageRepository repository) {
    this.meterRegistry = meterRegistry;
    Gauge.builder("smql.queue.ready", repository, MessageRepository::readyCount)
        .description("Messages waiting in the ready queue")
        .register(meterRegistry);
    Gauge.builder("smql.queue.in_flight", repository, MessageRepository::inFlightCount)
        .description("Messages leased and not yet deleted or retried")
        .register(meterRegistry);
  }

  public void recordEnqueued() {
    recordMessages("enqueued", 1);
  }

  public void recordLeased(int count) {
    recordMessages("leased", count);
  }

  public void recordAcknowledged(int count) {
    recordMessages("acknowledged", count);
  }

  public void recordRetried(int count) {
    recordMessages("retried", count);
  }

  public void recordExpired(int count) {
    recordMessages("expired", count);
  }

  public void recordPurged(int count) {
    recordMessages("purged", count);
  }

  public void recordRejected(String reason) {
    rejectedCounters.computeIfAbsent(reason, this::registerRejectedCounter).increment();
  }

  public void recordStorageError(String operation) {
    storageErrorCounters
        .computeIfAbsent(operation, this::registerStorageErrorCounter)
        .increment();
  }

  private void recordMessages(String operation, int count) {
    if (count <= 0) {
      return;
    }
    messageCounters.computeIfAbsent(operation, this::registerMessageCounter).increment(count);
  }

  private Counter registerMessageCounter(String operation) {
    return Counter.builder("smql.messages.total")
        .tags(Tags.of("op", operation))
        .register(meterRegistry);
  }

  private Counter registerRejectedCounter(String reason) {
    return Counter.builder("smql.request.rejected.total")
        .tags(Tags.of("reason", reason))
        .register(meterRegistry);
  }

  private Counter registerStorageErrorCounter(String operation) {
    return Counter.builder("smql.storage.error.total")
        .tags(Tags.of("op", operation))
        .register(meterRegistry);
  }
}
