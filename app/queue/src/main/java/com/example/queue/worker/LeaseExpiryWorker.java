/*
 * Where: Queue lease reaper
 * What: Returns messages whose lease deadline passed to the ready queue on a schedule
 * Why: A consumer that crashes after leasing must not strand its messages in flight
 */
package com.example.queue.worker;

import com.example.queue.service.QueueMetrics;
import com.example.queue.service.QueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "smql.lease-reaper-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class LeaseExpiryWorker {

  private static final Logger logger = LoggerFactory.getLogger(LeaseExpiryWorker.class);

  private final QueueService queueService;
  private final QueueMetrics metrics;

  public LeaseExpiryWorker(QueueService queueService, QueueMetrics metrics) {
    this.queueService = queueService;
    this.metrics = metrics;
  }

  @Scheduled(fixedDelayString = "${smql.lease-reaper-interval}")
  public void run() {
    try {
      queueService.releaseExpiredLeases();
    } catch (RuntimeException ex) {
      logger.warn("lease expiry worker loop failed", ex);
      metrics.recordStorageError("worker_loop");
    }
  }
}
