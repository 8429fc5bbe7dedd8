/*
 * Where: Queue application bootstrap
 * What: Logs the effective configuration once the application is ready
 * Why: Make the bound port and limits visible in the first log lines of every start
 */
package com.example.queue.config;

import com.google.common.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class QueueStartupLogger {

  private static final Logger logger = LoggerFactory.getLogger(QueueStartupLogger.class);

  private final QueueProperties properties;
  private final String logLevel;

  public QueueStartupLogger(
      QueueProperties properties, @Value("${logging.level.root:info}") String logLevel) {
    this.properties = properties;
    this.logLevel = logLevel;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onReady(ApplicationReadyEvent event) {
    final String port =
        event.getApplicationContext().getEnvironment().getProperty("local.server.port", "-");
    logger.info(describe(port));
  }

  @VisibleForTesting
  String describe(String port) {
    return "Starting SMQL with configuration: port="
        + port
        + ", max_message_size="
        + properties.maxMessageSizeBytes()
        + ", log_level="
        + logLevel
        + ", lease_timeout="
        + (properties.leaseExpiryEnabled() ? properties.leaseTimeout() : "disabled")
        + ", lease_reaper="
        + (properties.leaseReaperEnabled()
            ? "every " + properties.leaseReaperInterval()
            : "disabled");
  }
}
