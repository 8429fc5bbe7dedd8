package com.example.queue.service;

import com.example.queue.config.QueueProperties;
import com.example.queue.model.Message;
import com.example.queue.model.MessageIds;
import com.example.queue.repository.MessageRepository;
import com.example.queue.repository.MessageStorageException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class QueueService {

  private static final Logger logger = LoggerFactory.getLogger(QueueService.class);
  private static final int DEFAULT_COUNT = 1;

  private final MessageRepository repository;
  private final QueueProperties properties;
  private final QueueMetrics metrics;
  private final Clock clock;

  public QueueService(
      MessageRepository repository,
      QueueProperties properties,
      QueueMetrics metrics,
      Clock clock) {
    this.repository = repository;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
  }

  public Message add(String body) {
    if (body == null) {
      metrics.recordRejected("invalid_request");
      throw new InvalidQueueRequestException("body is required");
    }
    final long size = body.getBytes(StandardCharsets.UTF_8).length;
    final long limit = properties.maxMessageSizeBytes();
    if (size > limit) {
      metrics.recordRejected("body_too_large");
      logger.debug("rejected message body size={} limit={}", size, limit);
      throw new MessageBodyTooLargeException(size, limit);
    }
    final Message message = Message.create(body);
    callStorage(
        "add",
        () -> {
          repository.add(message);
          return message;
        });
    metrics.recordEnqueued();
    logger.debug("enqueued message id={} size={}", message.id(), size);
    return message;
  }

  public List<Message> get(Integer count) {
    final int resolved = resolveCount(count);
    final Instant lockUntil = nextLockUntil();
    final List<Message> leased = callStorage("lease", () -> repository.lease(resolved, lockUntil));
    metrics.recordLeased(leased.size());
    logger.debug("leased messages requested={} leased={}", resolved, leased.size());
    return leased;
  }

  public List<Message> peek(Integer count) {
    final int resolved = resolveCount(count);
    return callStorage("peek", () -> repository.peek(resolved));
  }

  public void delete(List<String> ids) {
    final List<UUID> parsed = validateIds(ids);
    final int deleted = callStorage("delete", () -> repository.delete(parsed));
    metrics.recordAcknowledged(deleted);
    logger.debug("deleted messages requested={} deleted={}", parsed.size(), deleted);
  }

  public void retry(List<String> ids) {
    final List<UUID> parsed = validateIds(ids);
    final int retried = callStorage("retry", () -> repository.retry(parsed));
    metrics.recordRetried(retried);
    logger.debug("retried messages requested={} retried={}", parsed.size(), retried);
  }

  public void purge() {
    final int purged = callStorage("purge", repository::purge);
    metrics.recordPurged(purged);
    logger.info("purged queue messages={}", purged);
  }

  /**
   * 役割: リース期限切れのメッセージを ready キューへ戻す。
   * 動作: 現在時刻で期限判定し、戻した件数を返す。リース期限が無効な設定では何もしない。
   */
  public int releaseExpiredLeases() {
    if (!properties.leaseExpiryEnabled()) {
      return 0;
    }
    final Instant now = clock.instant();
    final int released = callStorage("release_expired", () -> repository.releaseExpired(now));
    if (released > 0) {
      metrics.recordExpired(released);
      logger.info("released expired leases count={}", released);
    }
    return released;
  }

  private int resolveCount(Integer count) {
    if (count == null) {
      return DEFAULT_COUNT;
    }
    if (count < 0) {
      metrics.recordRejected("invalid_request");
      throw new InvalidQueueRequestException("count must not be negative");
    }
    return count;
  }

  private Instant nextLockUntil() {
    if (!properties.leaseExpiryEnabled()) {
      return null;
    }
    return clock.instant().plus(properties.leaseTimeout());
  }

  // 全 ID の検証が通るまでストレージへは触れない
  private List<UUID> validateIds(List<String> ids) {
    if (ids == null || ids.isEmpty()) {
      metrics.recordRejected("no_ids");
      throw new MissingMessageIdsException();
    }
    final List<UUID> parsed = new ArrayList<>(ids.size());
    for (String id : ids) {
      final UUID uuid =
          MessageIds.parse(id)
              .orElseThrow(
                  () -> {
                    metrics.recordRejected("invalid_id");
                    return new InvalidMessageIdException(id);
                  });
      parsed.add(uuid);
    }
    return parsed;
  }

  private <T> T callStorage(String operation, Supplier<T> call) {
    try {
      return call.get();
    } catch (MessageStorageException ex) {
      metrics.recordStorageError(operation);
      logger.warn("storage operation failed op={}", operation, ex);
      throw ex;
    }
  }
}
