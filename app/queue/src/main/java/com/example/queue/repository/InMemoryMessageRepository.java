package com.example.queue.repository;

import com.example.queue.model.Message;
import com.example.queue.model.MessageState;
import com.google.common.annotations.VisibleForTesting;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import org.springframework.stereotype.Repository;

/**
 * Keeps the ready queue and the in-flight set in memory behind one lock.
 *
 * <p>Both partitions are read and written under the same lock for the full duration of each
 * operation, so a message moves between them atomically and is never visible in both or in
 * neither. The in-flight map preserves lease order, which is the order expired leases are
 * released in.
 */
@Repository
public class InMemoryMessageRepository implements MessageRepository {

  private final ReentrantLock lock = new ReentrantLock();
  private final Deque<Message> ready = new ArrayDeque<>();
  private final Map<UUID, Message> inFlight = new LinkedHashMap<>();

  @Override
  public void add(Message message) {
    lock.lock();
    try {
      ready.addLast(message);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public List<Message> lease(int count, Instant lockUntil) {
    lock.lock();
    try {
      final int size = Math.min(Math.max(count, 0), ready.size());
      final List<Message> leased = new ArrayList<>(size);
      for (int i = 0; i < size; i++) {
        final Message queued = ready.pollFirst();
        final Message processing =
            new Message(
                queued.id(),
                queued.body(),
                MessageState.PROCESSING,
                lockUntil,
                queued.retryCount());
        inFlight.put(processing.id(), processing);
        leased.add(processing);
      }
      return leased;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int delete(Collection<UUID> ids) {
    lock.lock();
    try {
      int deleted = 0;
      for (UUID id : ids) {
        if (inFlight.remove(id) != null) {
          deleted++;
        }
      }
      return deleted;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int purge() {
    lock.lock();
    try {
      final int purged = ready.size() + inFlight.size();
      ready.clear();
      inFlight.clear();
      return purged;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int retry(Collection<UUID> ids) {
    lock.lock();
    try {
      int retried = 0;
      for (UUID id : ids) {
        final Message processing = inFlight.remove(id);
        if (processing != null) {
          ready.addLast(toReady(processing));
          retried++;
        }
      }
      return retried;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public List<Message> peek(int count) {
    lock.lock();
    try {
      final int size = Math.min(Math.max(count, 0), ready.size());
      final List<Message> head = new ArrayList<>(size);
      final Iterator<Message> iterator = ready.iterator();
      while (head.size() < size) {
        head.add(iterator.next());
      }
      return head;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int releaseExpired(Instant now) {
    lock.lock();
    try {
      int released = 0;
      final Iterator<Message> iterator = inFlight.values().iterator();
      while (iterator.hasNext()) {
        final Message processing = iterator.next();
        if (processing.lockUntil() == null || processing.lockUntil().isAfter(now)) {
          continue;
        }
        iterator.remove();
        ready.addLast(toReady(processing));
        released++;
      }
      return released;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int readyCount() {
    lock.lock();
    try {
      return ready.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int inFlightCount() {
    lock.lock();
    try {
      return inFlight.size();
    } finally {
      lock.unlock();
    }
  }

  @VisibleForTesting
  List<Message> readySnapshot() {
    lock.lock();
    try {
      return List.copyOf(ready);
    } finally {
      lock.unlock();
    }
  }

  @VisibleForTesting
  List<Message> inFlightSnapshot() {
    lock.lock();
    try {
      return List.copyOf(inFlight.values());
    } finally {
      lock.unlock();
    }
  }

  private Message toReady(Message processing) {
    return new Message(
        processing.id(),
        processing.body(),
        MessageState.READY,
        null,
        processing.retryCount() + 1);
  }
}
