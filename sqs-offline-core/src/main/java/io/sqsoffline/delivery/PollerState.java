package io.sqsoffline.delivery;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutable per-loop counters. Written only by the owning loop; read through {@link #snapshot}.
 */
final class PollerState {
  private final AtomicReference<LoopState> state = new AtomicReference<>(LoopState.STOPPED);
  private final AtomicLong messagesProcessed = new AtomicLong();
  private final AtomicLong errorCount = new AtomicLong();
  private volatile Instant lastPollTime;
  private volatile String lastError;

  LoopState state() {
    return state.get();
  }

  void state(LoopState next) {
    state.set(next);
  }

  boolean transition(LoopState expected, LoopState next) {
    return state.compareAndSet(expected, next);
  }

  void polled(Instant at) {
    lastPollTime = at;
  }

  void processed(int count) {
    messagesProcessed.addAndGet(count);
  }

  void error(String message) {
    errorCount.incrementAndGet();
    lastError = message;
  }

  PollerStatus snapshot(String pollerId, String queueName, String handlerRef) {
    LoopState current = state.get();
    return new PollerStatus(pollerId, queueName, handlerRef, current, current == LoopState.POLLING,
        messagesProcessed.get(), errorCount.get(), lastPollTime, lastError);
  }
}
