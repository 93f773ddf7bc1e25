package io.sqsoffline.delivery;

import io.sqsoffline.config.QueueDescriptor;
import io.sqsoffline.model.QueueHandle;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One polling loop: a descriptor, its resolved queue, its schedule and its counters.
 * The cycle lock keeps cycles of the same loop from overlapping and is carried over
 * when a stopped loop is started again.
 */
final class QueuePoller {
  private final QueueDescriptor descriptor;
  private final PollerState state;
  private final ReentrantLock cycleLock;
  private volatile QueueHandle queue;
  private volatile ScheduledFuture<?> schedule;

  QueuePoller(QueueDescriptor descriptor, PollerState state) {
    this(descriptor, state, new ReentrantLock());
  }

  QueuePoller(QueueDescriptor descriptor, PollerState state, ReentrantLock cycleLock) {
    this.descriptor = descriptor;
    this.state = state;
    this.cycleLock = cycleLock;
  }

  QueueDescriptor descriptor() {
    return descriptor;
  }

  PollerState state() {
    return state;
  }

  ReentrantLock cycleLock() {
    return cycleLock;
  }

  QueueHandle queue() {
    return queue;
  }

  void queue(QueueHandle queue) {
    this.queue = queue;
  }

  void schedule(ScheduledFuture<?> schedule) {
    this.schedule = schedule;
  }

  void cancel() {
    ScheduledFuture<?> current = schedule;
    if (current != null) {
      current.cancel(false);
      schedule = null;
    }
  }

  String pollerId() {
    return descriptor.pollerId();
  }

  PollerStatus snapshot() {
    return state.snapshot(pollerId(), descriptor.name(), descriptor.handlerRef());
  }
}
