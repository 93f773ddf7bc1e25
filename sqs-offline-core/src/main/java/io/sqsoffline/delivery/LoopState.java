package io.sqsoffline.delivery;

/**
 * Lifecycle of one polling loop: {@code STOPPED → STARTING → POLLING → STOPPING → STOPPED}.
 */
public enum LoopState {
  STOPPED,
  STARTING,
  POLLING,
  STOPPING
}
