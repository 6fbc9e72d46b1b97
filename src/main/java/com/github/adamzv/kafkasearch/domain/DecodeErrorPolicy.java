package com.github.adamzv.kafkasearch.domain;

/**
 * What a read does when the payload decoder rejects a message.
 */
public enum DecodeErrorPolicy {
  /** Fail the read with a {@code DECODE_FAILED} problem. */
  ABORT,
  /** End the read quietly, keeping whatever was delivered so far. */
  STOP_SILENTLY
}
