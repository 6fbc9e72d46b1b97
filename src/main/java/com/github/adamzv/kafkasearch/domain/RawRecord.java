package com.github.adamzv.kafkasearch.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * Undecoded record as delivered by a partition stream. The payload is copied on the way in and
 * out, and compared by content.
 */
public record RawRecord(
    String topic,
    int partition,
    long offset,
    byte[] value
) {

  public RawRecord {
    value = value == null ? null : value.clone();
  }

  @Override
  public byte[] value() {
    return value == null ? null : value.clone();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof RawRecord that)) {
      return false;
    }
    return partition == that.partition
        && offset == that.offset
        && Objects.equals(topic, that.topic)
        && Arrays.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(topic, partition, offset) + Arrays.hashCode(value);
  }

  @Override
  public String toString() {
    return "RawRecord[topic=" + topic + ", partition=" + partition + ", offset=" + offset
        + ", valueLength=" + (value == null ? -1 : value.length) + "]";
  }
}
