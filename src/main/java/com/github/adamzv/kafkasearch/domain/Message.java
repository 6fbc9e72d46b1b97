package com.github.adamzv.kafkasearch.domain;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A decoded message together with the partition context it was read within. The payload is
 * copied on the way in and out, and compared by content.
 */
public record Message(
    Partition partition,
    byte[] value,
    long offset
) {

  public Message {
    value = value == null ? null : value.clone();
  }

  @Override
  public byte[] value() {
    return value == null ? null : value.clone();
  }

  public String valueString() {
    return value == null ? null : new String(value, StandardCharsets.UTF_8);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Message that)) {
      return false;
    }
    return offset == that.offset
        && Objects.equals(partition, that.partition)
        && Arrays.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(partition, offset) + Arrays.hashCode(value);
  }

  @Override
  public String toString() {
    return "Message[partition=" + partition + ", offset=" + offset
        + ", valueLength=" + (value == null ? -1 : value.length) + "]";
  }
}
