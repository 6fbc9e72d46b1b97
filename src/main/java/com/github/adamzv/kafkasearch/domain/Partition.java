package com.github.adamzv.kafkasearch.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;

/**
 * One partition of a topic: its oldest ({@code start}) and next-to-be-written ({@code end})
 * offsets plus the cursor reads begin from. {@code start <= offset <= end} always holds.
 *
 * <p>The string form is compact JSON, so a partition can be logged, shown and parsed back
 * with {@link #parse(String)}.
 */
@JsonPropertyOrder({"topic", "partition", "start", "end", "offset", "filter"})
public record Partition(
    String topic,
    int partition,
    long start,
    long end,
    long offset,
    String filter
) {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  public Partition {
    if (topic == null || topic.isBlank()) {
      throw new IllegalArgumentException("topic must not be blank");
    }
    if (start > end) {
      throw new IllegalArgumentException("start " + start + " is after end " + end);
    }
    if (offset < start || offset > end) {
      throw new IllegalArgumentException(
          "offset " + offset + " outside [" + start + ", " + end + "] for " + topic + "/" + partition);
    }
    filter = filter == null ? "" : filter;
  }

  public static Partition of(String topic, int partition, long start, long end) {
    return new Partition(topic, partition, start, end, start, "");
  }

  public Partition withOffset(long newOffset) {
    return new Partition(topic, partition, start, end, newOffset, filter);
  }

  public Partition withFilter(String newFilter) {
    return new Partition(topic, partition, start, end, offset, newFilter);
  }

  /**
   * Messages left between the cursor and the end of the partition.
   */
  @JsonIgnore
  public long remaining() {
    return end - offset;
  }

  @JsonIgnore
  public boolean isExhausted() {
    return offset >= end;
  }

  public static Partition parse(String json) {
    try {
      return MAPPER.readValue(json, Partition.class);
    } catch (JsonProcessingException ex) {
      throw Problems.invalidArgument("Malformed partition", Map.of("value", String.valueOf(json)));
    }
  }

  @Override
  public String toString() {
    try {
      return MAPPER.writeValueAsString(this);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Partition could not be serialized", ex);
    }
  }
}
