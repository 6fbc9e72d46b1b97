package com.github.adamzv.kafkasearch.adapters.kafka;

import com.github.adamzv.kafkasearch.domain.Problems;
import com.github.adamzv.kafkasearch.domain.RawRecord;
import com.github.adamzv.kafkasearch.ports.PartitionStream;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.InterruptException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-partition stream over a dedicated consumer. Records of one poll are handed out one
 * at a time.
 */
final class KafkaPartitionStream implements PartitionStream {

  private static final Logger log = LoggerFactory.getLogger(KafkaPartitionStream.class);

  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(2);
  private static final Duration POSITION_TIMEOUT = Duration.ofSeconds(5);

  private final Consumer<byte[], byte[]> consumer;
  private final TopicPartition topicPartition;
  private final Deque<ConsumerRecord<byte[], byte[]>> buffered = new ArrayDeque<>();
  private boolean closed;

  private KafkaPartitionStream(Consumer<byte[], byte[]> consumer, TopicPartition topicPartition) {
    this.consumer = consumer;
    this.topicPartition = topicPartition;
  }

  static KafkaPartitionStream open(Consumer<byte[], byte[]> consumer, TopicPartition topicPartition, long offset) {
    consumer.assign(List.of(topicPartition));
    consumer.seek(topicPartition, offset);
    return new KafkaPartitionStream(consumer, topicPartition);
  }

  @Override
  public Optional<RawRecord> poll(Duration timeout) {
    if (closed) {
      throw new IllegalStateException("Stream for " + topicPartition + " is closed");
    }
    if (buffered.isEmpty()) {
      fill(timeout);
    }
    ConsumerRecord<byte[], byte[]> record = buffered.pollFirst();
    if (record == null) {
      return Optional.empty();
    }
    return Optional.of(new RawRecord(record.topic(), record.partition(), record.offset(), record.value()));
  }

  @Override
  public long position() {
    ConsumerRecord<byte[], byte[]> next = buffered.peekFirst();
    if (next != null) {
      return next.offset();
    }
    try {
      return consumer.position(topicPartition, POSITION_TIMEOUT);
    } catch (InterruptException ex) {
      throw Problems.operationFailed(
          "Interrupted while reading position",
          Map.of("topic", topicPartition.topic(), "partition", topicPartition.partition())
      );
    } catch (KafkaException ex) {
      throw Problems.connectFailed(
          "Cannot read consumer position",
          Map.of("topic", topicPartition.topic(), "partition", topicPartition.partition(), "error", ex.getClass().getSimpleName()),
          ex
      );
    }
  }

  private void fill(Duration timeout) {
    try {
      for (ConsumerRecord<byte[], byte[]> record : consumer.poll(timeout).records(topicPartition)) {
        buffered.addLast(record);
      }
    } catch (InterruptException ex) {
      throw Problems.operationFailed(
          "Interrupted while polling",
          Map.of("topic", topicPartition.topic(), "partition", topicPartition.partition())
      );
    } catch (KafkaException ex) {
      throw Problems.connectFailed(
          "Kafka poll failed",
          Map.of("topic", topicPartition.topic(), "partition", topicPartition.partition(), "error", ex.getClass().getSimpleName()),
          ex
      );
    }
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    buffered.clear();
    try {
      consumer.close(CLOSE_TIMEOUT);
    } catch (KafkaException ex) {
      log.warn("Failed to close consumer for {}", topicPartition, ex);
    }
  }
}
