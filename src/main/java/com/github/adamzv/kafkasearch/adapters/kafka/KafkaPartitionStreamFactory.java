package com.github.adamzv.kafkasearch.adapters.kafka;

import com.github.adamzv.kafkasearch.domain.Problems;
import com.github.adamzv.kafkasearch.ports.PartitionStream;
import com.github.adamzv.kafkasearch.ports.PartitionStreamFactory;
import com.github.adamzv.kafkasearch.security.ConnectionConfig;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens one consumer per partition stream. Consumers are assigned manually and never join a
 * group or commit offsets.
 */
public class KafkaPartitionStreamFactory implements PartitionStreamFactory {

  private static final Logger log = LoggerFactory.getLogger(KafkaPartitionStreamFactory.class);

  private final ConnectionConfig connectionConfig;
  private final Function<Map<String, Object>, Consumer<byte[], byte[]>> consumerFactory;

  public KafkaPartitionStreamFactory(ConnectionConfig connectionConfig) {
    this(connectionConfig, props -> new KafkaConsumer<>(props, new ByteArrayDeserializer(), new ByteArrayDeserializer()));
  }

  KafkaPartitionStreamFactory(ConnectionConfig connectionConfig,
                              Function<Map<String, Object>, Consumer<byte[], byte[]>> consumerFactory) {
    this.connectionConfig = connectionConfig;
    this.consumerFactory = consumerFactory;
  }

  @Override
  public PartitionStream open(String topic, int partition, long offset) {
    Map<String, Object> props = new HashMap<>(connectionConfig.toProperties());
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
    props.put(ConsumerConfig.CLIENT_ID_CONFIG, "kafka-search-" + topic + "-" + partition + "-" + UUID.randomUUID());

    TopicPartition topicPartition = new TopicPartition(topic, partition);
    Consumer<byte[], byte[]> consumer = null;
    try {
      consumer = consumerFactory.apply(props);
      KafkaPartitionStream stream = KafkaPartitionStream.open(consumer, topicPartition, offset);
      log.debug("partition_stream_opened topic={} partition={} offset={}", topic, partition, offset);
      return stream;
    } catch (KafkaException | IllegalStateException ex) {
      if (consumer != null) {
        closeAfterFailure(consumer, topicPartition);
      }
      throw Problems.connectFailed(
          "Cannot open partition stream",
          Map.of(
              "topic", topic,
              "partition", partition,
              "offset", offset,
              "bootstrapServers", String.join(",", connectionConfig.bootstrapServers()),
              "error", ex.getClass().getSimpleName()
          ),
          ex
      );
    }
  }

  private void closeAfterFailure(Consumer<byte[], byte[]> consumer, TopicPartition topicPartition) {
    try {
      consumer.close();
    } catch (KafkaException ex) {
      log.warn("Failed to close consumer for {} after open failure", topicPartition, ex);
    }
  }
}
