package com.github.adamzv.kafkasearch.adapters.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.adamzv.kafkasearch.domain.Partition;
import com.github.adamzv.kafkasearch.domain.ProblemCodes;
import com.github.adamzv.kafkasearch.domain.ProblemException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.kafka.clients.admin.MockAdminClient;
import org.apache.kafka.common.Node;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.TopicPartitionInfo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class KafkaAdminAdapterTest {

  private static final Node BROKER = new Node(0, "localhost", 9092);

  private MockAdminClient admin;
  private KafkaAdminAdapter adapter;

  @BeforeEach
  void setUp() {
    admin = new MockAdminClient(List.of(BROKER), BROKER);
    adapter = new KafkaAdminAdapter(admin, "localhost:9092");
  }

  @AfterEach
  void tearDown() {
    adapter.close();
  }

  @Test
  void listsInternalTopicsToo() {
    addTopic(false, "orders", 1);
    addTopic(true, "__consumer_offsets", 1);

    assertEquals(Set.of("orders", "__consumer_offsets"), adapter.listTopicNames());
  }

  @Test
  void describesPartitionsWithOffsetRangeSortedByIndex() {
    addTopic(false, "orders", 3);
    admin.updateBeginningOffsets(Map.of(
        new TopicPartition("orders", 0), 0L,
        new TopicPartition("orders", 1), 40L,
        new TopicPartition("orders", 2), 7L
    ));
    admin.updateEndOffsets(Map.of(
        new TopicPartition("orders", 0), 12L,
        new TopicPartition("orders", 1), 40L,
        new TopicPartition("orders", 2), 90L
    ));

    List<Partition> partitions = adapter.describePartitions("orders");

    assertEquals(List.of(
        Partition.of("orders", 0, 0, 12),
        Partition.of("orders", 1, 40, 40),
        Partition.of("orders", 2, 7, 90)
    ), partitions);
    assertTrue(partitions.get(1).isExhausted());
  }

  @Test
  void unknownTopicIsNotFound() {
    ProblemException exception = assertThrows(ProblemException.class, () -> adapter.describePartitions("missing"));

    assertEquals(ProblemCodes.NOT_FOUND, exception.problem().code());
  }

  @Test
  void blankTopicIsInvalidArgument() {
    ProblemException exception = assertThrows(ProblemException.class, () -> adapter.describePartitions(""));

    assertEquals(ProblemCodes.INVALID_ARGUMENT, exception.problem().code());
  }

  private void addTopic(boolean internal, String name, int partitions) {
    List<TopicPartitionInfo> infos = new ArrayList<>();
    for (int p = 0; p < partitions; p++) {
      infos.add(new TopicPartitionInfo(p, BROKER, List.of(BROKER), List.of(BROKER)));
    }
    admin.addTopic(internal, name, infos, Map.of());
  }
}
