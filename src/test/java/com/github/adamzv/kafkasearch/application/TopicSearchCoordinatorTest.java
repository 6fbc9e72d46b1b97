package com.github.adamzv.kafkasearch.application;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.adamzv.kafkasearch.domain.Partition;
import com.github.adamzv.kafkasearch.domain.ProblemCodes;
import com.github.adamzv.kafkasearch.domain.ProblemException;
import com.github.adamzv.kafkasearch.domain.ResultOrdering;
import com.github.adamzv.kafkasearch.ports.PayloadDecoder;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class TopicSearchCoordinatorTest {

  private static final Duration POLL_TIMEOUT = Duration.ofMillis(20);

  @Test
  void firstOnlyReturnsSingleMatchWithoutWaitingForStalledPartitions() {
    InMemoryBroker broker = new InMemoryBroker().topic("events", 4)
        .append("events", 0, "boot", "needle-here", "shutdown")
        .append("events", 1, "a", "b")
        .append("events", 2, "c", "d")
        .append("events", 3, "e", "f")
        .stall("events", 1)
        .stall("events", 2)
        .stall("events", 3);
    TopicSearchCoordinator coordinator = coordinator(broker, 20, ResultOrdering.SERIALIZED_FORM);

    List<Partition> matches = assertTimeoutPreemptively(Duration.ofSeconds(5),
        () -> coordinator.searchTopic(partitions(broker, "events", 4), "needle", true, ProgressListener.NONE));

    assertEquals(1, matches.size());
    assertEquals(0, matches.get(0).partition());
    assertEquals(1L, matches.get(0).offset());
    assertEquals(0, broker.openStreams());
  }

  @Test
  void gatherAllReturnsEveryMatchingPartition() {
    InMemoryBroker broker = new InMemoryBroker().topic("events", 5)
        .append("events", 0, "x", "needle")
        .append("events", 1, "x", "y")
        .append("events", 2, "needle")
        .append("events", 3, "x", "y", "z")
        .append("events", 4, "x", "y", "prefix-needle-suffix");
    TopicSearchCoordinator coordinator = coordinator(broker, 20, ResultOrdering.PARTITION_INDEX);

    List<Partition> matches = coordinator.searchTopic(partitions(broker, "events", 5), "needle", false,
        ProgressListener.NONE);

    assertEquals(List.of(0, 2, 4), matches.stream().map(Partition::partition).toList());
    assertEquals(List.of(1L, 0L, 2L), matches.stream().map(Partition::offset).toList());
    assertEquals(0, broker.openStreams());
  }

  @Test
  void gatherAllCompletesWhenPartitionsEndWithMarkers() {
    InMemoryBroker broker = new InMemoryBroker().topic("events", 3)
        .append("events", 0, "x").appendMarker("events", 0)
        .append("events", 1, "needle").appendMarker("events", 1)
        .appendMarker("events", 2);
    TopicSearchCoordinator coordinator = coordinator(broker, 20, ResultOrdering.PARTITION_INDEX);

    List<Partition> matches = assertTimeoutPreemptively(Duration.ofSeconds(5),
        () -> coordinator.searchTopic(partitions(broker, "events", 3), "needle", false, ProgressListener.NONE));

    assertEquals(List.of(1), matches.stream().map(Partition::partition).toList());
    assertEquals(0, broker.openStreams());
  }

  @Test
  void reportsProgressOncePerPartition() {
    InMemoryBroker broker = new InMemoryBroker().topic("events", 3)
        .append("events", 0, "a")
        .append("events", 1, "b")
        .append("events", 2, "c");
    TopicSearchCoordinator coordinator = coordinator(broker, 2, ResultOrdering.SERIALIZED_FORM);
    List<long[]> calls = new ArrayList<>();

    coordinator.searchTopic(partitions(broker, "events", 3), "zzz", false,
        (current, total) -> calls.add(new long[] {current, total}));

    assertEquals(3, calls.size());
    for (int i = 0; i < calls.size(); i++) {
      assertEquals(i, calls.get(i)[0]);
      assertEquals(3L, calls.get(i)[1]);
    }
  }

  @Test
  void neverRunsMoreWorkersThanConcurrency() {
    InMemoryBroker broker = new InMemoryBroker().topic("events", 8).recordDelay(Duration.ofMillis(5));
    for (int p = 0; p < 8; p++) {
      broker.append("events", p, "one", "two", "three", "four");
    }
    TopicSearchCoordinator coordinator = coordinator(broker, 2, ResultOrdering.SERIALIZED_FORM);

    List<Partition> matches = coordinator.searchTopic(partitions(broker, "events", 8), "absent", false,
        ProgressListener.NONE);

    assertTrue(matches.isEmpty());
    assertEquals(8, broker.openedStreams());
    assertTrue(broker.maxOpenStreams() <= 2, "max open streams was " + broker.maxOpenStreams());
    assertEquals(0, broker.openStreams());
  }

  @Test
  void firstWorkerErrorIsRaisedAfterOtherWorkersStop() {
    InMemoryBroker broker = new InMemoryBroker().topic("events", 4)
        .append("events", 0, "a")
        .append("events", 1, "b")
        .append("events", 2, "c")
        .append("events", 3, "d")
        .stall("events", 0)
        .stall("events", 2)
        .stall("events", 3)
        .failOpen("events", 1);
    TopicSearchCoordinator coordinator = coordinator(broker, 20, ResultOrdering.SERIALIZED_FORM);

    ProblemException exception = assertTimeoutPreemptively(Duration.ofSeconds(5),
        () -> assertThrows(ProblemException.class,
            () -> coordinator.searchTopic(partitions(broker, "events", 4), "needle", false, ProgressListener.NONE)));

    assertEquals(ProblemCodes.CONNECT_FAILED, exception.problem().code());
    assertEquals(0, broker.openStreams());
  }

  @Test
  void serializedFormOrderingComparesJsonText() {
    InMemoryBroker broker = matchingPartitions2And10();
    TopicSearchCoordinator coordinator = coordinator(broker, 20, ResultOrdering.SERIALIZED_FORM);

    List<Partition> matches = coordinator.searchTopic(partitions(broker, "events", 11), "needle", false,
        ProgressListener.NONE);

    assertEquals(List.of(10, 2), matches.stream().map(Partition::partition).toList());
  }

  @Test
  void partitionIndexOrderingIsNumeric() {
    InMemoryBroker broker = matchingPartitions2And10();
    TopicSearchCoordinator coordinator = coordinator(broker, 20, ResultOrdering.PARTITION_INDEX);

    List<Partition> matches = coordinator.searchTopic(partitions(broker, "events", 11), "needle", false,
        ProgressListener.NONE);

    assertEquals(List.of(2, 10), matches.stream().map(Partition::partition).toList());
  }

  @Test
  void emptyPartitionListYieldsNoMatches() {
    InMemoryBroker broker = new InMemoryBroker();
    TopicSearchCoordinator coordinator = coordinator(broker, 20, ResultOrdering.SERIALIZED_FORM);

    assertTrue(coordinator.searchTopic(List.of(), "needle", true, ProgressListener.NONE).isEmpty());
  }

  private static InMemoryBroker matchingPartitions2And10() {
    InMemoryBroker broker = new InMemoryBroker().topic("events", 11);
    for (int p = 0; p < 11; p++) {
      broker.append("events", p, p == 2 || p == 10 ? "needle" : "hay");
    }
    return broker;
  }

  private static TopicSearchCoordinator coordinator(InMemoryBroker broker, int concurrency, ResultOrdering ordering) {
    PartitionScanner scanner = new PartitionScanner(broker, PayloadDecoder.IDENTITY, POLL_TIMEOUT);
    return new TopicSearchCoordinator(scanner, concurrency, ordering);
  }

  private static List<Partition> partitions(InMemoryBroker broker, String topic, int count) {
    List<Partition> partitions = new ArrayList<>();
    for (int p = 0; p < count; p++) {
      partitions.add(broker.partition(topic, p));
    }
    return partitions;
  }
}
