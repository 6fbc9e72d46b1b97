package com.github.adamzv.kafkasearch.adapters.kafka;

import com.github.adamzv.kafkasearch.domain.Partition;
import com.github.adamzv.kafkasearch.domain.ProblemException;
import com.github.adamzv.kafkasearch.domain.Problems;
import com.github.adamzv.kafkasearch.ports.BrokerMetadataPort;
import java.time.Duration;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.DescribeTopicsOptions;
import org.apache.kafka.clients.admin.DescribeTopicsResult;
import org.apache.kafka.clients.admin.ListOffsetsOptions;
import org.apache.kafka.clients.admin.ListOffsetsResult.ListOffsetsResultInfo;
import org.apache.kafka.clients.admin.ListTopicsOptions;
import org.apache.kafka.clients.admin.OffsetSpec;
import org.apache.kafka.clients.admin.TopicDescription;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.KafkaFuture;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.UnknownTopicOrPartitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class KafkaAdminAdapter implements BrokerMetadataPort {

  private static final Logger log = LoggerFactory.getLogger(KafkaAdminAdapter.class);

  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

  private final Admin adminClient;
  private final String bootstrapServers;

  public KafkaAdminAdapter(Admin adminClient, String bootstrapServers) {
    this.adminClient = adminClient;
    this.bootstrapServers = bootstrapServers;
  }

  @Override
  public Set<String> listTopicNames() {
    ListTopicsOptions options = new ListTopicsOptions()
        .listInternal(true)
        .timeoutMs(timeoutMs());

    KafkaFuture<Set<String>> future = adminClient.listTopics(options).names();
    Set<String> names = await(future, "listTopics", Map.of());
    return names.stream().collect(Collectors.toUnmodifiableSet());
  }

  @Override
  public List<Partition> describePartitions(String topic) {
    if (topic == null || topic.isBlank()) {
      throw Problems.invalidArgument("Topic name must be provided", Collections.singletonMap("topic", topic));
    }

    DescribeTopicsOptions options = new DescribeTopicsOptions()
        .timeoutMs(timeoutMs())
        .includeAuthorizedOperations(false);

    DescribeTopicsResult result = adminClient.describeTopics(List.of(topic), options);
    Map<String, TopicDescription> descriptions = await(
        result.allTopicNames(),
        "describeTopic",
        Map.of("topic", topic)
    );

    TopicDescription description = descriptions.get(topic);
    if (description == null) {
      throw Problems.notFound("Topic not found", Map.of("topic", topic));
    }

    List<TopicPartition> partitions = description.partitions().stream()
        .map(info -> new TopicPartition(topic, info.partition()))
        .sorted(Comparator.comparingInt(TopicPartition::partition))
        .toList();
    if (partitions.isEmpty()) {
      return List.of();
    }

    Map<TopicPartition, ListOffsetsResultInfo> oldest = listOffsets(partitions, OffsetSpec.earliest(), "listOldestOffsets");
    Map<TopicPartition, ListOffsetsResultInfo> newest = listOffsets(partitions, OffsetSpec.latest(), "listNewestOffsets");

    List<Partition> mapped = partitions.stream()
        .map(tp -> Partition.of(
            topic,
            tp.partition(),
            offsetOf(oldest, tp, "oldest"),
            offsetOf(newest, tp, "newest")
        ))
        .toList();
    log.debug("Topic {} has {} partitions", topic, mapped.size());
    return mapped;
  }

  @Override
  public void close() {
    adminClient.close(DEFAULT_TIMEOUT);
  }

  private Map<TopicPartition, ListOffsetsResultInfo> listOffsets(List<TopicPartition> partitions,
                                                                 OffsetSpec spec,
                                                                 String operation) {
    Map<TopicPartition, OffsetSpec> request = new HashMap<>();
    for (TopicPartition tp : partitions) {
      request.put(tp, spec);
    }
    ListOffsetsOptions options = new ListOffsetsOptions().timeoutMs(timeoutMs());
    return await(
        adminClient.listOffsets(request, options).all(),
        operation,
        Map.of("topic", partitions.get(0).topic(), "partitions", partitions.size())
    );
  }

  private long offsetOf(Map<TopicPartition, ListOffsetsResultInfo> offsets, TopicPartition tp, String which) {
    ListOffsetsResultInfo info = offsets.get(tp);
    if (info == null) {
      throw Problems.metadataUnavailable(
          "Missing " + which + " offset",
          Map.of("topic", tp.topic(), "partition", tp.partition()),
          null
      );
    }
    return info.offset();
  }

  private <T> T await(KafkaFuture<T> future, String operation, Map<String, Object> context) {
    try {
      return future.get(DEFAULT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw Problems.operationFailed("Interrupted while executing " + operation, context);
    } catch (TimeoutException ex) {
      throw Problems.metadataUnavailable(
          "Timed out contacting Kafka during " + operation,
          mergeContext(context, "TimeoutException", ex.getMessage()),
          ex
      );
    } catch (ExecutionException ex) {
      throw translate(operation, ex.getCause(), context);
    }
  }

  private ProblemException translate(String operation, Throwable cause, Map<String, Object> context) {
    if (cause instanceof UnknownTopicOrPartitionException) {
      return Problems.notFound(
          "Kafka topic not found during " + operation,
          mergeContext(context, cause.getClass().getSimpleName(), cause.getMessage())
      );
    }
    if (cause instanceof KafkaException) {
      return Problems.metadataUnavailable(
          "Kafka operation failed: " + operation,
          mergeContext(context, cause.getClass().getSimpleName(), cause.getMessage()),
          cause
      );
    }
    return Problems.metadataUnavailable(
        "Unexpected failure during " + operation,
        mergeContext(context, cause.getClass().getSimpleName(), cause.getMessage()),
        cause
    );
  }

  private Map<String, Object> mergeContext(Map<String, Object> base, String error, String message) {
    Map<String, Object> merged = new HashMap<>(base);
    merged.put("bootstrapServers", bootstrapServers);
    merged.put("error", error);
    if (message != null) {
      merged.put("message", message);
    }
    return Collections.unmodifiableMap(merged);
  }

  private static int timeoutMs() {
    return Math.toIntExact(DEFAULT_TIMEOUT.toMillis());
  }
}
