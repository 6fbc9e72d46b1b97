package com.github.adamzv.kafkasearch.application;

import com.github.adamzv.kafkasearch.domain.Message;
import com.github.adamzv.kafkasearch.domain.Partition;
import com.github.adamzv.kafkasearch.domain.Problem;
import com.github.adamzv.kafkasearch.domain.ProblemException;
import com.github.adamzv.kafkasearch.domain.Problems;
import com.github.adamzv.kafkasearch.ports.BrokerMetadataPort;
import com.github.adamzv.kafkasearch.ports.PartitionStreamFactory;
import com.github.adamzv.kafkasearch.ports.PayloadDecoder;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.ToLongFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for callers: topic metadata, range reads and substring search over one
 * partition or a whole topic.
 *
 * <p>Errors surface as {@link ProblemException}; callers are expected to show them as-is.
 */
public class KafkaSearchClient implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(KafkaSearchClient.class);

  private final BrokerMetadataPort metadata;
  private final PartitionScanner scanner;
  private final TopicSearchCoordinator coordinator;
  private final ClientOptions options;
  private final MeterRegistry meterRegistry;

  public KafkaSearchClient(BrokerMetadataPort metadata,
                           PartitionStreamFactory streams,
                           PayloadDecoder decoder,
                           ClientOptions options,
                           MeterRegistry meterRegistry) {
    this.metadata = metadata;
    this.options = options;
    this.meterRegistry = meterRegistry;
    this.scanner = new PartitionScanner(streams, decoder == null ? PayloadDecoder.IDENTITY : decoder, options.pollTimeout());
    this.coordinator = new TopicSearchCoordinator(scanner, options.concurrency(), options.resultOrdering());
  }

  public ClientOptions options() {
    return options;
  }

  public List<String> listTopics() {
    return invoke(
        "listTopics",
        () -> metadata.listTopicNames().stream().sorted().toList(),
        List::size,
        Map.of()
    );
  }

  public List<Partition> describeTopic(String topic) {
    if (topic == null || topic.isBlank()) {
      throw Problems.invalidArgument("Topic name must be provided", Collections.singletonMap("topic", topic));
    }
    return invoke(
        "describeTopic",
        () -> metadata.describePartitions(topic),
        List::size,
        Map.of("topic", topic)
    );
  }

  /**
   * Reads forward from the partition cursor and returns up to {@code count} messages whose raw
   * payload satisfies {@code predicate}.
   */
  public List<Message> readRange(Partition partition, int count, Predicate<byte[]> predicate) {
    requirePartition(partition);
    if (count < 0) {
      throw Problems.invalidArgument("Count must not be negative", Map.of("count", count));
    }
    Predicate<byte[]> filter = predicate == null ? payload -> true : predicate;
    return invoke(
        "readRange",
        () -> scanner.read(partition, count, filter, new StopSignal()),
        List::size,
        contextOf(partition, "count", count)
    );
  }

  /**
   * @return offset of the first message containing {@code needle}, or
   *     {@link PartitionScanner#NOT_FOUND}
   */
  public long search(Partition partition, String needle, ProgressListener progress) {
    requirePartition(partition);
    requireNeedle(needle);
    ProgressListener listener = progress == null ? ProgressListener.NONE : progress;
    return invoke(
        "search",
        () -> scanner.search(partition, needle, new StopSignal(), listener),
        offset -> offset > PartitionScanner.NOT_FOUND ? 1 : 0,
        contextOf(partition, "needleLength", needle.length())
    );
  }

  /**
   * Searches every given partition concurrently. With {@code firstOnly} the search ends as soon
   * as one partition reports a match.
   */
  public List<Partition> searchTopic(List<Partition> partitions,
                                     String needle,
                                     boolean firstOnly,
                                     ProgressListener progress) {
    if (partitions == null) {
      throw Problems.invalidArgument("Partitions must be provided", Map.of());
    }
    requireNeedle(needle);
    ProgressListener listener = progress == null ? ProgressListener.NONE : progress;
    Map<String, Object> context = new LinkedHashMap<>();
    context.put("partitions", partitions.size());
    context.put("firstOnly", firstOnly);
    context.put("concurrency", options.concurrency());
    if (!partitions.isEmpty()) {
      context.put("topic", partitions.get(0).topic());
    }
    return invoke(
        "searchTopic",
        () -> coordinator.searchTopic(partitions, needle, firstOnly, listener),
        List::size,
        context
    );
  }

  /**
   * Streams decoded payloads to {@code consumer}, at most {@code end} of them.
   */
  public void fetch(Partition partition, long end, Consumer<String> consumer) {
    requirePartition(partition);
    if (consumer == null) {
      throw Problems.invalidArgument("Message consumer must be provided", Map.of());
    }
    invoke(
        "fetch",
        () -> scanner.fetch(partition, end, consumer, options.fetchDecodeErrorPolicy(), new StopSignal()),
        delivered -> delivered,
        contextOf(partition, "end", end)
    );
  }

  @Override
  public void close() {
    metadata.close();
  }

  private <T> T invoke(String operation,
                       Supplier<T> action,
                       ToLongFunction<T> counter,
                       Map<String, Object> context) {
    Instant start = Instant.now();
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      T result = action.get();
      long count = counter.applyAsLong(result);
      sample.stop(meterRegistry.timer("kafka_search_call_duration_seconds", "operation", operation));
      meterRegistry.counter("kafka_search_messages_out_total", "operation", operation).increment(count);
      log.info(
          "kafka_call outcome=success operation={} durationMs={} count={} context={}",
          operation,
          Duration.between(start, Instant.now()).toMillis(),
          count,
          context
      );
      return result;
    } catch (ProblemException ex) {
      sample.stop(meterRegistry.timer("kafka_search_call_duration_seconds", "operation", operation));
      Problem problem = ex.problem();
      if (problem != null) {
        meterRegistry.counter("kafka_search_call_errors_total", "operation", operation, "code", problem.code())
            .increment();
      }
      log.warn(
          "kafka_call outcome=error operation={} durationMs={} code={} message={} context={}",
          operation,
          Duration.between(start, Instant.now()).toMillis(),
          ex.code(),
          ex.getMessage(),
          context
      );
      throw ex;
    }
  }

  private static void requirePartition(Partition partition) {
    if (partition == null) {
      throw Problems.invalidArgument("Partition must be provided", Map.of());
    }
  }

  private static void requireNeedle(String needle) {
    if (needle == null) {
      throw Problems.invalidArgument("Search term must be provided", Map.of());
    }
  }

  private static Map<String, Object> contextOf(Partition partition, String key, Object value) {
    Map<String, Object> context = new LinkedHashMap<>();
    context.put("topic", partition.topic());
    context.put("partition", partition.partition());
    context.put("offset", partition.offset());
    context.put(key, value);
    return context;
  }
}
