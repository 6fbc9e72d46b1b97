package com.github.adamzv.kafkasearch.application;

import com.github.adamzv.kafkasearch.domain.DecodeErrorPolicy;
import com.github.adamzv.kafkasearch.domain.Message;
import com.github.adamzv.kafkasearch.domain.Partition;
import com.github.adamzv.kafkasearch.ports.PartitionStreamFactory;
import com.github.adamzv.kafkasearch.ports.PayloadDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Sequential operations over a single partition. Every call opens its own stream and closes it
 * before returning.
 */
public class PartitionScanner {

  public static final long NOT_FOUND = -1L;

  private final PartitionStreamFactory streams;
  private final PayloadDecoder decoder;
  private final Duration pollTimeout;

  public PartitionScanner(PartitionStreamFactory streams, PayloadDecoder decoder, Duration pollTimeout) {
    this.streams = streams;
    this.decoder = decoder;
    this.pollTimeout = pollTimeout;
  }

  /**
   * Scans forward from the partition cursor for the first decoded payload containing
   * {@code needle}.
   *
   * @return offset of the first match, or {@link #NOT_FOUND} when the partition is exhausted
   *     or {@code stop} is raised first
   */
  public long search(Partition partition, String needle, StopSignal stop, ProgressListener progress) {
    if (partition.isExhausted() || stop.isRaised()) {
      return NOT_FOUND;
    }
    byte[] target = needle.getBytes(StandardCharsets.UTF_8);
    SearchCursor cursor = new SearchCursor();

    try (PartitionReader reader = open(partition, stop)) {
      reader.scan(partition.remaining(), record -> {
        progress.onProgress(cursor.index, partition.end());
        byte[] decoded = reader.decode(record, DecodeErrorPolicy.ABORT).orElseThrow();
        if (ByteSearch.contains(decoded, target)) {
          cursor.match = record.offset();
          return true;
        }
        cursor.index++;
        return stop.isRaised();
      });
    }
    return cursor.match;
  }

  /**
   * Delivers decoded payloads, up to {@code maxCount} of them or until the partition end.
   *
   * @return number of payloads delivered
   */
  public long fetch(Partition partition,
                    long maxCount,
                    Consumer<String> consumer,
                    DecodeErrorPolicy policy,
                    StopSignal stop) {
    if (partition.isExhausted() || maxCount <= 0) {
      return 0;
    }
    long[] delivered = {0};
    try (PartitionReader reader = open(partition, stop)) {
      reader.scan(maxCount, record -> {
        Optional<byte[]> decoded = reader.decode(record, policy);
        if (decoded.isEmpty()) {
          return true;
        }
        consumer.accept(new String(decoded.get(), StandardCharsets.UTF_8));
        delivered[0]++;
        return false;
      });
    }
    return delivered[0];
  }

  public List<Message> read(Partition partition, int count, Predicate<byte[]> predicate, StopSignal stop) {
    if (partition.isExhausted() || count <= 0) {
      return List.of();
    }
    try (PartitionReader reader = open(partition, stop)) {
      return reader.readUntil(count, predicate);
    }
  }

  private PartitionReader open(Partition partition, StopSignal stop) {
    return PartitionReader.open(streams, partition, decoder, pollTimeout, stop);
  }

  private static final class SearchCursor {
    private long index;
    private long match = NOT_FOUND;
  }
}
