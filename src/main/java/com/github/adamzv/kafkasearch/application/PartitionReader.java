package com.github.adamzv.kafkasearch.application;

import com.github.adamzv.kafkasearch.domain.DecodeErrorPolicy;
import com.github.adamzv.kafkasearch.domain.Message;
import com.github.adamzv.kafkasearch.domain.Partition;
import com.github.adamzv.kafkasearch.domain.Problems;
import com.github.adamzv.kafkasearch.domain.RawRecord;
import com.github.adamzv.kafkasearch.ports.PartitionStream;
import com.github.adamzv.kafkasearch.ports.PartitionStreamFactory;
import com.github.adamzv.kafkasearch.ports.PayloadDecoder;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads one partition forward from its cursor. Never yields a record below the cursor or at
 * or beyond the partition end captured in the {@link Partition} snapshot.
 *
 * <p>Each poll waits at most the configured timeout. An empty poll ends the read only when the
 * stream position has reached the partition end, which happens when the trailing offsets are
 * transaction markers. Otherwise the reader polls again unless the {@link StopSignal} has been
 * raised in the meantime.
 */
public class PartitionReader implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(PartitionReader.class);

  public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofSeconds(1);

  private final Partition partition;
  private final PartitionStream stream;
  private final PayloadDecoder decoder;
  private final Duration pollTimeout;
  private final StopSignal stopSignal;

  private PartitionReader(Partition partition,
                          PartitionStream stream,
                          PayloadDecoder decoder,
                          Duration pollTimeout,
                          StopSignal stopSignal) {
    this.partition = partition;
    this.stream = stream;
    this.decoder = decoder;
    this.pollTimeout = pollTimeout;
    this.stopSignal = stopSignal;
  }

  public static PartitionReader open(PartitionStreamFactory streams,
                                     Partition partition,
                                     PayloadDecoder decoder,
                                     Duration pollTimeout,
                                     StopSignal stopSignal) {
    PartitionStream stream = streams.open(partition.topic(), partition.partition(), partition.offset());
    return new PartitionReader(partition, stream, decoder, pollTimeout, stopSignal);
  }

  public Partition partition() {
    return partition;
  }

  /**
   * Collects up to {@code count} messages whose raw payload satisfies {@code predicate}.
   * Matching payloads are decoded; a decoder failure aborts the read.
   */
  public List<Message> readUntil(int count, Predicate<byte[]> predicate) {
    List<Message> out = new ArrayList<>();
    if (count <= 0 || partition.isExhausted()) {
      return out;
    }

    while (out.size() < count) {
      Optional<RawRecord> next = next();
      if (next.isEmpty()) {
        break;
      }
      RawRecord record = next.get();
      if (record.offset() >= partition.end()) {
        break;
      }
      if (record.offset() >= partition.offset() && predicate.test(record.value())) {
        byte[] value = decode(record, DecodeErrorPolicy.ABORT).orElseThrow();
        out.add(new Message(partition.withOffset(record.offset()), value, record.offset()));
      }
      if (isLast(record)) {
        break;
      }
    }
    return out;
  }

  /**
   * Hands records to {@code visitor} until it asks to stop, {@code maxCount} records have been
   * visited, the partition end is reached or the stop signal is raised.
   *
   * @return number of records visited
   */
  public long scan(long maxCount, RecordVisitor visitor) {
    long limit = Math.min(maxCount, partition.remaining());
    long visited = 0;
    while (visited < limit) {
      Optional<RawRecord> next = next();
      if (next.isEmpty()) {
        break;
      }
      RawRecord record = next.get();
      if (record.offset() >= partition.end()) {
        break;
      }
      if (record.offset() < partition.offset()) {
        continue;
      }
      visited++;
      if (visitor.visit(record) || isLast(record)) {
        break;
      }
    }
    return visited;
  }

  /**
   * Decodes a record payload. With {@link DecodeErrorPolicy#STOP_SILENTLY} a failure yields an
   * empty result, which callers treat as the end of the read.
   */
  public Optional<byte[]> decode(RawRecord record, DecodeErrorPolicy policy) {
    try {
      byte[] decoded = decoder.decode(partition.topic(), record.value());
      return Optional.of(decoded == null ? new byte[0] : decoded);
    } catch (IOException | RuntimeException ex) {
      if (policy == DecodeErrorPolicy.STOP_SILENTLY) {
        log.debug(
            "decode_failed_stop topic={} partition={} offset={} error={}",
            partition.topic(),
            partition.partition(),
            record.offset(),
            ex.toString()
        );
        return Optional.empty();
      }
      throw Problems.decodeFailed(
          "Payload decoder failed",
          Map.of("topic", partition.topic(), "partition", partition.partition(), "offset", record.offset()),
          ex
      );
    }
  }

  @Override
  public void close() {
    stream.close();
  }

  private Optional<RawRecord> next() {
    while (!stopSignal.isRaised()) {
      Optional<RawRecord> record = stream.poll(pollTimeout);
      if (record.isPresent()) {
        return record;
      }
      long position = stream.position();
      if (position >= partition.end()) {
        log.debug(
            "partition_end_without_record topic={} partition={} position={} end={}",
            partition.topic(),
            partition.partition(),
            position,
            partition.end()
        );
        return Optional.empty();
      }
      log.trace("poll_idle topic={} partition={} position={}", partition.topic(), partition.partition(), position);
    }
    return Optional.empty();
  }

  private boolean isLast(RawRecord record) {
    return record.offset() >= partition.end() - 1;
  }
}
