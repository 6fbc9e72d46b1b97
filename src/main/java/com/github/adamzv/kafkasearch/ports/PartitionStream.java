package com.github.adamzv.kafkasearch.ports;

import com.github.adamzv.kafkasearch.domain.ProblemException;
import com.github.adamzv.kafkasearch.domain.RawRecord;
import java.time.Duration;
import java.util.Optional;

/**
 * Offset-ordered records of a single partition.
 */
public interface PartitionStream extends AutoCloseable {

  /**
   * Waits at most {@code timeout} for the next record. An empty result only means nothing
   * arrived in time, not that the partition is exhausted.
   */
  Optional<RawRecord> poll(Duration timeout) throws ProblemException;

  /**
   * Offset of the next record the stream would fetch. Moves past offsets that never surface
   * as records, such as transaction markers.
   */
  long position() throws ProblemException;

  @Override
  void close();
}
