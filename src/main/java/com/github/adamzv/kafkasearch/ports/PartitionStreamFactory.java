package com.github.adamzv.kafkasearch.ports;

import com.github.adamzv.kafkasearch.domain.ProblemException;

@FunctionalInterface
public interface PartitionStreamFactory {

  /**
   * Opens a dedicated stream positioned at {@code offset}. The caller owns the stream and
   * must close it.
   *
   * @throws ProblemException with code {@code CONNECT_FAILED} when the stream cannot be set up
   */
  PartitionStream open(String topic, int partition, long offset) throws ProblemException;
}
