package com.github.adamzv.kafkasearch.application;

import com.github.adamzv.kafkasearch.domain.Partition;
import com.github.adamzv.kafkasearch.domain.ProblemException;

/**
 * Outcome of one partition search, handed from a worker to the coordinator.
 */
record SearchResult(
    Partition partition,
    long offset,
    ProblemException error
) {

  static SearchResult notFound(Partition partition) {
    return new SearchResult(partition, PartitionScanner.NOT_FOUND, null);
  }

  static SearchResult failed(Partition partition, ProblemException error) {
    return new SearchResult(partition, PartitionScanner.NOT_FOUND, error);
  }

  boolean found() {
    return error == null && offset > PartitionScanner.NOT_FOUND;
  }
}
