package com.github.adamzv.kafkasearch.domain;

/**
 * Ordering applied to the partitions returned by a topic-wide search.
 */
public enum ResultOrdering {
  /** Lexicographic order of {@link Partition#toString()}. */
  SERIALIZED_FORM,
  /** Ascending partition index. */
  PARTITION_INDEX
}
