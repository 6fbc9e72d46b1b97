package com.github.adamzv.kafkasearch.ports;

import com.github.adamzv.kafkasearch.domain.Partition;
import com.github.adamzv.kafkasearch.domain.ProblemException;
import java.util.List;
import java.util.Set;

public interface BrokerMetadataPort extends AutoCloseable {

  Set<String> listTopicNames() throws ProblemException;

  /**
   * Returns every partition of the topic with its current oldest and newest offsets,
   * ordered by partition index. The cursor of each partition is positioned at its start.
   */
  List<Partition> describePartitions(String topic) throws ProblemException;

  @Override
  void close();
}
