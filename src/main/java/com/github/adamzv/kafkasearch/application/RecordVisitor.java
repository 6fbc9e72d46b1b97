package com.github.adamzv.kafkasearch.application;

import com.github.adamzv.kafkasearch.domain.RawRecord;

@FunctionalInterface
public interface RecordVisitor {

  /**
   * @return {@code true} to end the scan after this record
   */
  boolean visit(RawRecord record);
}
