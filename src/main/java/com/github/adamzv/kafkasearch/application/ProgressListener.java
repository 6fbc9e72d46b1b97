package com.github.adamzv.kafkasearch.application;

@FunctionalInterface
public interface ProgressListener {

  ProgressListener NONE = (current, total) -> {
  };

  void onProgress(long current, long total);
}
