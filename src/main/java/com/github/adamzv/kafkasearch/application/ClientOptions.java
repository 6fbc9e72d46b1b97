package com.github.adamzv.kafkasearch.application;

import com.github.adamzv.kafkasearch.domain.DecodeErrorPolicy;
import com.github.adamzv.kafkasearch.domain.ResultOrdering;
import com.github.adamzv.kafkasearch.security.ConnectionSettings;
import java.time.Duration;

public record ClientOptions(
    int concurrency,
    Duration pollTimeout,
    ResultOrdering resultOrdering,
    DecodeErrorPolicy fetchDecodeErrorPolicy
) {

  public ClientOptions {
    if (concurrency <= 0) {
      throw new IllegalArgumentException("concurrency must be positive");
    }
    if (pollTimeout == null || pollTimeout.isNegative() || pollTimeout.isZero()) {
      throw new IllegalArgumentException("pollTimeout must be positive");
    }
    resultOrdering = resultOrdering == null ? ResultOrdering.SERIALIZED_FORM : resultOrdering;
    fetchDecodeErrorPolicy = fetchDecodeErrorPolicy == null ? DecodeErrorPolicy.STOP_SILENTLY : fetchDecodeErrorPolicy;
  }

  public static ClientOptions defaults() {
    return new ClientOptions(
        ConnectionSettings.DEFAULT_CONCURRENCY,
        PartitionReader.DEFAULT_POLL_TIMEOUT,
        ResultOrdering.SERIALIZED_FORM,
        DecodeErrorPolicy.STOP_SILENTLY
    );
  }

  public ClientOptions withConcurrency(int newConcurrency) {
    return new ClientOptions(newConcurrency, pollTimeout, resultOrdering, fetchDecodeErrorPolicy);
  }

  public ClientOptions withPollTimeout(Duration newPollTimeout) {
    return new ClientOptions(concurrency, newPollTimeout, resultOrdering, fetchDecodeErrorPolicy);
  }

  public ClientOptions withResultOrdering(ResultOrdering newOrdering) {
    return new ClientOptions(concurrency, pollTimeout, newOrdering, fetchDecodeErrorPolicy);
  }

  public ClientOptions withFetchDecodeErrorPolicy(DecodeErrorPolicy newPolicy) {
    return new ClientOptions(concurrency, pollTimeout, resultOrdering, newPolicy);
  }
}
