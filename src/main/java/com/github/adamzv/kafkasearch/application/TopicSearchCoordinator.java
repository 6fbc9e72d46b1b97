package com.github.adamzv.kafkasearch.application;

import com.github.adamzv.kafkasearch.domain.Partition;
import com.github.adamzv.kafkasearch.domain.ProblemException;
import com.github.adamzv.kafkasearch.domain.Problems;
import com.github.adamzv.kafkasearch.domain.ResultOrdering;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@link PartitionScanner#search} over every partition of a topic on a bounded pool.
 *
 * <p>All workers of one call share a {@link StopSignal}. It is raised once enough matches were
 * collected (one in first-match mode, otherwise one per partition) or when a worker fails.
 * The coordinator always drains one result per partition, so every stream has been closed by
 * the time the call returns or throws.
 */
public class TopicSearchCoordinator {

  private static final Logger log = LoggerFactory.getLogger(TopicSearchCoordinator.class);

  private final PartitionScanner scanner;
  private final int concurrency;
  private final ResultOrdering ordering;

  public TopicSearchCoordinator(PartitionScanner scanner, int concurrency, ResultOrdering ordering) {
    if (concurrency <= 0) {
      throw new IllegalArgumentException("concurrency must be positive");
    }
    this.scanner = scanner;
    this.concurrency = concurrency;
    this.ordering = ordering;
  }

  /**
   * @return matching partitions with their cursor moved to the matching offset
   */
  public List<Partition> searchTopic(List<Partition> partitions,
                                     String needle,
                                     boolean firstOnly,
                                     ProgressListener progress) {
    if (partitions.isEmpty()) {
      return List.of();
    }

    int total = partitions.size();
    int target = firstOnly ? 1 : total;
    StopSignal stop = new StopSignal();
    ExecutorService workers = Executors.newFixedThreadPool(Math.min(concurrency, total), new WorkerThreadFactory());
    CompletionService<SearchResult> results = new ExecutorCompletionService<>(workers);

    try {
      for (Partition partition : partitions) {
        results.submit(() -> scan(partition, needle, stop));
      }

      List<Partition> matches = new ArrayList<>();
      ProblemException failure = null;
      for (int i = 0; i < total; i++) {
        SearchResult result = take(results, stop);
        progress.onProgress(i, total);

        if (failure != null) {
          continue;
        }
        if (result.error() != null) {
          failure = result.error();
          stop.raise();
          log.debug("search_worker_failed partition={} code={}", result.partition(), failure.code());
          continue;
        }
        if (result.found() && matches.size() < target) {
          matches.add(result.partition().withOffset(result.offset()));
          if (matches.size() == target) {
            stop.raise();
          }
        }
      }

      if (failure != null) {
        throw failure;
      }
      matches.sort(comparator());
      return List.copyOf(matches);
    } finally {
      workers.shutdownNow();
    }
  }

  private SearchResult scan(Partition partition, String needle, StopSignal stop) {
    if (stop.isRaised()) {
      return SearchResult.notFound(partition);
    }
    try {
      long offset = scanner.search(partition, needle, stop, ProgressListener.NONE);
      log.debug("search_worker_done topic={} partition={} offset={}", partition.topic(), partition.partition(), offset);
      return new SearchResult(partition, offset, null);
    } catch (ProblemException ex) {
      return SearchResult.failed(partition, ex);
    }
  }

  private SearchResult take(CompletionService<SearchResult> results, StopSignal stop) {
    try {
      return results.take().get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      stop.raise();
      throw Problems.operationFailed("Interrupted while waiting for search results", Map.of());
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      return SearchResult.failed(null, Problems.operationFailed(
          "Search worker failed",
          Map.of("error", cause.getClass().getSimpleName()),
          cause
      ));
    }
  }

  private Comparator<Partition> comparator() {
    if (ordering == ResultOrdering.PARTITION_INDEX) {
      return Comparator.comparingInt(Partition::partition);
    }
    return Comparator.comparing(Partition::toString);
  }

  private static final class WorkerThreadFactory implements ThreadFactory {

    private final ThreadFactory delegate = Executors.defaultThreadFactory();
    private final AtomicInteger sequence = new AtomicInteger();

    @Override
    public Thread newThread(Runnable runnable) {
      Thread thread = delegate.newThread(runnable);
      thread.setName("kafka-search-worker-" + sequence.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
