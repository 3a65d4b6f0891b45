package org.ohnlp.cdm.timeline.concurrent;

import org.apache.beam.sdk.values.Row;
import org.ohnlp.cdm.timeline.exceptions.TimelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Fans rows out to one unit of work per partition key on a fixed thread pool and waits for all of them before
 * returning. Units must not share mutable state; merging their outputs is left to the caller.
 */
public class PersonPartitionExecutor implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(PersonPartitionExecutor.class);

    private final ExecutorService executorService;
    private final boolean tolerateFailures;

    public PersonPartitionExecutor(int threads, boolean tolerateFailures) {
        this.executorService = Executors.newFixedThreadPool(Math.max(1, threads));
        this.tolerateFailures = tolerateFailures;
        LOG.debug("Partition executor started with {} threads", Math.max(1, threads));
    }

    /**
     * Runs {@code unit} once per distinct value of {@code keyColumn}.
     * @param stage Name of the stage for logging and failure reports, usually the table name
     * @param rows Rows sorted by {@code keyColumn}
     * @param keyColumn Partition column, e.g. person_id
     * @param unit Work applied to each partition's rows, in their original order
     * @return per-key outputs in partition order plus any failures, when failures are tolerated
     * @throws TimelineException the first unit failure, when failures are not tolerated
     */
    public <T> PartitionResult<T> run(String stage, List<Row> rows, String keyColumn, Function<List<Row>, T> unit) {
        Map<String, List<Row>> partitions = partition(rows, keyColumn);
        Map<String, CompletableFuture<T>> futures = new LinkedHashMap<>();
        partitions.forEach((key, group) ->
                futures.put(key, CompletableFuture.supplyAsync(() -> unit.apply(group), executorService)));

        // Barrier: every unit completes, successfully or not, before results are merged
        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0]))
                .exceptionally(t -> null)
                .join();

        Map<String, T> results = new LinkedHashMap<>();
        List<UnitFailure> failures = new ArrayList<>();
        futures.forEach((key, future) -> {
            try {
                results.put(key, future.join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                LOG.warn("{}: unit for {} failed: {}", stage, key, cause.getMessage());
                failures.add(new UnitFailure(stage, key, cause));
            }
        });
        if (!failures.isEmpty()) {
            if (!tolerateFailures) {
                LOG.error("{}: {} of {} units failed", stage, failures.size(), partitions.size());
                Throwable first = failures.get(0).getCause();
                if (first instanceof TimelineException) {
                    throw (TimelineException) first;
                }
                throw new TimelineException(stage + ": unit for " + failures.get(0).getPersonId() + " failed", first);
            }
            LOG.warn("{}: skipped {} of {} units after failures", stage, failures.size(), partitions.size());
        }
        return new PartitionResult<>(results, failures);
    }

    /**
     * Groups rows by the value of a column, keeping first-seen key order and row order within each group.
     */
    public static Map<String, List<Row>> partition(List<Row> rows, String keyColumn) {
        Map<String, List<Row>> ret = new LinkedHashMap<>();
        for (Row row : rows) {
            ret.computeIfAbsent(row.getString(keyColumn), k -> new ArrayList<>()).add(row);
        }
        return ret;
    }

    @Override
    public void close() {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(30, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
