package org.replaysafe.datapipeline.services.pipeline.components;

import org.replaysafe.datapipeline.api.contracts.FingerprintedEvent;
import org.replaysafe.datapipeline.api.resources.log.LogRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns a chunk of log records into a deduplicated list of fingerprinted events.
 * <p>
 * Parsing, key derivation and a first dedup pass run per partition on a worker pool. The
 * per-partition results are concatenated in partition order and deduplicated once more, which
 * makes the outcome independent of {@code parallelism}: the arrival order that decides every
 * tie is (partition, offset), not the order in which workers finish.
 */
public class WindowProcessor implements AutoCloseable {

    /**
     * Called for every record that fails validation. May be invoked from worker threads.
     */
    @FunctionalInterface
    public interface InvalidRecordListener {
        void onInvalid(LogRecord record, MissingFieldException cause);
    }

    /**
     * @param unique            One event per dedup key, in arrival order.
     * @param recordCount       Records in the chunk.
     * @param skippedInvalid    Records that failed validation.
     * @param duplicatesInBatch Valid records dropped as duplicates.
     */
    public record ProcessedWindow(List<FingerprintedEvent> unique, int recordCount, int skippedInvalid, int duplicatesInBatch) {
    }

    private record PartitionResult(List<FingerprintedEvent> unique, int skipped) {
    }

    private final EventSchema schema;
    private final KeyDeriver keyDeriver;
    private final BatchDeduplicator deduplicator;
    private final InvalidRecordListener invalidRecordListener;
    private final ExecutorService workers;

    /**
     * @param parallelism Worker threads; 1 processes on the calling thread.
     */
    public WindowProcessor(EventSchema schema, KeyDeriver keyDeriver, BatchDeduplicator deduplicator,
                           int parallelism, String threadNamePrefix, InvalidRecordListener invalidRecordListener) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive, got: " + parallelism);
        }
        this.schema = schema;
        this.keyDeriver = keyDeriver;
        this.deduplicator = deduplicator;
        this.invalidRecordListener = invalidRecordListener;
        if (parallelism == 1) {
            this.workers = null;
        } else {
            AtomicInteger threadIndex = new AtomicInteger();
            this.workers = Executors.newFixedThreadPool(parallelism, r -> {
                Thread t = new Thread(r, threadNamePrefix + "-" + threadIndex.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        }
    }

    /**
     * @throws BatchTooLargeException if the chunk exceeds the deduplicator's limit.
     * @throws InterruptedException   if interrupted while waiting for the workers.
     */
    public ProcessedWindow process(List<LogRecord> records) throws BatchTooLargeException, InterruptedException {
        deduplicator.checkSize(records.size());

        Map<Integer, List<LogRecord>> byPartition = new TreeMap<>();
        for (LogRecord record : records) {
            byPartition.computeIfAbsent(record.partition(), p -> new ArrayList<>()).add(record);
        }

        List<PartitionResult> results = new ArrayList<>(byPartition.size());
        if (workers == null || byPartition.size() <= 1) {
            for (List<LogRecord> partitionRecords : byPartition.values()) {
                results.add(processPartition(partitionRecords));
            }
        } else {
            List<Future<PartitionResult>> futures = new ArrayList<>(byPartition.size());
            for (List<LogRecord> partitionRecords : byPartition.values()) {
                futures.add(workers.submit(() -> processPartition(partitionRecords)));
            }
            try {
                for (Future<PartitionResult> future : futures) {
                    results.add(future.get());
                }
            } catch (ExecutionException e) {
                futures.forEach(f -> f.cancel(true));
                Throwable cause = e.getCause();
                if (cause instanceof BatchTooLargeException tooLarge) {
                    throw tooLarge;
                }
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                if (cause instanceof Error error) {
                    throw error;
                }
                throw new IllegalStateException("Partition worker failed", cause);
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                throw e;
            }
        }

        List<FingerprintedEvent> concatenated = new ArrayList<>();
        int skipped = 0;
        for (PartitionResult result : results) {
            concatenated.addAll(result.unique());
            skipped += result.skipped();
        }
        DedupResult merged = deduplicator.dedupe(concatenated);
        int duplicates = records.size() - skipped - merged.unique().size();
        return new ProcessedWindow(merged.unique(), records.size(), skipped, duplicates);
    }

    private PartitionResult processPartition(List<LogRecord> records) throws BatchTooLargeException {
        List<FingerprintedEvent> fingerprinted = new ArrayList<>(records.size());
        int skipped = 0;
        for (LogRecord record : records) {
            try {
                fingerprinted.add(keyDeriver.fingerprint(schema.parse(record)));
            } catch (MissingFieldException e) {
                skipped++;
                invalidRecordListener.onInvalid(record, e);
            }
        }
        return new PartitionResult(deduplicator.dedupe(fingerprinted).unique(), skipped);
    }

    @Override
    public void close() {
        if (workers != null) {
            workers.shutdownNow();
            try {
                workers.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
