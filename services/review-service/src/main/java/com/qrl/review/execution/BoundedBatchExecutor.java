package com.qrl.review.execution;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

/**
 * Runs items in fixed-size batches. Items inside a batch run concurrently on
 * the executor; the next batch starts only after the whole batch finished and
 * the gate let it through.
 *
 * <p>Tasks are expected to handle their own failures. An exception escaping a
 * task does not stop its batch siblings but fails the run once the batch completes.
 */
public class BoundedBatchExecutor {
    private final ExecutorService executor;

    public BoundedBatchExecutor(ExecutorService executor) {
        this.executor = executor;
    }

    public <T> int runBatches(List<T> items, int batchSize, FixedIntervalGate gate, Consumer<T> task)
        throws InterruptedException {
        int size = Math.max(1, batchSize);
        int batches = 0;
        for (int start = 0; start < items.size(); start += size) {
            gate.acquire();
            List<T> batch = items.subList(start, Math.min(items.size(), start + size));
            List<CompletableFuture<Void>> futures = new ArrayList<>(batch.size());
            for (T item : batch) {
                futures.add(CompletableFuture.runAsync(() -> task.accept(item), executor));
            }
            try {
                CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get();
            } catch (ExecutionException e) {
                throw new IllegalStateException("batch task failed", e.getCause());
            }
            batches++;
        }
        return batches;
    }
}
