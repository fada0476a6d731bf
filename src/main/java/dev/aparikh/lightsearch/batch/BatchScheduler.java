package dev.aparikh.lightsearch.batch;

import dev.aparikh.lightsearch.InvalidConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs a single-item insertion over a sequence, handing control back to the host
 * executor after every {@code batchSize} insertions.
 *
 * <p>The first slice runs on the calling thread. Whenever {@code batchSize} insertions have
 * been performed and items remain, the rest of the batch is submitted to the executor as a
 * new task, so work already queued there runs before the batch resumes. Between two yields
 * all insertions run synchronously.</p>
 *
 * <p><strong>Partial commit:</strong> a batch is not atomic. When an item fails, the
 * returned future completes with a {@link BatchInsertException} that carries the failing
 * position; items inserted before it stay committed and later items are not attempted.
 * Cancelling the future stops the batch at its next yield point, again keeping what was
 * already inserted. Any failure, {@link Error}s included, completes the future; it never
 * stays pending.</p>
 *
 * <p>The executor may run tasks on its own threads or inline on the submitting thread;
 * inline execution does not deepen the stack per slice.</p>
 *
 * @author Aditya Parikh
 * @since 1.0.0
 */
public class BatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(BatchScheduler.class);

    public static final int DEFAULT_BATCH_SIZE = 1000;

    private final Executor executor;
    private final BatchListener listener;

    public BatchScheduler(Executor executor) {
        this(executor, BatchListener.NONE);
    }

    public BatchScheduler(Executor executor, BatchListener listener) {
        this.executor = executor;
        this.listener = listener;
    }

    /**
     * Starts a batch.
     *
     * @param items     the items to insert, in order
     * @param insertion inserts one item and returns its identifier
     * @param batchSize insertions performed between two yields
     * @param <T>       item type
     * @return future of the identifiers, in input order
     * @throws InvalidConfigException if {@code batchSize} is not positive
     */
    public <T> CompletableFuture<List<String>> schedule(List<? extends T> items,
                                                        Function<? super T, String> insertion,
                                                        int batchSize) {
        if (batchSize <= 0) {
            throw new InvalidConfigException("batchSize must be positive, got: " + batchSize);
        }
        log.debug("Starting batch of {} item(s) with batchSize={}", items.size(), batchSize);

        BatchRun<T> run = new BatchRun<>(List.copyOf(items), insertion, batchSize);
        run.resume();
        return run.result;
    }

    /**
     * Progress of one batch: the next position and the identifiers collected so far.
     *
     * <p>At most one slice runs at a time. A continuation that the executor runs while a
     * slice is still on the stack, for example with an inline executor, is counted and
     * picked up by the running loop instead of recursing.</p>
     */
    private final class BatchRun<T> {
        private final List<T> items;
        private final Function<? super T, String> insertion;
        private final int batchSize;
        private final List<String> ids;
        private final CompletableFuture<List<String>> result = new CompletableFuture<>();
        private final AtomicInteger pendingSlices = new AtomicInteger();
        private int position;

        BatchRun(List<T> items, Function<? super T, String> insertion, int batchSize) {
            this.items = items;
            this.insertion = insertion;
            this.batchSize = batchSize;
            this.ids = new ArrayList<>(items.size());
        }

        void resume() {
            if (pendingSlices.getAndIncrement() > 0) {
                return;
            }
            do {
                try {
                    runSlice();
                } catch (Throwable t) {
                    log.warn("Batch failed at item {} of {}: {}", position, items.size(), t.toString());
                    result.completeExceptionally(new BatchInsertException(position, ids, t));
                }
            } while (pendingSlices.decrementAndGet() > 0);
        }

        private void runSlice() {
            if (result.isDone()) {
                log.info("Batch stopped at item {} of {}, {} item(s) stay committed",
                        position, items.size(), ids.size());
                return;
            }

            int sinceYield = 0;
            while (position < items.size()) {
                if (sinceYield == batchSize) {
                    yieldToExecutor();
                    return;
                }
                ids.add(insertion.apply(items.get(position)));
                position++;
                sinceYield++;
            }

            log.info("Batch inserted {} item(s)", ids.size());
            result.complete(Collections.unmodifiableList(ids));
        }

        private void yieldToExecutor() {
            listener.onYield(position);
            try {
                executor.execute(this::resume);
            } catch (RejectedExecutionException e) {
                log.warn("Executor rejected batch continuation at item {}", position);
                result.completeExceptionally(new BatchInsertException(position, ids, e));
            }
        }
    }
}
