package org.carball.lca.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.lca.model.product.ProductSpecification;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Runs the engine over many products one after another. {@link #cancel()} is honoured
 * between products; a calculation already under way always completes. A cancel requested
 * while no batch is running stops the next batch before its first product.
 */
@Slf4j
public class BatchCalculator {

    private final LCAEngine engine;
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private volatile boolean lastRunCancelled;

    public BatchCalculator(LCAEngine engine) {
        this.engine = engine;
    }

    /**
     * @return one entry per product processed, in input order; shorter than the input if cancelled
     */
    public List<BatchItemResult> run(List<ProductSpecification> specs) {
        return run(specs, item -> { });
    }

    /**
     * @param onItem called after each product, on the calling thread
     */
    public List<BatchItemResult> run(List<ProductSpecification> specs, Consumer<BatchItemResult> onItem) {
        List<BatchItemResult> results = new ArrayList<>();
        boolean stopped = false;
        log.info("Starting batch of {} products", specs.size());

        try {
            for (ProductSpecification spec : specs) {
                if (cancelRequested.get()) {
                    log.warn("Batch cancelled after {} of {} products", results.size(), specs.size());
                    stopped = true;
                    break;
                }
                BatchItemResult item;
                try {
                    item = BatchItemResult.success(engine.calculate(spec));
                } catch (IllegalArgumentException e) {
                    String productId = spec == null ? null : spec.productId();
                    log.error("Skipping product '{}': {}", productId, e.getMessage());
                    item = BatchItemResult.failure(productId, e.getMessage());
                }
                results.add(item);
                onItem.accept(item);
            }
        } finally {
            // the request belonged to this batch
            cancelRequested.set(false);
            lastRunCancelled = stopped;
        }

        log.info("Batch finished: {} products processed", results.size());
        return results;
    }

    public void cancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    /**
     * @return whether the most recent {@link #run} stopped before reaching the end of its input
     */
    public boolean wasLastRunCancelled() {
        return lastRunCancelled;
    }
}
