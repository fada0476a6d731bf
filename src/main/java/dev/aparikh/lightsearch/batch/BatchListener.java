package dev.aparikh.lightsearch.batch;

/**
 * Observes the progress of batch insertions.
 */
@FunctionalInterface
public interface BatchListener {

    BatchListener NONE = processed -> { };

    /**
     * Called each time a batch insertion hands control back to the host executor.
     *
     * @param processed number of documents inserted so far by this batch
     */
    void onYield(int processed);
}
