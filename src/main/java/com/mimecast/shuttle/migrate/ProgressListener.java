package com.mimecast.shuttle.migrate;

/**
 * Batch boundary callback.
 *
 * <p>Invoked on the pipeline thread after every batch, must not block for long.
 */
@FunctionalInterface
public interface ProgressListener {

    /**
     * Listener that does nothing.
     */
    ProgressListener NONE = (mailbox, batchIndex, batchCount, processed, total) -> {
    };

    /**
     * Batch finished.
     *
     * @param mailbox    Source mailbox name.
     * @param batchIndex Finished batch, 1 based.
     * @param batchCount Number of batches.
     * @param processed  Messages processed so far.
     * @param total      Messages found by search.
     */
    void onBatch(String mailbox, int batchIndex, int batchCount, int processed, int total);
}
