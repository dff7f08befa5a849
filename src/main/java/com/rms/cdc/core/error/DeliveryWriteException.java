package com.rms.cdc.core.error;

/**
 * A delivery write (bulk insert of delivery records, or a keyed upsert) was
 * not accepted by the store.
 *
 * <p>Recoverable: the caller retries the whole batch and must not advance its
 * replication position until a retry succeeds.</p>
 */
public class DeliveryWriteException extends RuntimeException {

    private final int batchSize;

    public DeliveryWriteException(String message, int batchSize, Throwable cause) {
        super(message, cause);
        this.batchSize = batchSize;
    }

    /** Number of changes in the batch that failed. */
    public int getBatchSize() {
        return batchSize;
    }
}
