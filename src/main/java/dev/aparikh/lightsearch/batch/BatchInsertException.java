package dev.aparikh.lightsearch.batch;

import dev.aparikh.lightsearch.LightSearchException;

import java.util.List;

/**
 * Reports the first document of a batch that could not be inserted.
 *
 * <p>Documents before the failing position remain committed and their identifiers are
 * available from {@link #getInsertedIds()}. Documents after it were not attempted.
 * The underlying error is the {@linkplain #getCause() cause}.</p>
 */
public class BatchInsertException extends LightSearchException {

    private final int position;
    private final List<String> insertedIds;

    public BatchInsertException(int position, List<String> insertedIds, Throwable cause) {
        super("Batch insertion failed at document " + position + " after " + insertedIds.size()
                + " inserted: " + cause.getMessage(), cause);
        this.position = position;
        this.insertedIds = List.copyOf(insertedIds);
    }

    /**
     * Zero-based position of the failing document in the input sequence.
     */
    public int getPosition() {
        return position;
    }

    public List<String> getInsertedIds() {
        return insertedIds;
    }
}
