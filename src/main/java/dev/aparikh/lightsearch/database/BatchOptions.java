package dev.aparikh.lightsearch.database;

import dev.aparikh.lightsearch.identity.InsertConfig;
import org.jspecify.annotations.Nullable;

/**
 * Options for {@link SearchDatabase#insertBatch(java.util.List, BatchOptions)}.
 *
 * @param batchSize    insertions performed before yielding; {@code null} uses the database default
 * @param insertConfig identifier options applied to every document of the batch
 */
public record BatchOptions(
        @Nullable Integer batchSize,
        InsertConfig insertConfig
) {

    public BatchOptions {
        if (insertConfig == null) {
            insertConfig = InsertConfig.defaults();
        }
    }

    public static BatchOptions defaults() {
        return new BatchOptions(null, InsertConfig.defaults());
    }

    public static BatchOptions ofBatchSize(int batchSize) {
        return new BatchOptions(batchSize, InsertConfig.defaults());
    }
}
