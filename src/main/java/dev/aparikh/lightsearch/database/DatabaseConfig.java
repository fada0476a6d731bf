package dev.aparikh.lightsearch.database;

import dev.aparikh.lightsearch.batch.BatchListener;
import dev.aparikh.lightsearch.batch.BatchScheduler;
import dev.aparikh.lightsearch.index.SimpleTokenizer;
import dev.aparikh.lightsearch.index.Tokenizer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Settings for {@link SearchDatabase#create(DatabaseConfig)}.
 *
 * @param schema        field name to declared type name ({@code string}, {@code number}, {@code boolean})
 * @param tokenizer     tokenizer for string fields (default: {@link SimpleTokenizer})
 * @param executor      host executor batch insertions yield to (default: the common pool)
 * @param batchSize     default number of insertions between two yields (default: 1000)
 * @param batchListener observer of batch yields (default: none)
 */
public record DatabaseConfig(
        Map<String, String> schema,
        Tokenizer tokenizer,
        Executor executor,
        int batchSize,
        BatchListener batchListener
) {

    public DatabaseConfig {
        schema = schema == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(schema));
        if (tokenizer == null) {
            tokenizer = new SimpleTokenizer();
        }
        if (executor == null) {
            executor = ForkJoinPool.commonPool();
        }
        if (batchSize <= 0) {
            batchSize = BatchScheduler.DEFAULT_BATCH_SIZE;
        }
        if (batchListener == null) {
            batchListener = BatchListener.NONE;
        }
    }

    public static DatabaseConfig withSchema(Map<String, String> schema) {
        return builder().schema(schema).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Map<String, String> schema = new LinkedHashMap<>();
        private Tokenizer tokenizer = new SimpleTokenizer();
        private Executor executor = ForkJoinPool.commonPool();
        private int batchSize = BatchScheduler.DEFAULT_BATCH_SIZE;
        private BatchListener batchListener = BatchListener.NONE;

        public Builder schema(Map<String, String> schema) {
            this.schema = new LinkedHashMap<>(schema);
            return this;
        }

        public Builder tokenizer(Tokenizer tokenizer) {
            this.tokenizer = tokenizer;
            return this;
        }

        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder batchListener(BatchListener batchListener) {
            this.batchListener = batchListener;
            return this;
        }

        public DatabaseConfig build() {
            return new DatabaseConfig(schema, tokenizer, executor, batchSize, batchListener);
        }
    }
}
