package dev.aparikh.lightsearch.config;

import dev.aparikh.lightsearch.batch.BatchScheduler;
import dev.aparikh.lightsearch.index.SimpleTokenizer;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalized settings bound from {@code light-search.*}.
 *
 * <pre>{@code
 * # application.properties
 * light-search.batch-size=1000
 * light-search.tokenizer.min-token-length=1
 * }</pre>
 *
 * <p>Missing or non-positive values fall back to the defaults.</p>
 *
 * @param batchSize default number of insertions between two yields of a batch
 * @param tokenizer settings of the default tokenizer
 */
@ConfigurationProperties(prefix = "light-search")
public record LightSearchProperties(
        int batchSize,
        TokenizerProperties tokenizer
) {

    public LightSearchProperties {
        if (batchSize <= 0) {
            batchSize = BatchScheduler.DEFAULT_BATCH_SIZE;
        }
        if (tokenizer == null) {
            tokenizer = new TokenizerProperties(SimpleTokenizer.DEFAULT_MIN_TOKEN_LENGTH);
        }
    }

    /**
     * @param minTokenLength shortest token kept by the tokenizer
     */
    public record TokenizerProperties(int minTokenLength) {

        public TokenizerProperties {
            if (minTokenLength <= 0) {
                minTokenLength = SimpleTokenizer.DEFAULT_MIN_TOKEN_LENGTH;
            }
        }
    }
}
