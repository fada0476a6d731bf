package dev.aparikh.lightsearch.config;

import dev.aparikh.lightsearch.index.SimpleTokenizer;
import dev.aparikh.lightsearch.index.Tokenizer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Spring configuration for the indexing core.
 *
 * <p>Publishes:
 * <ul>
 *   <li><strong>Tokenizer</strong>: a {@link SimpleTokenizer} unless the application defines its own</li>
 *   <li><strong>Indexing executor</strong>: a single-threaded executor that batch insertions
 *       yield to; every slice after the first runs on the {@code light-search-indexer} thread,
 *       while single insertions and the first slice run on the caller's thread</li>
 *   <li><strong>SearchDatabaseFactory</strong>: creates databases wired with the above</li>
 * </ul>
 *
 * @see LightSearchProperties
 */
@Configuration
@EnableConfigurationProperties(LightSearchProperties.class)
public class LightSearchConfig {

    public static final String INDEXING_EXECUTOR = "lightSearchIndexingExecutor";

    private static final String INDEXING_THREAD_NAME = "light-search-indexer";

    @Bean
    @ConditionalOnMissingBean
    Tokenizer tokenizer(LightSearchProperties properties) {
        return new SimpleTokenizer(properties.tokenizer().minTokenLength());
    }

    @Bean(name = INDEXING_EXECUTOR, destroyMethod = "shutdown")
    ExecutorService indexingExecutor() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, INDEXING_THREAD_NAME);
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    SearchDatabaseFactory searchDatabaseFactory(Tokenizer tokenizer,
                                                @Qualifier(INDEXING_EXECUTOR) ExecutorService indexingExecutor,
                                                LightSearchProperties properties) {
        return new SearchDatabaseFactory(tokenizer, indexingExecutor, properties);
    }
}
