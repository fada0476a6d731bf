package dev.aparikh.lightsearch.config;

import dev.aparikh.lightsearch.database.DatabaseConfig;
import dev.aparikh.lightsearch.database.SearchDatabase;
import dev.aparikh.lightsearch.index.Tokenizer;
import dev.aparikh.lightsearch.schema.SchemaException;

import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Creates {@link SearchDatabase} instances wired with the application's tokenizer,
 * indexing executor and configured batch size.
 *
 * <p>Every call returns a new, independent database; instances share no identifiers,
 * documents or postings.</p>
 */
public class SearchDatabaseFactory {

    private final Tokenizer tokenizer;
    private final Executor executor;
    private final LightSearchProperties properties;

    public SearchDatabaseFactory(Tokenizer tokenizer, Executor executor, LightSearchProperties properties) {
        this.tokenizer = tokenizer;
        this.executor = executor;
        this.properties = properties;
    }

    /**
     * Creates a database for the given schema.
     *
     * @param schema field name to declared type name
     * @return an empty database
     * @throws SchemaException if the schema declares an unsupported type
     */
    public SearchDatabase create(Map<String, String> schema) {
        return SearchDatabase.create(DatabaseConfig.builder()
                .schema(schema)
                .tokenizer(tokenizer)
                .executor(executor)
                .batchSize(properties.batchSize())
                .build());
    }
}
