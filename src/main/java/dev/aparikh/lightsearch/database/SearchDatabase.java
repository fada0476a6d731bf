package dev.aparikh.lightsearch.database;

import dev.aparikh.lightsearch.InvalidConfigException;
import dev.aparikh.lightsearch.batch.BatchInsertException;
import dev.aparikh.lightsearch.batch.BatchScheduler;
import dev.aparikh.lightsearch.document.Document;
import dev.aparikh.lightsearch.identity.DuplicateIdException;
import dev.aparikh.lightsearch.identity.IdentifierAssigner;
import dev.aparikh.lightsearch.identity.InsertConfig;
import dev.aparikh.lightsearch.index.IndexReader;
import dev.aparikh.lightsearch.index.IndexWriter;
import dev.aparikh.lightsearch.index.TokenizationException;
import dev.aparikh.lightsearch.schema.SchemaException;
import dev.aparikh.lightsearch.schema.SchemaRegistry;
import dev.aparikh.lightsearch.validation.DocumentValidator;
import dev.aparikh.lightsearch.validation.IndexableView;
import dev.aparikh.lightsearch.validation.TypeMismatchException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * One schema-typed full-text database: its schema, committed identifiers, stored documents
 * and inverted index.
 *
 * <p>A single insertion runs these steps synchronously:
 * <ol>
 *   <li>resolve the identifier and reject duplicates ({@link IdentifierAssigner})</li>
 *   <li>validate the document against the schema ({@link DocumentValidator})</li>
 *   <li>index its string fields ({@link IndexWriter})</li>
 *   <li>commit the identifier and store the document</li>
 * </ol>
 * Any failure leaves the database exactly as it was before the call.</p>
 *
 * <p>Batch insertion repeats the same steps per document and yields to the host executor
 * between slices, see {@link BatchScheduler}. Batches are <strong>not</strong> atomic:
 * documents inserted before a failure stay committed.</p>
 *
 * <p>A database expects a single writer at a time. Concurrent mutation of one instance from
 * several threads is not supported and needs external locking.</p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * SearchDatabase db = SearchDatabase.create(DatabaseConfig.withSchema(
 *     Map.of("title", "string", "year", "number")));
 *
 * String id = db.insert(Map.of("title", "Lucene in Action", "year", 2010)).id();
 * Set<String> hits = db.index().lookup("title", "lucene");
 * }</pre>
 *
 * @author Aditya Parikh
 * @since 1.0.0
 */
public class SearchDatabase {

    private static final Logger log = LoggerFactory.getLogger(SearchDatabase.class);

    private final SchemaRegistry schema;
    private final IdentifierAssigner identifiers;
    private final DocumentValidator validator;
    private final IndexWriter indexWriter;
    private final BatchScheduler batchScheduler;
    private final int defaultBatchSize;
    private final Map<String, Document> documents = new LinkedHashMap<>();

    SearchDatabase(SchemaRegistry schema,
                   IdentifierAssigner identifiers,
                   DocumentValidator validator,
                   IndexWriter indexWriter,
                   BatchScheduler batchScheduler,
                   int defaultBatchSize) {
        this.schema = schema;
        this.identifiers = identifiers;
        this.validator = validator;
        this.indexWriter = indexWriter;
        this.batchScheduler = batchScheduler;
        this.defaultBatchSize = defaultBatchSize;
    }

    /**
     * Creates an empty database.
     *
     * @param config schema and collaborators
     * @return the database
     * @throws SchemaException if the schema declares an unsupported type
     */
    public static SearchDatabase create(DatabaseConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        SchemaRegistry schema = SchemaRegistry.of(config.schema());
        SearchDatabase database = new SearchDatabase(
                schema,
                new IdentifierAssigner(),
                new DocumentValidator(),
                new IndexWriter(config.tokenizer()),
                new BatchScheduler(config.executor(), config.batchListener()),
                config.batchSize());
        log.info("Created database with {} schema field(s), default batchSize={}",
                schema.size(), config.batchSize());
        return database;
    }

    public InsertResult insert(Map<String, ?> fields) {
        return insert(Document.of(fields), InsertConfig.defaults());
    }

    public InsertResult insert(Document document) {
        return insert(document, InsertConfig.defaults());
    }

    /**
     * Inserts one document.
     *
     * @param document the document
     * @param config   identifier options, or {@code null} for the defaults
     * @return the assigned identifier
     * @throws DuplicateIdException   if the identifier is already taken
     * @throws TypeMismatchException  if a schema field holds a value of another type
     * @throws InvalidConfigException if the id function yields no usable identifier
     * @throws TokenizationException  if a string field cannot be tokenized
     */
    public InsertResult insert(Document document, @Nullable InsertConfig config) {
        Objects.requireNonNull(document, "document must not be null");
        InsertConfig insertConfig = config == null ? InsertConfig.defaults() : config;

        String id = identifiers.assign(document, insertConfig);
        IndexableView view = validator.validate(document, schema);
        indexWriter.insert(id, view);
        identifiers.commit(id);
        documents.put(id, document);

        log.debug("Inserted document '{}' with {} indexed field(s)", id, view.fields().size());
        return new InsertResult(id);
    }

    public CompletableFuture<List<String>> insertBatch(List<Document> documents) {
        return insertBatch(documents, BatchOptions.defaults());
    }

    /**
     * Inserts documents in order, yielding to the host executor every {@code batchSize}
     * documents.
     *
     * <p>The future completes with the identifiers in input order. If a document fails, it
     * completes exceptionally with a {@link BatchInsertException} holding the position of
     * that document; the documents before it remain inserted and the ones after it are
     * skipped. Callers that need all-or-nothing batches must remove the
     * {@linkplain BatchInsertException#getInsertedIds() inserted ids} themselves.</p>
     *
     * @param documents the documents to insert
     * @param options   batch size and identifier options
     * @return future of the assigned identifiers
     * @throws InvalidConfigException if the batch size is not positive
     */
    public CompletableFuture<List<String>> insertBatch(List<Document> documents, BatchOptions options) {
        Objects.requireNonNull(documents, "documents must not be null");
        Objects.requireNonNull(options, "options must not be null");
        int batchSize = options.batchSize() != null ? options.batchSize() : defaultBatchSize;
        InsertConfig insertConfig = options.insertConfig();
        return batchScheduler.schedule(documents, document -> insert(document, insertConfig).id(), batchSize);
    }

    /**
     * Returns a stored document, including fields that are not part of the schema.
     */
    public Optional<Document> getById(String id) {
        return Optional.ofNullable(documents.get(id));
    }

    /**
     * Removes a document from the store, the index and the committed identifiers.
     *
     * @param id the document identifier
     * @return true if the document existed
     */
    public boolean remove(String id) {
        if (documents.remove(id) == null) {
            return false;
        }
        indexWriter.remove(id);
        identifiers.release(id);
        log.debug("Removed document '{}'", id);
        return true;
    }

    public int count() {
        return documents.size();
    }

    public SchemaRegistry schema() {
        return schema;
    }

    public IndexReader index() {
        return indexWriter;
    }
}
