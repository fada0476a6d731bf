package dev.aparikh.lightsearch.database;

import dev.aparikh.lightsearch.InvalidConfigException;
import dev.aparikh.lightsearch.TestUtils;
import dev.aparikh.lightsearch.TestUtils.QueuedExecutor;
import dev.aparikh.lightsearch.batch.BatchInsertException;
import dev.aparikh.lightsearch.document.Document;
import dev.aparikh.lightsearch.identity.DuplicateIdException;
import dev.aparikh.lightsearch.identity.InsertConfig;
import dev.aparikh.lightsearch.index.TokenizationException;
import dev.aparikh.lightsearch.schema.SchemaException;
import dev.aparikh.lightsearch.validation.TypeMismatchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SearchDatabase} covering single and batch insertion end to end.
 */
class SearchDatabaseTest {

    private static final Map<String, String> BOOK_SCHEMA = Map.of("title", "string", "year", "number");

    private QueuedExecutor executor;
    private List<Integer> yields;
    private SearchDatabase database;

    @BeforeEach
    void setUp() {
        executor = new QueuedExecutor();
        yields = new ArrayList<>();
        database = SearchDatabase.create(DatabaseConfig.builder()
                .schema(BOOK_SCHEMA)
                .executor(executor)
                .batchListener(yields::add)
                .build());
    }

    @Nested
    class Creation {

        @Test
        void shouldFailOnUnsupportedType() {
            assertThatThrownBy(() -> SearchDatabase.create(DatabaseConfig.withSchema(Map.of("tags", "array"))))
                    .isInstanceOf(SchemaException.class);
        }

        @Test
        void shouldStartEmpty() {
            assertThat(database.count()).isZero();
            assertThat(database.index().documentCount()).isZero();
            assertThat(database.schema().fieldNames()).containsExactlyInAnyOrder("title", "year");
        }

        @Test
        void shouldKeepInstancesIndependent() {
            SearchDatabase other = SearchDatabase.create(DatabaseConfig.withSchema(BOOK_SCHEMA));

            database.insert(Map.of("id", "abc", "title", "A"));

            assertThat(other.insert(Map.of("id", "abc", "title", "A")).id()).isEqualTo("abc");
            assertThat(other.count()).isEqualTo(1);
        }
    }

    @Nested
    class SingleInsertion {

        @Test
        void shouldIndexStringFieldUnderGeneratedId() {
            InsertResult result = database.insert(Map.of("title", "X", "year", 2020));

            assertThat(result.id()).isNotBlank();
            assertThat(database.index().lookup("title", "x")).containsExactly(result.id());
            assertThat(database.index().indexedFields()).containsExactly("title");
        }

        @Test
        void shouldRejectStringYear() {
            assertThatThrownBy(() -> database.insert(Map.of("title", "X", "year", "2020")))
                    .isInstanceOfSatisfying(TypeMismatchException.class,
                            ex -> assertThat(ex.getField()).isEqualTo("year"));

            assertThat(database.count()).isZero();
            assertThat(database.index().lookup("title", "x")).isEmpty();
        }

        @Test
        void shouldRejectDuplicateIdField() {
            database.insert(Map.of("id", "abc", "title", "A"));

            assertThatThrownBy(() -> database.insert(Map.of("id", "abc", "title", "B")))
                    .isInstanceOf(DuplicateIdException.class);

            assertThat(database.index().lookup("title", "b")).isEmpty();
            assertThat(database.getById("abc")).hasValueSatisfying(
                    doc -> assertThat(doc.get("title")).isEqualTo("A"));
        }

        @Test
        void shouldUseIdFunction() {
            InsertConfig config = InsertConfig.derivingId(doc -> ((String) doc.get("title")).toLowerCase(Locale.ROOT));

            InsertResult result = database.insert(Document.of(Map.of("title", "Hello")), config);

            assertThat(result.id()).isEqualTo("hello");
        }

        @Test
        void shouldUseFixedId() {
            assertThat(database.insert(Document.of(Map.of("title", "A")), InsertConfig.withId("fixed")).id())
                    .isEqualTo("fixed");
        }

        @Test
        void shouldNotReserveIdOfRejectedDocument() {
            assertThatThrownBy(() -> database.insert(Map.of("id", "abc", "year", "bad")))
                    .isInstanceOf(TypeMismatchException.class);

            assertThat(database.insert(Map.of("id", "abc", "year", 1)).id()).isEqualTo("abc");
        }

        @Test
        void shouldNotReserveIdWhenTokenizerFails() {
            SearchDatabase failing = SearchDatabase.create(DatabaseConfig.builder()
                    .schema(BOOK_SCHEMA)
                    .tokenizer(text -> {
                        throw new IllegalArgumentException("cannot tokenize");
                    })
                    .build());

            assertThatThrownBy(() -> failing.insert(Map.of("id", "abc", "title", "A")))
                    .isInstanceOf(TokenizationException.class);

            assertThat(failing.count()).isZero();
            assertThat(failing.insert(Map.of("id", "abc", "year", 1)).id()).isEqualTo("abc");
        }

        @Test
        void shouldStoreButNeverIndexUnknownFields() {
            InsertResult result = database.insert(Map.of(
                    "title", "Dune",
                    "summary", "desert planet",
                    "tags", List.of("scifi")));

            assertThat(database.index().indexedFields()).containsExactly("title");
            assertThat(database.index().lookup("summary", "desert")).isEmpty();
            assertThat(database.getById(result.id())).hasValueSatisfying(doc -> {
                assertThat(doc.get("summary")).isEqualTo("desert planet");
                assertThat(doc.get("tags")).isEqualTo(List.of("scifi"));
            });
        }

        @Test
        void shouldStoreEverythingWithEmptySchema() {
            SearchDatabase schemaless = SearchDatabase.create(DatabaseConfig.withSchema(Map.of()));

            InsertResult result = schemaless.insert(Map.of("title", "X", "year", "any"));

            assertThat(schemaless.index().indexedFields()).isEmpty();
            assertThat(schemaless.getById(result.id())).isPresent();
        }

        @Test
        void shouldReturnDistinctIds() {
            Set<String> ids = new HashSet<>();
            for (int i = 0; i < 50; i++) {
                ids.add(database.insert(Map.of("title", "Same title")).id());
            }

            assertThat(ids).hasSize(50);
            assertThat(database.index().lookup("title", "same")).hasSize(50);
        }
    }

    @Nested
    class Removal {

        @Test
        void shouldRemoveFromStoreIndexAndIds() {
            database.insert(Map.of("id", "abc", "title", "Gone"));

            assertThat(database.remove("abc")).isTrue();

            assertThat(database.getById("abc")).isEmpty();
            assertThat(database.index().lookup("title", "gone")).isEmpty();
            assertThat(database.insert(Map.of("id", "abc", "title", "Back")).id()).isEqualTo("abc");
        }

        @Test
        void shouldReportUnknownId() {
            assertThat(database.remove("missing")).isFalse();
        }
    }

    @Nested
    class BatchInsertion {

        @Test
        void shouldYieldAfterSecondAndFourthDocument() {
            List<Document> documents = TestUtils.titledDocuments("doc", 5);

            CompletableFuture<List<String>> result = database.insertBatch(documents, BatchOptions.ofBatchSize(2));

            assertThat(yields).containsExactly(2);
            assertThat(database.count()).isEqualTo(2);

            executor.runNext();
            assertThat(yields).containsExactly(2, 4);
            assertThat(database.count()).isEqualTo(4);

            executor.runNext();
            assertThat(result).isCompletedWithValue(List.of("doc-1", "doc-2", "doc-3", "doc-4", "doc-5"));
            assertThat(yields).containsExactly(2, 4);
        }

        @Test
        void shouldKeepDocumentsBeforeFailure() {
            List<Document> documents = new ArrayList<>(TestUtils.titledDocuments("doc", 5));
            documents.set(2, Document.of(Map.of("id", "doc-3", "title", "Title 3", "year", "bad")));

            CompletableFuture<List<String>> result = database.insertBatch(documents);
            executor.runAll();

            assertThatThrownBy(result::join)
                    .cause()
                    .isInstanceOfSatisfying(BatchInsertException.class, ex -> {
                        assertThat(ex.getPosition()).isEqualTo(2);
                        assertThat(ex.getInsertedIds()).containsExactly("doc-1", "doc-2");
                        assertThat(ex.getCause()).isInstanceOf(TypeMismatchException.class);
                    });
            assertThat(database.index().lookup("title", "title")).containsExactly("doc-1", "doc-2");
            assertThat(database.getById("doc-4")).isEmpty();
            assertThat(database.getById("doc-5")).isEmpty();
        }

        @Test
        void shouldApplyIdFunctionToEveryDocument() {
            List<Document> documents = List.of(
                    Document.of(Map.of("title", "First")),
                    Document.of(Map.of("title", "Second")));
            BatchOptions options = new BatchOptions(null,
                    InsertConfig.derivingId(doc -> "book:" + doc.get("title")));

            CompletableFuture<List<String>> result = database.insertBatch(documents, options);

            assertThat(result).isCompletedWithValue(List.of("book:First", "book:Second"));
        }

        @Test
        void shouldFailOnDuplicateInsideBatch() {
            List<Document> documents = List.of(
                    Document.of(Map.of("id", "same", "title", "A")),
                    Document.of(Map.of("id", "same", "title", "B")));

            CompletableFuture<List<String>> result = database.insertBatch(documents);

            assertThatThrownBy(result::join)
                    .cause()
                    .isInstanceOf(BatchInsertException.class)
                    .hasCauseInstanceOf(DuplicateIdException.class);
            assertThat(database.count()).isEqualTo(1);
        }

        @Test
        void shouldRejectNonPositiveBatchSizeBeforeInserting() {
            assertThatThrownBy(() -> database.insertBatch(TestUtils.titledDocuments("doc", 3), BatchOptions.ofBatchSize(0)))
                    .isInstanceOf(InvalidConfigException.class);

            assertThat(database.count()).isZero();
        }

        @Test
        void shouldMatchIndependentSingleInsertions() {
            SearchDatabase single = SearchDatabase.create(DatabaseConfig.withSchema(BOOK_SCHEMA));
            List<Document> documents = TestUtils.titledDocuments("doc", 7);
            documents.forEach(single::insert);

            database.insertBatch(documents, BatchOptions.ofBatchSize(3));
            executor.runAll();

            assertThat(database.count()).isEqualTo(single.count());
            for (String token : single.index().tokens("title")) {
                assertThat(database.index().lookup("title", token))
                        .containsExactlyElementsOf(single.index().lookup("title", token));
            }
        }

        @Test
        void shouldUseConfiguredDefaultBatchSize() {
            SearchDatabase small = SearchDatabase.create(DatabaseConfig.builder()
                    .schema(BOOK_SCHEMA)
                    .executor(executor)
                    .batchSize(4)
                    .batchListener(yields::add)
                    .build());

            small.insertBatch(TestUtils.titledDocuments("doc", 9));
            executor.runAll();

            assertThat(yields).containsExactly(4, 8);
            assertThat(small.count()).isEqualTo(9);
        }
    }
}
