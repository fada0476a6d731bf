package dev.aparikh.lightsearch.identity;

import dev.aparikh.lightsearch.InvalidConfigException;
import dev.aparikh.lightsearch.document.Document;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Resolves document identifiers and owns the set of identifiers committed to one database.
 *
 * <p>Resolution order, first match wins:
 * <ol>
 *   <li>a fixed id from the {@link InsertConfig}</li>
 *   <li>the result of the config's id function, applied to the full document</li>
 *   <li>the document's {@code id} field, if it holds a string</li>
 *   <li>a freshly generated random identifier</li>
 * </ol>
 * </p>
 *
 * <p>{@link #assign} only checks uniqueness. The identifier becomes part of the committed set
 * through {@link #commit} once the rest of the insertion has succeeded, so a failed insertion
 * never reserves its identifier.</p>
 *
 * <p>Instances are not thread-safe; a database is mutated by a single caller at a time.</p>
 *
 * @author Aditya Parikh
 * @since 1.0.0
 */
public class IdentifierAssigner {

    private static final Logger log = LoggerFactory.getLogger(IdentifierAssigner.class);

    private final Set<String> committed = new HashSet<>();
    private final Supplier<String> generator;

    public IdentifierAssigner() {
        this(() -> UUID.randomUUID().toString());
    }

    /**
     * Creates an assigner with a custom generator for documents that carry no identifier.
     *
     * @param generator supplier of random identifiers
     */
    public IdentifierAssigner(Supplier<String> generator) {
        this.generator = generator;
    }

    /**
     * Resolves the identifier for a document and checks it against the committed set.
     *
     * @param document the document being inserted
     * @param config   the insertion options
     * @return the resolved identifier
     * @throws InvalidConfigException if the id function fails or returns a null or blank id
     * @throws DuplicateIdException   if the identifier is already committed
     */
    public String assign(Document document, InsertConfig config) {
        String id = resolve(document, config);
        if (committed.contains(id)) {
            log.debug("Rejecting duplicate document id '{}'", id);
            throw new DuplicateIdException(id);
        }
        return id;
    }

    private String resolve(Document document, InsertConfig config) {
        if (config.id() != null) {
            return requireUsable(config.id(), "Configured document id");
        }
        Function<Document, String> idFunction = config.idFunction();
        if (idFunction != null) {
            String derived;
            try {
                derived = idFunction.apply(document);
            } catch (RuntimeException e) {
                throw new InvalidConfigException("Document id function failed: " + e.getMessage(), e);
            }
            return requireUsable(derived, "Document id function result");
        }
        return document.stringId().orElseGet(generator);
    }

    private static String requireUsable(@Nullable String id, String what) {
        // id functions are caller code and may return null despite the signature
        if (id == null || id.isBlank()) {
            throw new InvalidConfigException(what + " must be a non-blank string");
        }
        return id;
    }

    /**
     * Registers an identifier as committed.
     *
     * @param id the identifier of a successfully inserted document
     * @throws DuplicateIdException if the identifier is already committed
     */
    public void commit(String id) {
        if (!committed.add(id)) {
            throw new DuplicateIdException(id);
        }
    }

    /**
     * Removes an identifier from the committed set, making it available again.
     *
     * @param id the identifier of a removed document
     * @return true if the identifier was committed
     */
    public boolean release(String id) {
        return committed.remove(id);
    }

    public boolean contains(String id) {
        return committed.contains(id);
    }

    public int size() {
        return committed.size();
    }
}
