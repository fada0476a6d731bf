package dev.aparikh.lightsearch.index;

import dev.aparikh.lightsearch.identity.DuplicateIdException;
import dev.aparikh.lightsearch.validation.IndexableView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable inverted index of one database: field, then token, then posting list of
 * document identifiers.
 *
 * <p>Insertion is all-or-nothing per document. Fields are written one after the other;
 * if tokenizing a later field fails, the postings written for earlier fields of the same
 * document are removed before the error propagates.</p>
 *
 * <p>The writer also remembers which tokens each document was indexed under, so that
 * {@link #remove(String)} does not need to scan every posting list.</p>
 *
 * <p>Instances are not thread-safe.</p>
 *
 * @author Aditya Parikh
 * @since 1.0.0
 */
public class IndexWriter implements IndexReader {

    private static final Logger log = LoggerFactory.getLogger(IndexWriter.class);

    private final Tokenizer tokenizer;

    private final Map<String, Map<String, Set<String>>> postings = new LinkedHashMap<>();

    private final Map<String, Map<String, Set<String>>> documentTokens = new HashMap<>();

    public IndexWriter(Tokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    /**
     * Indexes the string fields of a document.
     *
     * @param id   the document identifier
     * @param view the validated string fields
     * @throws DuplicateIdException   if the identifier is already indexed
     * @throws TokenizationException if the tokenizer fails on any field
     */
    public void insert(String id, IndexableView view) {
        if (documentTokens.containsKey(id)) {
            throw new DuplicateIdException(id);
        }

        Map<String, Set<String>> written = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : view.fields().entrySet()) {
            String field = entry.getKey();
            Set<String> tokens;
            try {
                tokens = tokenize(id, field, entry.getValue());
            } catch (RuntimeException e) {
                rollback(id, written);
                log.warn("Rolled back {} field(s) of document '{}' after tokenizer failure on '{}'",
                        written.size(), id, field);
                throw e instanceof TokenizationException ? e : new TokenizationException(id, field, e);
            }

            written.put(field, tokens);
            if (tokens.isEmpty()) {
                continue;
            }
            Map<String, Set<String>> fieldPostings = postings.computeIfAbsent(field, f -> new HashMap<>());
            for (String token : tokens) {
                fieldPostings.computeIfAbsent(token, t -> new LinkedHashSet<>()).add(id);
                log.trace("Posted '{}' under {}:{}", id, field, token);
            }
        }

        documentTokens.put(id, written);
        log.debug("Indexed document '{}' across {} field(s)", id, written.size());
    }

    private Set<String> tokenize(String id, String field, String value) {
        List<String> tokens = tokenizer.tokenize(value);
        if (tokens == null) {
            throw new TokenizationException(id, field, "tokenizer returned null");
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String token : tokens) {
            if (token == null) {
                throw new TokenizationException(id, field, "tokenizer returned a null token");
            }
            unique.add(token);
        }
        return unique;
    }

    /**
     * Removes a document from every posting list it appears in.
     *
     * @param id the document identifier
     * @return true if the document was indexed
     */
    public boolean remove(String id) {
        Map<String, Set<String>> indexed = documentTokens.remove(id);
        if (indexed == null) {
            return false;
        }
        rollback(id, indexed);
        log.debug("Removed document '{}' from the index", id);
        return true;
    }

    private void rollback(String id, Map<String, Set<String>> written) {
        for (Map.Entry<String, Set<String>> entry : written.entrySet()) {
            Map<String, Set<String>> fieldPostings = postings.get(entry.getKey());
            if (fieldPostings == null) {
                continue;
            }
            for (String token : entry.getValue()) {
                Set<String> ids = fieldPostings.get(token);
                if (ids != null && ids.remove(id) && ids.isEmpty()) {
                    fieldPostings.remove(token);
                }
            }
            if (fieldPostings.isEmpty()) {
                postings.remove(entry.getKey());
            }
        }
    }

    @Override
    public Set<String> lookup(String field, String token) {
        Map<String, Set<String>> fieldPostings = postings.get(field);
        if (fieldPostings == null) {
            return Set.of();
        }
        Set<String> ids = fieldPostings.get(token);
        return ids == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(ids));
    }

    @Override
    public Set<String> tokens(String field) {
        Map<String, Set<String>> fieldPostings = postings.get(field);
        if (fieldPostings == null) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(fieldPostings.keySet()));
    }

    @Override
    public Set<String> indexedFields() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(postings.keySet()));
    }

    @Override
    public boolean containsDocument(String id) {
        return documentTokens.containsKey(id);
    }

    @Override
    public int documentCount() {
        return documentTokens.size();
    }
}
