package dev.aparikh.lightsearch.index;

import java.util.Set;

/**
 * Read access to the inverted index, as consumed by a query engine.
 *
 * <p>Returned sets are snapshots taken at call time; later insertions and removals are not
 * reflected in them.</p>
 */
public interface IndexReader {

    /**
     * Returns the identifiers of documents whose {@code field} contains {@code token},
     * in insertion order.
     *
     * @param field the indexed field
     * @param token an already tokenized term
     * @return unmodifiable copy of the posting list, empty if there is none
     */
    Set<String> lookup(String field, String token);

    /**
     * Returns the tokens that currently have postings under a field.
     */
    Set<String> tokens(String field);

    Set<String> indexedFields();

    boolean containsDocument(String id);

    int documentCount();
}
