package dev.aparikh.lightsearch.index;

import dev.aparikh.lightsearch.LightSearchException;

/**
 * Thrown when the tokenizer fails on a field value. Postings already written for the
 * document are rolled back before this is raised.
 */
public class TokenizationException extends LightSearchException {

    private final String field;

    public TokenizationException(String id, String field, Throwable cause) {
        super("Failed to tokenize field '" + field + "' of document '" + id + "'", cause);
        this.field = field;
    }

    public TokenizationException(String id, String field, String reason) {
        super("Failed to tokenize field '" + field + "' of document '" + id + "': " + reason);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
