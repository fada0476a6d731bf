package dev.aparikh.lightsearch.identity;

import dev.aparikh.lightsearch.LightSearchException;

/**
 * Thrown when a resolved document identifier is already committed to the database.
 * Retrying with the same input fails the same way.
 */
public class DuplicateIdException extends LightSearchException {

    private final String id;

    public DuplicateIdException(String id) {
        super("Document id '" + id + "' already exists");
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
