package dev.aparikh.lightsearch.schema;

import dev.aparikh.lightsearch.LightSearchException;

/**
 * Thrown when a schema declaration is invalid, which makes database creation fail.
 */
public class SchemaException extends LightSearchException {

    public SchemaException(String message) {
        super(message);
    }
}
