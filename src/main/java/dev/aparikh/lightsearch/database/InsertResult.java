package dev.aparikh.lightsearch.database;

/**
 * Result of a single insertion.
 *
 * @param id the identifier assigned to the inserted document
 */
public record InsertResult(String id) {
}
