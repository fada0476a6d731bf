package dev.aparikh.lightsearch.identity;

import dev.aparikh.lightsearch.InvalidConfigException;
import dev.aparikh.lightsearch.document.Document;
import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.function.Function;

/**
 * Per-insertion options controlling how the document identifier is resolved.
 *
 * @param id         fixed identifier to use (optional)
 * @param idFunction function deriving the identifier from the full document (optional)
 */
public record InsertConfig(
        @Nullable String id,
        @Nullable Function<Document, String> idFunction
) {

    private static final InsertConfig DEFAULTS = new InsertConfig(null, null);

    public InsertConfig {
        if (id != null && idFunction != null) {
            throw new InvalidConfigException("Specify either a fixed id or an id function, not both");
        }
    }

    /**
     * No explicit identifier: the document's {@code id} field is used if it is a string,
     * otherwise a random identifier is generated.
     */
    public static InsertConfig defaults() {
        return DEFAULTS;
    }

    public static InsertConfig withId(String id) {
        return new InsertConfig(Objects.requireNonNull(id, "id must not be null"), null);
    }

    public static InsertConfig derivingId(Function<Document, String> idFunction) {
        return new InsertConfig(null, Objects.requireNonNull(idFunction, "idFunction must not be null"));
    }
}
