package dev.aparikh.lightsearch.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The string-typed schema fields of a validated document, in schema declaration order.
 * Only these values are handed to the index writer.
 *
 * @param fields field name to string value mapping
 */
public record IndexableView(Map<String, String> fields) {

    private static final IndexableView EMPTY = new IndexableView(Map.of());

    public IndexableView {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static IndexableView empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }
}
