package dev.aparikh.lightsearch.document;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A caller supplied record: an ordered, unmodifiable set of named fields.
 *
 * <p>Documents are stored exactly as given, including fields that are not part of the
 * schema. A field mapped to {@code null} is treated as absent by {@link #value(String)}.</p>
 *
 * <pre>{@code
 * Document doc = Document.builder()
 *     .field("id", "doc-001")
 *     .field("title", "Spring in Action")
 *     .field("year", 2022)
 *     .build();
 * }</pre>
 */
public final class Document {

    public static final String ID_FIELD = "id";

    private final Map<String, @Nullable Object> fields;

    private Document(Map<String, ? extends @Nullable Object> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Creates a document from a field map. The map is copied.
     *
     * @param fields field name to raw value mapping
     * @return the document
     */
    public static Document of(Map<String, ? extends @Nullable Object> fields) {
        Objects.requireNonNull(fields, "fields must not be null");
        for (String name : fields.keySet()) {
            if (name == null) {
                throw new IllegalArgumentException("Document field names must not be null");
            }
        }
        return new Document(fields);
    }

    public static Builder builder() {
        return new Builder();
    }

    public @Nullable Object get(String name) {
        return fields.get(name);
    }

    /**
     * Returns the classified value of a field.
     *
     * @param name the field name
     * @return the value, or empty if the field is missing or null
     */
    public Optional<FieldValue> value(String name) {
        Object raw = fields.get(name);
        return raw == null ? Optional.empty() : Optional.of(FieldValue.of(raw));
    }

    public boolean has(String name) {
        return fields.get(name) != null;
    }

    /**
     * Returns the {@value #ID_FIELD} field if it holds a string.
     */
    public Optional<String> stringId() {
        Object raw = fields.get(ID_FIELD);
        return raw instanceof CharSequence ? Optional.of(raw.toString()) : Optional.empty();
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public Map<String, @Nullable Object> asMap() {
        return fields;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Document)) {
            return false;
        }
        return fields.equals(((Document) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "Document" + fields;
    }

    public static class Builder {
        private final Map<String, @Nullable Object> fields = new LinkedHashMap<>();

        public Builder field(String name, @Nullable Object value) {
            Objects.requireNonNull(name, "field name must not be null");
            fields.put(name, value);
            return this;
        }

        public Document build() {
            return new Document(fields);
        }
    }
}
