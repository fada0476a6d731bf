package dev.aparikh.lightsearch.schema;

import dev.aparikh.lightsearch.document.FieldValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Types a schema field can be declared with.
 *
 * <p>Only {@link #STRING} fields feed the inverted index. Number and boolean fields are
 * type-checked on insertion and kept on the stored document.</p>
 */
public enum FieldType {

    STRING("string", FieldValue.Kind.STRING),
    NUMBER("number", FieldValue.Kind.NUMBER),
    BOOLEAN("boolean", FieldValue.Kind.BOOLEAN);

    private final String declaredName;
    private final FieldValue.Kind kind;

    FieldType(String declaredName, FieldValue.Kind kind) {
        this.declaredName = declaredName;
        this.kind = kind;
    }

    /**
     * Name used to declare this type in a schema mapping, e.g. {@code "string"}.
     */
    public String declaredName() {
        return declaredName;
    }

    /**
     * Returns whether a runtime value is of this declared type.
     *
     * @param value the classified field value
     * @return true if the value kind corresponds to this type
     */
    public boolean accepts(FieldValue value) {
        return value.kind() == kind;
    }

    /**
     * Resolves a declared type name, ignoring case and surrounding whitespace.
     *
     * @param name the declared type name
     * @return the matching type, or empty if the name is not a supported type
     */
    public static Optional<FieldType> fromDeclaredName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (FieldType type : values()) {
            if (type.declaredName.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return declaredName;
    }
}
