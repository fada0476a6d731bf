package dev.aparikh.lightsearch.document;

import org.jspecify.annotations.Nullable;

/**
 * Classified value of a document field.
 *
 * <p>Raw caller values are classified once into one of four variants so that type checks
 * against a schema compare a single {@link Kind} instead of inspecting Java classes at
 * every call site.</p>
 */
public sealed interface FieldValue
        permits FieldValue.StringValue, FieldValue.NumberValue, FieldValue.BooleanValue, FieldValue.UnknownValue {

    enum Kind {
        STRING,
        NUMBER,
        BOOLEAN,
        UNKNOWN
    }

    Kind kind();

    /**
     * Human readable type name used in error messages.
     */
    String typeName();

    /**
     * Classifies a raw value. Character sequences are strings, any {@link Number} is a number,
     * {@link Boolean} is a boolean, everything else is unknown.
     *
     * @param raw the raw field value
     * @return the classified value
     */
    static FieldValue of(@Nullable Object raw) {
        if (raw instanceof CharSequence) {
            return new StringValue(raw.toString());
        }
        if (raw instanceof Number) {
            return new NumberValue((Number) raw);
        }
        if (raw instanceof Boolean) {
            return new BooleanValue((Boolean) raw);
        }
        return new UnknownValue(raw);
    }

    record StringValue(String value) implements FieldValue {
        @Override
        public Kind kind() {
            return Kind.STRING;
        }

        @Override
        public String typeName() {
            return "string";
        }
    }

    record NumberValue(Number value) implements FieldValue {
        @Override
        public Kind kind() {
            return Kind.NUMBER;
        }

        @Override
        public String typeName() {
            return "number";
        }
    }

    record BooleanValue(boolean value) implements FieldValue {
        @Override
        public Kind kind() {
            return Kind.BOOLEAN;
        }

        @Override
        public String typeName() {
            return "boolean";
        }
    }

    record UnknownValue(@Nullable Object raw) implements FieldValue {
        @Override
        public Kind kind() {
            return Kind.UNKNOWN;
        }

        @Override
        public String typeName() {
            return raw == null ? "null" : raw.getClass().getSimpleName();
        }
    }
}
