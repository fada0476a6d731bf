package dev.aparikh.lightsearch.validation;

import dev.aparikh.lightsearch.LightSearchException;
import dev.aparikh.lightsearch.schema.FieldType;

/**
 * Thrown when a field declared in the schema holds a value of another type.
 * The whole insertion is rejected.
 */
public class TypeMismatchException extends LightSearchException {

    private final String field;
    private final FieldType expected;
    private final String actual;

    public TypeMismatchException(String field, FieldType expected, String actual) {
        super("Field '" + field + "' expected type " + expected.declaredName() + " but got " + actual);
        this.field = field;
        this.expected = expected;
        this.actual = actual;
    }

    public String getField() {
        return field;
    }

    public FieldType getExpected() {
        return expected;
    }

    /**
     * Type name of the rejected value, e.g. {@code "string"} or {@code "ArrayList"}.
     */
    public String getActual() {
        return actual;
    }
}
