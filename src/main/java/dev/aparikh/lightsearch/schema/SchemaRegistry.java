package dev.aparikh.lightsearch.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping of field names to their declared {@link FieldType}.
 *
 * <p>A registry is built once when a database instance is created and is shared read-only
 * by the validator and the index writer. There is no way to change it afterwards, so every
 * validation decision made against it is stable for the lifetime of the database.</p>
 *
 * <p>Declaration order is preserved, which keeps validation and indexing order
 * deterministic.</p>
 *
 * @author Aditya Parikh
 * @since 1.0.0
 */
public final class SchemaRegistry {

    private static final Logger log = LoggerFactory.getLogger(SchemaRegistry.class);

    private static final SchemaRegistry EMPTY = new SchemaRegistry(Map.of());

    private final Map<String, FieldType> fields;

    private SchemaRegistry(Map<String, FieldType> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Builds a registry from declared type names such as {@code "string"} or {@code "number"}.
     *
     * @param declarations field name to type name mapping
     * @return the registry
     * @throws SchemaException if a field name is blank or a type name is missing or unsupported
     */
    public static SchemaRegistry of(Map<String, String> declarations) {
        Map<String, FieldType> parsed = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : declarations.entrySet()) {
            String field = checkFieldName(entry.getKey());
            String typeName = entry.getValue();
            if (typeName == null || typeName.isBlank()) {
                throw new SchemaException("Missing type for field '" + field + "'");
            }
            FieldType type = FieldType.fromDeclaredName(typeName)
                    .orElseThrow(() -> new SchemaException(
                            "Unsupported type '" + typeName + "' for field '" + field
                                    + "', expected one of string, number, boolean"));
            parsed.put(field, type);
        }
        log.debug("Parsed schema with {} field(s): {}", parsed.size(), parsed);
        return new SchemaRegistry(parsed);
    }

    /**
     * Builds a registry from already typed declarations.
     *
     * @param declarations field name to type mapping
     * @return the registry
     * @throws SchemaException if a field name is blank or a type is missing
     */
    public static SchemaRegistry ofTypes(Map<String, FieldType> declarations) {
        Map<String, FieldType> checked = new LinkedHashMap<>();
        declarations.forEach((field, type) -> {
            checkFieldName(field);
            if (type == null) {
                throw new SchemaException("Missing type for field '" + field + "'");
            }
            checked.put(field, type);
        });
        return new SchemaRegistry(checked);
    }

    public static SchemaRegistry empty() {
        return EMPTY;
    }

    private static String checkFieldName(String field) {
        if (field == null || field.isBlank()) {
            throw new SchemaException("Schema field names must not be blank");
        }
        return field;
    }

    /**
     * Looks up the declared type of a field.
     *
     * @param fieldName the field name
     * @return the declared type, or empty if the field is not part of the schema
     */
    public Optional<FieldType> typeOf(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public Map<String, FieldType> fields() {
        return fields;
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public int size() {
        return fields.size();
    }

    @Override
    public String toString() {
        return "SchemaRegistry" + fields;
    }
}
