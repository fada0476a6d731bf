package dev.aparikh.lightsearch.validation;

import dev.aparikh.lightsearch.document.Document;
import dev.aparikh.lightsearch.document.FieldValue;
import dev.aparikh.lightsearch.schema.FieldType;
import dev.aparikh.lightsearch.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Checks a document against a schema and extracts its indexable view.
 *
 * <p>Schemas describe known fields, not required ones: a schema field missing from the
 * document is skipped. A present schema field must match its declared type. Fields outside
 * the schema are neither checked nor indexed, but stay on the stored document.</p>
 *
 * <p>The validator has no state; {@link #validate} depends only on its arguments.</p>
 */
public class DocumentValidator {

    private static final Logger log = LoggerFactory.getLogger(DocumentValidator.class);

    /**
     * Validates a document.
     *
     * @param document the document to check
     * @param schema   the schema of the target database
     * @return the string fields to index
     * @throws TypeMismatchException on the first schema field whose value has another type
     */
    public IndexableView validate(Document document, SchemaRegistry schema) {
        if (schema.isEmpty()) {
            return IndexableView.empty();
        }

        Map<String, String> indexable = new LinkedHashMap<>();
        for (Map.Entry<String, FieldType> declared : schema.fields().entrySet()) {
            String field = declared.getKey();
            FieldType expected = declared.getValue();

            Optional<FieldValue> value = document.value(field);
            if (value.isEmpty()) {
                continue;
            }
            FieldValue actual = value.get();
            if (!expected.accepts(actual)) {
                log.debug("Field '{}' declared {} but document holds {}", field, expected, actual.typeName());
                throw new TypeMismatchException(field, expected, actual.typeName());
            }
            if (actual instanceof FieldValue.StringValue) {
                indexable.put(field, ((FieldValue.StringValue) actual).value());
            }
        }
        return new IndexableView(indexable);
    }
}
