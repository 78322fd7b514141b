package com.davisodom.settlementsim.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JSON Schema check for data-driven catalog entries.
 *
 * Schemas live on the classpath under {@code schemas/} and use draft 7.
 */
public class CatalogSchemaValidator {

    public static final String STRUCTURE_SCHEMA = "structure.json";

    private final JsonSchema schema;

    /**
     * @throws IOException when the schema resource is missing
     */
    public CatalogSchemaValidator(String schemaName) throws IOException {
        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
        try (InputStream in = CatalogSchemaValidator.class.getClassLoader()
                .getResourceAsStream("schemas/" + schemaName)) {
            if (in == null) {
                throw new IOException("Schema not found: " + schemaName);
            }
            this.schema = factory.getSchema(in);
        }
    }

    /**
     * @return violation messages, empty when the node is valid
     */
    public List<String> validate(JsonNode node) {
        Set<ValidationMessage> errors = schema.validate(node);
        return errors.stream()
                .map(ValidationMessage::getMessage)
                .sorted()
                .collect(Collectors.toList());
    }
}
