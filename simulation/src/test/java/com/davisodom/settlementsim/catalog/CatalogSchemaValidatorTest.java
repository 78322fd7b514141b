package com.davisodom.settlementsim.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CatalogSchemaValidatorTest {

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());
    private CatalogSchemaValidator validator;

    @BeforeEach
    void setUp() throws IOException {
        validator = new CatalogSchemaValidator(CatalogSchemaValidator.STRUCTURE_SCHEMA);
    }

    private JsonNode node(String text) throws IOException {
        return yaml.readTree(text);
    }

    @Test
    void testValidExtractorPasses() throws IOException {
        JsonNode farm = node("id: farm\ncategory: EXTRACTOR\nproduces: food\ncosts: { wood: 20, stone: 10 }\n"
                + "staffing: { required: 2, optional: 3, bonusPerWorker: 0.1, priority: 10 }\n");

        assertTrue(validator.validate(farm).isEmpty());
    }

    @Test
    void testNegativeCostRejected() throws IOException {
        List<String> errors = validator.validate(node("id: hut\ncategory: BUILDING\ncosts: { wood: -5 }\n"));

        assertFalse(errors.isEmpty());
    }

    @Test
    void testUnknownResourceRejected() throws IOException {
        List<String> errors = validator.validate(node("id: hut\ncategory: BUILDING\ncosts: { gold: 5 }\n"));

        assertFalse(errors.isEmpty());
    }

    @Test
    void testExtractorNeedsProducedResource() throws IOException {
        assertFalse(validator.validate(node("id: pit\ncategory: EXTRACTOR\ncosts: { wood: 1 }\n")).isEmpty());
    }

    @Test
    void testMissingSchemaFails() {
        assertThrows(IOException.class, () -> new CatalogSchemaValidator("nope.json"));
    }
}
