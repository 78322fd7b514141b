package com.davisodom.settlementsim.catalog;

import com.davisodom.settlementsim.economy.ResourceAmounts;
import com.davisodom.settlementsim.economy.ResourceType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;
import java.util.logging.Logger;

/**
 * Loads the structure catalog from a YAML document.
 *
 * Document layout:
 * - {@code version}: integer table version
 * - {@code structures}: list of definitions, each with optional inline {@code staffing}
 * - {@code biomes}: map of biome name to per-resource efficiency
 *
 * Each structure entry is checked against {@code schemas/structure.json} first. Invalid entries
 * are logged and skipped; the rest of the catalog still loads.
 */
public class YamlStructureCatalog implements StructureCatalog {

    public static final String DEFAULT_RESOURCE = "catalog/structures.yml";

    private final Logger logger;
    private final ObjectMapper yamlMapper;
    private CatalogSchemaValidator validator;
    private final Map<String, StructureDefinition> definitions = new LinkedHashMap<>();
    private final Map<String, StaffingRequirement> staffing = new LinkedHashMap<>();
    private final Map<String, BiomeEfficiency> biomes = new LinkedHashMap<>();
    private int version;

    public YamlStructureCatalog(Logger logger) {
        this.logger = logger;
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    /**
     * Load the catalog bundled on the classpath.
     */
    public YamlStructureCatalog loadFromClasspath(String resource) throws IOException {
        try (InputStream in = YamlStructureCatalog.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Catalog resource not found: " + resource);
            }
            return load(in);
        }
    }

    public synchronized YamlStructureCatalog load(InputStream in) throws IOException {
        if (validator == null) {
            validator = new CatalogSchemaValidator(CatalogSchemaValidator.STRUCTURE_SCHEMA);
        }
        JsonNode root = yamlMapper.readTree(in);
        definitions.clear();
        staffing.clear();
        biomes.clear();
        version = root.path("version").asInt(1);

        for (JsonNode node : root.path("structures")) {
            List<String> violations = validator.validate(node);
            if (!violations.isEmpty()) {
                logger.warning(String.format("Skipping structure definition %s: %s",
                        node.path("id").asText("?"), String.join("; ", violations)));
                continue;
            }
            try {
                StructureDefinition definition = parseDefinition(node);
                definitions.put(definition.getId(), definition);
                JsonNode staffingNode = node.path("staffing");
                if (staffingNode.isObject()) {
                    staffing.put(definition.getId(), new StaffingRequirement(
                            definition.getId(),
                            staffingNode.path("required").asInt(0),
                            staffingNode.path("optional").asInt(0),
                            staffingNode.path("bonusPerWorker").asDouble(0.0),
                            staffingNode.path("priority").asInt(0)));
                }
            } catch (IllegalArgumentException | NullPointerException e) {
                logger.warning("Skipping invalid structure definition " + node.path("id").asText("?") + ": " + e.getMessage());
            }
        }

        Iterator<Map.Entry<String, JsonNode>> biomeFields = root.path("biomes").fields();
        while (biomeFields.hasNext()) {
            Map.Entry<String, JsonNode> entry = biomeFields.next();
            EnumMap<ResourceType, Double> efficiency = new EnumMap<>(ResourceType.class);
            Iterator<Map.Entry<String, JsonNode>> values = entry.getValue().fields();
            while (values.hasNext()) {
                Map.Entry<String, JsonNode> value = values.next();
                efficiency.put(ResourceType.fromId(value.getKey()), value.getValue().asDouble(1.0));
            }
            String biome = entry.getKey().toUpperCase(Locale.ROOT);
            biomes.put(biome, new BiomeEfficiency(biome, efficiency));
        }

        logger.info(String.format("Loaded structure catalog v%d: %d definition(s), %d biome(s)",
                version, definitions.size(), biomes.size()));
        return this;
    }

    private static StructureDefinition parseDefinition(JsonNode node) {
        StructureDefinition.Builder builder = new StructureDefinition.Builder()
                .id(node.path("id").asText(null))
                .name(node.path("name").asText(null))
                .category(StructureCategory.valueOf(node.path("category").asText("BUILDING").toUpperCase(Locale.ROOT)))
                .buildingType(node.path("buildingType").asText(null))
                .constructionMillis(node.path("constructionSeconds").asLong(600) * 1000L)
                .tier(node.path("tier").asInt(1))
                .maxLevel(node.path("maxLevel").asInt(1))
                .populationRequired(node.path("populationRequired").asInt(0))
                .areaCost(node.path("areaCost").asInt(0))
                .unique(node.path("unique").asBoolean(false));

        if (node.hasNonNull("produces")) {
            builder.producedResource(ResourceType.fromId(node.get("produces").asText()));
        }

        ResourceAmounts.Builder costs = ResourceAmounts.builder();
        Iterator<Map.Entry<String, JsonNode>> costFields = node.path("costs").fields();
        while (costFields.hasNext()) {
            Map.Entry<String, JsonNode> cost = costFields.next();
            costs.units(ResourceType.fromId(cost.getKey()), cost.getValue().asDouble());
        }
        builder.costs(costs.build());

        for (JsonNode prereq : node.path("prerequisites")) {
            if (prereq.hasNonNull("research")) {
                builder.prerequisite(Prerequisite.research(prereq.get("research").asText()));
            } else {
                builder.prerequisite(Prerequisite.structure(prereq.path("structure").asText(),
                        prereq.path("level").asInt(1)));
            }
        }

        JsonNode modifiers = node.path("modifiers");
        builder.populationCapacity(modifiers.path("populationCapacity").asInt(0))
                .storageCapacity(modifiers.path("storageCapacity").asInt(0))
                .shelterCapacity(modifiers.path("shelterCapacity").asInt(0))
                .defenseRating(modifiers.path("defense").asInt(0))
                .moraleBonus(modifiers.path("morale").asInt(0));

        return builder.build();
    }

    @Override
    public synchronized Optional<StructureDefinition> findDefinition(String structureId) {
        return Optional.ofNullable(definitions.get(structureId));
    }

    @Override
    public synchronized Collection<StructureDefinition> allDefinitions() {
        return Collections.unmodifiableCollection(new ArrayList<>(definitions.values()));
    }

    @Override
    public synchronized BiomeEfficiency biomeEfficiency(String biome) {
        if (biome == null) {
            return BiomeEfficiency.neutral("UNKNOWN");
        }
        BiomeEfficiency efficiency = biomes.get(biome.toUpperCase(Locale.ROOT));
        return efficiency != null ? efficiency : BiomeEfficiency.neutral(biome);
    }

    @Override
    public synchronized Optional<StaffingRequirement> staffingRequirement(String structureId) {
        return Optional.ofNullable(staffing.get(structureId));
    }

    @Override
    public synchronized int getVersion() {
        return version;
    }
}
