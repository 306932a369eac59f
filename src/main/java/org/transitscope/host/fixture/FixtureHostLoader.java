package org.transitscope.host.fixture;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.transitscope.host.ComponentKind;
import org.transitscope.host.EntityKind;
import org.transitscope.host.HostValues;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads a {@link FixtureHostApi} from a JSON document.
 * <p>
 * Expected shape:
 * <pre>
 * {
 *   "game_time": { "date": { "year": 1900 } },
 *   "functions": [ ... ],              // optional, replaces the default function set
 *   "failing": [ ... ],                // optional
 *   "entity_types": { "VEHICLE": 1 },  // optional
 *   "component_types": { ... },        // optional
 *   "entities": { "station": [ { "id": 10, "name": "Central", ... } ], ... },
 *   "components": { "track_edge": [ { "id": 500, ... } ], ... }
 * }
 * </pre>
 * Entity and component group names are the lower-case {@link EntityKind} and
 * {@link ComponentKind} names. Every record needs a positive numeric {@code id}.
 */
public class FixtureHostLoader {

    private static final Logger log = LoggerFactory.getLogger(FixtureHostLoader.class);
    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public FixtureHostLoader() {
        this(new ObjectMapper());
    }

    public FixtureHostLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loads a fixture from a file.
     *
     * @param file The fixture file.
     * @return The fixture host.
     * @throws FixtureLoadException if the file is unreadable or malformed.
     */
    public FixtureHostApi load(Path file) throws FixtureLoadException {
        if (!Files.isRegularFile(file)) {
            throw new FixtureLoadException("Fixture file not found: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            FixtureHostApi host = load(in);
            log.info("Loaded host fixture from {}", file);
            return host;
        } catch (IOException e) {
            throw new FixtureLoadException("Failed to read fixture file " + file + ": " + e.getMessage(), e);
        }
    }

    public FixtureHostApi load(InputStream in) throws FixtureLoadException {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new FixtureLoadException("Fixture is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new FixtureLoadException("Failed to read fixture: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new FixtureLoadException("Fixture root must be a JSON object");
        }
        return parse(root);
    }

    private FixtureHostApi parse(JsonNode root) throws FixtureLoadException {
        FixtureHostApi.Builder builder = FixtureHostApi.builder();

        if (root.hasNonNull("game_time")) {
            builder.gameTime(objectMapper.convertValue(root.get("game_time"), Object.class));
        }
        if (root.has("functions")) {
            builder.functions(Set.copyOf(stringList(root.get("functions"), "functions")));
        }
        if (root.has("failing")) {
            for (String function : stringList(root.get("failing"), "failing")) {
                builder.failing(function);
            }
        }
        if (root.has("entity_types")) {
            builder.entityTypes(record(root.get("entity_types"), "entity_types"));
        }
        if (root.has("component_types")) {
            builder.componentTypes(record(root.get("component_types"), "component_types"));
        }

        JsonNode entities = root.path("entities");
        Iterator<Map.Entry<String, JsonNode>> groups = entities.fields();
        while (groups.hasNext()) {
            Map.Entry<String, JsonNode> group = groups.next();
            EntityKind kind = enumValue(EntityKind.class, group.getKey(), "entities");
            for (JsonNode node : group.getValue()) {
                Map<String, Object> record = record(node, "entities." + group.getKey());
                builder.entity(kind, requireId(record, group.getKey()), record);
            }
        }

        JsonNode components = root.path("components");
        Iterator<Map.Entry<String, JsonNode>> componentGroups = components.fields();
        while (componentGroups.hasNext()) {
            Map.Entry<String, JsonNode> group = componentGroups.next();
            ComponentKind kind = enumValue(ComponentKind.class, group.getKey(), "components");
            for (JsonNode node : group.getValue()) {
                Map<String, Object> record = record(node, "components." + group.getKey());
                builder.component(kind, requireId(record, group.getKey()), record);
            }
        }
        return builder.build();
    }

    private Map<String, Object> record(JsonNode node, String where) throws FixtureLoadException {
        if (!node.isObject()) {
            throw new FixtureLoadException("Expected an object in '" + where + "' but found " + node.getNodeType());
        }
        return objectMapper.convertValue(node, RECORD_TYPE);
    }

    private static List<String> stringList(JsonNode node, String where) throws FixtureLoadException {
        if (!node.isArray()) {
            throw new FixtureLoadException("'" + where + "' must be an array of function names");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            values.add(element.asText());
        }
        return values;
    }

    private static long requireId(Map<String, Object> record, String group) throws FixtureLoadException {
        long id = HostValues.safeInt(record.get("id"));
        if (id <= 0) {
            throw new FixtureLoadException("Record in '" + group + "' has no positive numeric id: " + record);
        }
        return id;
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String name, String where)
            throws FixtureLoadException {
        try {
            return Enum.valueOf(type, name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new FixtureLoadException("Unknown group '" + name + "' in '" + where + "'", e);
        }
    }
}
