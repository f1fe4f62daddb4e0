// file: core/src/main/java/io/fleetplan/core/DesiredConfigurationReader.java
package io.fleetplan.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parses operator-supplied desired configuration documents.
 * <p>
 * Two shapes are accepted:
 * <pre>
 *   nested (default):
 *     { "cn001": { "webapi": { "img-a": 3 },
 *                  "moray":  { "1": { "img-b": 2 } } } }
 *
 *   list (announced by "metadata": { "v": 2 }):
 *     { "metadata": { "v": 2 },
 *       "cn001": { "moray": [ { "shard": "1", "image_uuid": "img-b", "count": 2 } ] } }
 * </pre>
 * Shards are opaque tokens and are always kept as strings.
 */
public final class DesiredConfigurationReader {

    private static final String METADATA = "metadata";

    private final ObjectMapper mapper = new ObjectMapper();
    private final ServiceCatalog catalog;

    public DesiredConfigurationReader(ServiceCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public DesiredConfiguration read(Path path) {
        String contents;
        try {
            contents = Files.readString(path);
        } catch (IOException e) {
            throw new UncheckedIOException("reading \"" + path + "\"", e);
        }
        try {
            return parse(contents);
        } catch (PlanValidationException e) {
            throw new PlanValidationException("processing \"" + path + "\": " + e.getMessage(), e);
        }
    }

    /**
     * @throws PlanValidationException if the document is not valid JSON or does not have a supported shape
     */
    public DesiredConfiguration parse(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new PlanValidationException("invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new PlanValidationException("desired configuration must be a JSON object");
        }

        int version = version(root.get(METADATA));
        Map<String, Map<String, ServiceConfiguration>> byNode = new LinkedHashMap<>();

        Iterator<Map.Entry<String, JsonNode>> nodes = root.fields();
        while (nodes.hasNext()) {
            var nodeEntry = nodes.next();
            String nodeId = nodeEntry.getKey();
            if (METADATA.equals(nodeId)) {
                continue;
            }
            JsonNode services = nodeEntry.getValue();
            if (!services.isObject()) {
                throw new PlanValidationException(nodeId + ": expected an object of services");
            }

            Map<String, ServiceConfiguration> svcMap = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> svcs = services.fields();
            while (svcs.hasNext()) {
                var svcEntry = svcs.next();
                String svc = svcEntry.getKey();
                String path = nodeId + "." + svc;
                if (!catalog.isValid(svc)) {
                    throw new PlanValidationException(path + ": unrecognized service: \"" + svc + "\"");
                }
                List<ConfigField> fields = catalog.configFields(svc);
                var builder = ServiceConfiguration.builder(fields);
                if (version == 1) {
                    readNested(svcEntry.getValue(), fields, new String[fields.size()], 0, path, builder);
                } else {
                    readList(svcEntry.getValue(), fields, path, builder);
                }
                svcMap.put(svc, builder.build());
            }
            byNode.put(nodeId, svcMap);
        }

        return DesiredConfiguration.of(catalog, byNode);
    }

    private static int version(JsonNode metadata) {
        if (metadata == null) {
            return 1;
        }
        JsonNode v = metadata.get("v");
        if (!metadata.isObject() || v == null || !v.canConvertToInt()) {
            throw new PlanValidationException("metadata: expected { \"v\": <version> }");
        }
        int version = v.asInt();
        if (version != 1 && version != 2) {
            throw new PlanValidationException("metadata: unsupported configuration version " + version);
        }
        return version;
    }

    private static void readNested(
            JsonNode node,
            List<ConfigField> fields,
            String[] values,
            int depth,
            String path,
            ServiceConfiguration.Builder builder
    ) {
        if (!node.isObject()) {
            throw new PlanValidationException(path + ": expected an object keyed by "
                    + fields.get(depth).externalName());
        }
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            var e = it.next();
            values[depth] = e.getKey();
            String childPath = path + "." + e.getKey();
            if (depth == fields.size() - 1) {
                builder.incr(ConfigKey.of(values.clone()), count(e.getValue(), childPath));
            } else {
                readNested(e.getValue(), fields, values, depth + 1, childPath, builder);
            }
        }
    }

    private static void readList(
            JsonNode node,
            List<ConfigField> fields,
            String path,
            ServiceConfiguration.Builder builder
    ) {
        if (!node.isArray()) {
            throw new PlanValidationException(path + ": expected an array of configurations");
        }
        for (int i = 0; i < node.size(); i++) {
            JsonNode row = node.get(i);
            String rowPath = path + "[" + i + "]";
            if (!row.isObject()) {
                throw new PlanValidationException(rowPath + ": expected an object");
            }
            String[] values = new String[fields.size()];
            for (int f = 0; f < fields.size(); f++) {
                String name = fields.get(f).externalName();
                JsonNode v = row.get(name);
                if (v == null || !v.isValueNode() || v.isNull() || v.asText().isEmpty()) {
                    throw new PlanValidationException(rowPath + ": missing \"" + name + "\"");
                }
                values[f] = v.asText();
            }
            JsonNode count = row.get("count");
            if (count == null) {
                throw new PlanValidationException(rowPath + ": missing \"count\"");
            }
            builder.incr(ConfigKey.of(values), count(count, rowPath + ".count"));
        }
    }

    private static int count(JsonNode n, String path) {
        if (!n.isIntegralNumber() || !n.canConvertToInt()) {
            throw new PlanValidationException(path + ": count must be an integer");
        }
        int c = n.intValue();
        if (c < 0) {
            throw new PlanValidationException(path + ": count must be >= 0");
        }
        return c;
    }
}
