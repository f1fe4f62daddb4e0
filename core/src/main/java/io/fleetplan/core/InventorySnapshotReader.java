package io.fleetplan.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Loads a snapshot of deployed instances exported from the datacenter's
 * inventory, in place of live discovery.
 * <p>
 * Format: a JSON array of
 * <pre>
 *   { "uuid": "...", "service": "moray", "server_uuid": "cn001",
 *     "shard": "1", "image_uuid": "img-b" }
 * </pre>
 * {@code server_uuid}, {@code shard} and {@code image_uuid} may be null or absent.
 */
public final class InventorySnapshotReader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ServiceCatalog catalog;

    public InventorySnapshotReader(ServiceCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public DeployedState read(Path path) {
        List<InstanceDto> rows;
        try {
            rows = MAPPER.readValue(path.toFile(), InstanceDto.TYPE_REF);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load inventory snapshot from " + path, e);
        }
        return toState(rows);
    }

    public DeployedState parse(String json) {
        List<InstanceDto> rows;
        try {
            rows = MAPPER.readValue(json, InstanceDto.TYPE_REF);
        } catch (IOException e) {
            throw new IllegalArgumentException("invalid inventory snapshot: " + e.getMessage(), e);
        }
        return toState(rows);
    }

    private DeployedState toState(List<InstanceDto> rows) {
        List<DeployedInstance> instances = new ArrayList<>(rows == null ? 0 : rows.size());
        if (rows != null) {
            for (InstanceDto r : rows) {
                if (r.uuid == null || r.service == null) {
                    throw new IllegalArgumentException("inventory row missing \"uuid\" or \"service\"");
                }
                instances.add(new DeployedInstance(r.uuid, r.service, r.serverUuid, r.shard, r.imageUuid));
            }
        }
        return DeployedState.fromInstances(catalog, instances);
    }

    // ---------- JSON DTO ----------

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class InstanceDto {
        static final TypeReference<List<InstanceDto>> TYPE_REF = new TypeReference<>() {};

        final String uuid;
        final String service;
        final String serverUuid;
        final String shard;
        final String imageUuid;

        @JsonCreator
        InstanceDto(
                @JsonProperty("uuid") String uuid,
                @JsonProperty("service") String service,
                @JsonProperty("server_uuid") String serverUuid,
                @JsonProperty("shard") String shard,
                @JsonProperty("image_uuid") String imageUuid
        ) {
            this.uuid = uuid;
            this.service = service;
            this.serverUuid = serverUuid;
            this.shard = shard;
            this.imageUuid = imageUuid;
        }
    }
}
