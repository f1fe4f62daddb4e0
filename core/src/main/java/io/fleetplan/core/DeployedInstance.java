package io.fleetplan.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One real, currently-known service instance.
 *
 * @param instanceId unique instance identifier
 * @param service    service name
 * @param nodeId     compute node hosting the instance, or null if it is not placed in this datacenter
 * @param shard      shard identifier for sharded services, otherwise null
 * @param image      image the instance runs, or null if unknown
 */
public record DeployedInstance(
        String instanceId,
        String service,
        String nodeId,
        String shard,
        String image
) {
    /** Placeholder used in keys when a sharded instance carries no shard. */
    public static final String UNKNOWN = "-";

    public DeployedInstance {
        Objects.requireNonNull(instanceId, "instanceId");
        Objects.requireNonNull(service, "service");
        if (instanceId.isBlank()) throw new IllegalArgumentException("instanceId must not be blank");
    }

    /** Whether this instance contributes to the deployed counts. */
    public boolean counted() {
        return image != null;
    }

    public ConfigKey key(List<ConfigField> fields) {
        List<String> values = new ArrayList<>(fields.size());
        for (ConfigField f : fields) {
            switch (f) {
                case SHARD -> values.add(shard != null ? shard : UNKNOWN);
                case IMAGE -> values.add(image != null ? image : UNKNOWN);
            }
        }
        return ConfigKey.of(values);
    }
}
