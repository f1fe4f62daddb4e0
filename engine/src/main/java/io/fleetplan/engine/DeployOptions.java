package io.fleetplan.engine;

import io.fleetplan.core.NodeIds;
import io.fleetplan.core.plan.PlanEntry;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Placement parameters for one new instance.
 *
 * @param nodeId  target node, or null to let the provisioner choose
 * @param shard   shard for sharded services, otherwise null
 * @param imageId image to deploy
 */
public record DeployOptions(String nodeId, String shard, String imageId) {

    public DeployOptions {
        Objects.requireNonNull(imageId, "imageId");
    }

    /** Options for a provision entry; the {@code <any>} node becomes "no preference". */
    public static DeployOptions forEntry(PlanEntry entry) {
        String node = NodeIds.isAny(entry.nodeId()) ? null : entry.nodeId();
        return new DeployOptions(node, entry.shard(), entry.image());
    }

    /** Wire names of the set fields, in a stable order. */
    public Map<String, String> params() {
        Map<String, String> out = new LinkedHashMap<>();
        if (nodeId != null) {
            out.put("server_uuid", nodeId);
        }
        if (shard != null) {
            out.put("shard", shard);
        }
        out.put("image_uuid", imageId);
        return out;
    }
}
