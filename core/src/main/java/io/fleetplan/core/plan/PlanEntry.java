// file: core/src/main/java/io/fleetplan/core/plan/PlanEntry.java
package io.fleetplan.core.plan;

import io.fleetplan.core.ConfigKey;

import java.util.Objects;

/**
 * One queued action against one service on one node.
 * <p>
 * Lifecycle:
 *  - The generator emits unbound PROVISION and DEPROVISION entries.
 *  - The orderer binds each DEPROVISION to a concrete instance, and may fuse a
 *    PROVISION + DEPROVISION pair into a single REPROVISION.
 * <p>
 * For REPROVISION the key carries the new image and {@code reason} is the
 * provision's reason; {@code oldImage} and {@code oldReason} come from the
 * deprovision it replaced.
 *
 * @param nodeId     target node, or {@link io.fleetplan.core.NodeIds#ANY}
 * @param service    service name
 * @param key        config key (image last)
 * @param action     what to do
 * @param reason     why, e.g. "more wanted"
 * @param instanceId bound instance (deprovision/reprovision), null until bound
 * @param oldImage   image being replaced (reprovision only)
 * @param oldReason  reason of the fused deprovision (reprovision only)
 */
public record PlanEntry(
        String nodeId,
        String service,
        ConfigKey key,
        PlanAction action,
        String reason,
        String instanceId,
        String oldImage,
        String oldReason
) {
    public PlanEntry {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(service, "service");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(reason, "reason");
        if (action == PlanAction.REPROVISION && (instanceId == null || oldImage == null)) {
            throw new IllegalArgumentException("reprovision requires an instance and an old image");
        }
    }

    public static PlanEntry provision(String nodeId, String service, ConfigKey key, String reason) {
        return new PlanEntry(nodeId, service, key, PlanAction.PROVISION, reason, null, null, null);
    }

    public static PlanEntry deprovision(String nodeId, String service, ConfigKey key, String reason) {
        return new PlanEntry(nodeId, service, key, PlanAction.DEPROVISION, reason, null, null, null);
    }

    /**
     * Fuse a provision and a bound deprovision of the same node, service and
     * shard into one in-place image swap.
     */
    public static PlanEntry reprovision(PlanEntry provision, PlanEntry deprovision) {
        return new PlanEntry(
                provision.nodeId,
                provision.service,
                provision.key,
                PlanAction.REPROVISION,
                provision.reason,
                deprovision.instanceId,
                deprovision.key.image(),
                deprovision.reason
        );
    }

    /** Copy of this deprovision bound to {@code instance}. */
    public PlanEntry boundTo(String instance) {
        if (action != PlanAction.DEPROVISION) {
            throw new IllegalStateException("only deprovisions are bound to instances: " + this);
        }
        return new PlanEntry(nodeId, service, key, action, reason,
                Objects.requireNonNull(instance, "instance"), null, null);
    }

    public boolean isBound() {
        return instanceId != null;
    }

    /** Shard of a sharded service, otherwise null. */
    public String shard() {
        return key.partition().isEmpty() ? null : key.get(0);
    }

    /** Image the action targets (the new image for a reprovision). */
    public String image() {
        return key.image();
    }

    public String newImage() {
        return action == PlanAction.REPROVISION ? key.image() : null;
    }

    public String newReason() {
        return action == PlanAction.REPROVISION ? reason : null;
    }
}
