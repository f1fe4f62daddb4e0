package io.fleetplan.core.plan;

/**
 * Flattened view of one ordered plan entry, for presenting a plan to a human
 * or asserting on it in tests.
 */
public record PlanRecord(
        String node,
        String service,
        PlanAction action,
        String instanceId,
        String image,
        String shard
) {
    static PlanRecord of(PlanEntry e) {
        return new PlanRecord(e.nodeId(), e.service(), e.action(), e.instanceId(), e.image(), e.shard());
    }
}
