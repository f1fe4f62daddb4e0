// file: core/src/main/java/io/fleetplan/core/plan/PlanOrderer.java
package io.fleetplan.core.plan;

import io.fleetplan.core.ConfigKey;
import io.fleetplan.core.DeployedInstance;
import io.fleetplan.core.DeployedState;
import io.fleetplan.core.NodeIds;
import io.fleetplan.core.ServiceCatalog;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns one (service, node) list of raw entries into a safe execution order.
 * <p>
 * Steps, per partition of the config key (everything but the image, i.e. the
 * shard for sharded services):
 *  1. Split into FIFO provision and deprovision queues.
 *  2. Bind every deprovision to a concrete instance: the first not-yet-bound
 *     instance in the sorted flattened list with the same service, key and
 *     node (any node for {@link NodeIds#ANY}).
 *  3. While fusion is allowed, replace provision + deprovision pairs with one
 *     reprovision.
 *  4. Alternate the rest, provision first, so capacity never drops to zero
 *     and never doubles.
 *  5. Append leftover provisions, then leftover deprovisions.
 * <p>
 * One orderer is used for a whole planning run: an instance is bound at most
 * once across every list it orders.
 */
public final class PlanOrderer {

    private final ServiceCatalog catalog;
    private final List<DeployedInstance> instances;
    private final Set<String> consumed = new HashSet<>();

    public PlanOrderer(DeployedState deployed) {
        Objects.requireNonNull(deployed, "deployed");
        this.catalog = deployed.catalog();
        this.instances = deployed.instances();
    }

    public List<PlanEntry> order(String service, String nodeId, List<PlanEntry> entries, boolean allowReprovision) {
        Map<List<String>, List<PlanEntry>> partitions = new LinkedHashMap<>();
        for (PlanEntry e : entries) {
            if (!e.service().equals(service) || !e.nodeId().equals(nodeId)) {
                throw new IllegalArgumentException(
                        "entry " + e + " does not belong to " + service + " on " + nodeId);
            }
            if (e.action() == PlanAction.REPROVISION) {
                throw new IllegalArgumentException("entries are already ordered: " + e);
            }
            partitions.computeIfAbsent(e.key().partition(), k -> new ArrayList<>()).add(e);
        }

        List<PlanEntry> out = new ArrayList<>(entries.size());
        for (List<PlanEntry> partition : partitions.values()) {
            out.addAll(orderPartition(partition, allowReprovision));
        }
        return out;
    }

    private List<PlanEntry> orderPartition(List<PlanEntry> entries, boolean allowReprovision) {
        Deque<PlanEntry> provisions = new ArrayDeque<>();
        Deque<PlanEntry> deprovisions = new ArrayDeque<>();
        for (PlanEntry e : entries) {
            if (e.action() == PlanAction.PROVISION) {
                provisions.addLast(e);
            } else {
                deprovisions.addLast(bind(e));
            }
        }

        List<PlanEntry> out = new ArrayList<>(entries.size());
        while (allowReprovision && !provisions.isEmpty() && !deprovisions.isEmpty()) {
            PlanEntry p = provisions.removeFirst();
            PlanEntry d = deprovisions.removeFirst();
            checkPair(p, d);
            out.add(PlanEntry.reprovision(p, d));
        }

        while (!provisions.isEmpty() && !deprovisions.isEmpty()) {
            PlanEntry p = provisions.removeFirst();
            PlanEntry d = deprovisions.removeFirst();
            checkPair(p, d);
            out.add(p);
            out.add(d);
        }

        out.addAll(provisions);
        out.addAll(deprovisions);
        return out;
    }

    private PlanEntry bind(PlanEntry deprovision) {
        String service = deprovision.service();
        ConfigKey key = deprovision.key();
        boolean anyNode = NodeIds.isAny(deprovision.nodeId());
        var fields = catalog.configFields(service);

        for (DeployedInstance inst : instances) {
            if (!inst.counted() || !inst.service().equals(service)) {
                continue;
            }
            if (consumed.contains(inst.instanceId())) {
                continue;
            }
            if (!anyNode && !deprovision.nodeId().equals(inst.nodeId())) {
                continue;
            }
            if (!inst.key(fields).equals(key)) {
                continue;
            }
            consumed.add(inst.instanceId());
            return deprovision.boundTo(inst.instanceId());
        }
        throw new IllegalStateException("no remaining instance of " + service + " " + key
                + " on " + deprovision.nodeId() + " to deprovision");
    }

    private static void checkPair(PlanEntry p, PlanEntry d) {
        if (!p.nodeId().equals(d.nodeId())
                || !p.service().equals(d.service())
                || !p.key().partition().equals(d.key().partition())
                || !d.isBound()) {
            throw new IllegalStateException("cannot pair " + p + " with " + d);
        }
    }
}
