// file: core/src/main/java/io/fleetplan/core/DeployedState.java
package io.fleetplan.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Snapshot of what is actually deployed, in the shapes the planner needs.
 * <p>
 * Responsibilities:
 *  - One datacenter-wide {@link ServiceConfiguration} per service.
 *  - One {@link ServiceConfiguration} per (service, compute node).
 *  - The flattened instance list, stably sorted by service, then the service's
 *    key fields, then instance id. Deprovisions are bound to instances by
 *    scanning this list in order, so a stable sort keeps repeated plans
 *    identical.
 * <p>
 * Everything is resolved once at construction and is read-only afterwards.
 */
public final class DeployedState {

    private final ServiceCatalog catalog;
    private final List<DeployedInstance> instances;
    private final Map<String, ServiceConfiguration> byService;
    private final Map<String, Map<String, ServiceConfiguration>> byServiceAndNode;

    private DeployedState(
            ServiceCatalog catalog,
            List<DeployedInstance> instances,
            Map<String, ServiceConfiguration> byService,
            Map<String, Map<String, ServiceConfiguration>> byServiceAndNode
    ) {
        this.catalog = catalog;
        this.instances = instances;
        this.byService = byService;
        this.byServiceAndNode = byServiceAndNode;
    }

    public static DeployedState empty(ServiceCatalog catalog) {
        return fromInstances(catalog, List.of());
    }

    /**
     * Build the global and per-node multisets from a list of instances.
     *
     * @throws IllegalArgumentException if an instance belongs to a service missing from the catalog,
     *                                  or an instance id appears twice
     */
    public static DeployedState fromInstances(ServiceCatalog catalog, List<DeployedInstance> raw) {
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(raw, "instances");

        Set<String> seen = new LinkedHashSet<>();
        for (DeployedInstance inst : raw) {
            if (!catalog.isValid(inst.service())) {
                throw new IllegalArgumentException(
                        "instance " + inst.instanceId() + " has unrecognized service \"" + inst.service() + "\"");
            }
            if (!seen.add(inst.instanceId())) {
                throw new IllegalArgumentException("duplicate instance id: " + inst.instanceId());
            }
        }

        List<DeployedInstance> sorted = new ArrayList<>(raw);
        sorted.sort(instanceOrder(catalog));

        Map<String, ServiceConfiguration.Builder> global = new LinkedHashMap<>();
        Map<String, Map<String, ServiceConfiguration.Builder>> perNode = new LinkedHashMap<>();
        for (String svc : catalog.names()) {
            global.put(svc, ServiceConfiguration.builder(catalog.configFields(svc)));
            perNode.put(svc, new LinkedHashMap<>());
        }

        for (DeployedInstance inst : sorted) {
            if (!inst.counted()) {
                continue;
            }
            List<ConfigField> fields = catalog.configFields(inst.service());
            ConfigKey key = inst.key(fields);
            global.get(inst.service()).incr(key);
            if (inst.nodeId() != null) {
                perNode.get(inst.service())
                        .computeIfAbsent(inst.nodeId(), n -> ServiceConfiguration.builder(fields))
                        .incr(key);
            }
        }

        Map<String, ServiceConfiguration> byService = new LinkedHashMap<>();
        global.forEach((svc, b) -> byService.put(svc, b.build()));
        Map<String, Map<String, ServiceConfiguration>> byServiceAndNode = new LinkedHashMap<>();
        perNode.forEach((svc, nodes) -> {
            Map<String, ServiceConfiguration> built = new LinkedHashMap<>();
            nodes.forEach((node, b) -> built.put(node, b.build()));
            byServiceAndNode.put(svc, Collections.unmodifiableMap(built));
        });

        return new DeployedState(
                catalog,
                List.copyOf(sorted),
                Collections.unmodifiableMap(byService),
                Collections.unmodifiableMap(byServiceAndNode)
        );
    }

    /**
     * Order used for the flattened instance list: canonical service order, then
     * each key field, then instance id.
     */
    static Comparator<DeployedInstance> instanceOrder(ServiceCatalog catalog) {
        return (a, b) -> {
            int c = Integer.compare(catalog.ordinal(a.service()), catalog.ordinal(b.service()));
            if (c != 0) return c;
            List<ConfigField> fields = catalog.configFields(a.service());
            List<String> ka = a.key(fields).values();
            List<String> kb = b.key(fields).values();
            for (int i = 0; i < ka.size(); i++) {
                c = ka.get(i).compareTo(kb.get(i));
                if (c != 0) return c;
            }
            return a.instanceId().compareTo(b.instanceId());
        };
    }

    public ServiceCatalog catalog() {
        return catalog;
    }

    /** Flattened, stably sorted instances (including uncounted ones). */
    public List<DeployedInstance> instances() {
        return instances;
    }

    /** Datacenter-wide counts for {@code service}; empty if nothing is deployed. */
    public ServiceConfiguration global(String service) {
        ServiceConfiguration sc = byService.get(service);
        return sc != null ? sc : ServiceConfiguration.empty(catalog.configFields(service));
    }

    /** Counts for {@code service} on {@code nodeId}; empty if nothing is deployed there. */
    public ServiceConfiguration onNode(String service, String nodeId) {
        Map<String, ServiceConfiguration> nodes = byServiceAndNode.get(service);
        ServiceConfiguration sc = nodes == null ? null : nodes.get(nodeId);
        return sc != null ? sc : ServiceConfiguration.empty(catalog.configFields(service));
    }

    public boolean hasOnNode(String service, String nodeId) {
        Map<String, ServiceConfiguration> nodes = byServiceAndNode.get(service);
        return nodes != null && nodes.containsKey(nodeId);
    }

    /** Nodes running at least one counted instance of {@code service}. */
    public Set<String> nodesFor(String service) {
        Map<String, ServiceConfiguration> nodes = byServiceAndNode.get(service);
        return nodes == null ? Set.of() : nodes.keySet();
    }

    /** Every node running at least one counted instance, in first-seen order. */
    public Set<String> nodes() {
        Set<String> out = new LinkedHashSet<>();
        for (Map<String, ServiceConfiguration> nodes : byServiceAndNode.values()) {
            out.addAll(nodes.keySet());
        }
        return out;
    }

    /**
     * Deployed configuration in the desired-configuration file shape:
     * {@code {node: {service: {[shard:] {image: count}}}}}, nodes sorted,
     * services in canonical order.
     */
    public Map<String, Object> exportByNode() {
        Map<String, Map<String, Object>> out = new TreeMap<>();
        byServiceAndNode.forEach((svc, nodes) -> nodes.forEach((node, sc) ->
                out.computeIfAbsent(node, n -> new LinkedHashMap<>()).put(svc, sc.legacySummary())));
        return new LinkedHashMap<>(out);
    }
}
