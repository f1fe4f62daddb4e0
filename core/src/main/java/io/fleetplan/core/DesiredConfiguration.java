// file: core/src/main/java/io/fleetplan/core/DesiredConfiguration.java
package io.fleetplan.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Operator-declared target: node id -> service name -> instance counts.
 * <p>
 * The node id may be the sentinel {@link NodeIds#ANY}, deferring placement to
 * the provisioning backend. A tree is either all-sentinel or all-concrete.
 */
public final class DesiredConfiguration {

    private final Map<String, Map<String, ServiceConfiguration>> byNode;

    private DesiredConfiguration(Map<String, Map<String, ServiceConfiguration>> byNode) {
        this.byNode = byNode;
    }

    /**
     * Validate and freeze a desired tree.
     *
     * @throws PlanValidationException if a service is unknown, a multiset's
     *                                 fields do not match the service, or the
     *                                 sentinel node is combined with concrete nodes
     */
    public static DesiredConfiguration of(
            ServiceCatalog catalog,
            Map<String, Map<String, ServiceConfiguration>> byNode
    ) {
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(byNode, "byNode");

        Map<String, Map<String, ServiceConfiguration>> copy = new LinkedHashMap<>();
        for (var nodeEntry : byNode.entrySet()) {
            String nodeId = nodeEntry.getKey();
            if (nodeId == null || nodeId.isBlank()) {
                throw new PlanValidationException("node id must not be blank");
            }
            Map<String, ServiceConfiguration> services = new LinkedHashMap<>();
            for (var svcEntry : nodeEntry.getValue().entrySet()) {
                String svc = svcEntry.getKey();
                if (!catalog.isValid(svc)) {
                    throw new PlanValidationException(
                            "node \"" + nodeId + "\": unrecognized service: \"" + svc + "\"");
                }
                ServiceConfiguration sc = Objects.requireNonNull(svcEntry.getValue(), "configuration");
                if (!sc.fields().equals(catalog.configFields(svc))) {
                    throw new PlanValidationException(
                            "node \"" + nodeId + "\", service \"" + svc + "\": expected fields "
                                    + catalog.configFields(svc) + " but got " + sc.fields());
                }
                services.put(svc, sc);
            }
            copy.put(nodeId, Collections.unmodifiableMap(services));
        }

        if (copy.containsKey(NodeIds.ANY) && copy.size() > 1) {
            throw new PlanValidationException(
                    "cannot combine \"" + NodeIds.ANY + "\" with specific compute nodes");
        }
        return new DesiredConfiguration(Collections.unmodifiableMap(copy));
    }

    public Set<String> nodes() {
        return byNode.keySet();
    }

    public boolean hasNode(String nodeId) {
        return byNode.containsKey(nodeId);
    }

    public boolean usesAnyNode() {
        return byNode.containsKey(NodeIds.ANY);
    }

    /** Services declared for {@code nodeId}, in declaration order (empty if the node is absent). */
    public Map<String, ServiceConfiguration> services(String nodeId) {
        return byNode.getOrDefault(nodeId, Map.of());
    }

    public ServiceConfiguration configuration(String nodeId, String service) {
        return services(nodeId).get(service);
    }

    /** Nested plain-map view in the configuration-file format. */
    public Map<String, Object> legacySummary() {
        Map<String, Object> out = new LinkedHashMap<>();
        byNode.forEach((node, services) -> {
            Map<String, Object> svcs = new LinkedHashMap<>();
            services.forEach((svc, sc) -> svcs.put(svc, sc.legacySummary()));
            out.put(node, svcs);
        });
        return out;
    }
}
