// file: core/src/main/java/io/fleetplan/core/plan/Plan.java
package io.fleetplan.core.plan;

import io.fleetplan.core.ServiceCatalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered actions grouped by service, then by node.
 * <p>
 * Built single-threaded by {@link PlanGenerator}, rewritten by
 * {@link PlanOrderer}, then sealed. A sealed plan is read-only and may be
 * shared with executor threads without locking.
 */
public final class Plan {

    private final Map<String, Map<String, List<PlanEntry>>> byService = new LinkedHashMap<>();
    private boolean sealed;

    void add(PlanEntry entry) {
        checkMutable();
        byService.computeIfAbsent(entry.service(), s -> new LinkedHashMap<>())
                .computeIfAbsent(entry.nodeId(), n -> new ArrayList<>())
                .add(entry);
    }

    void replace(String service, String nodeId, List<PlanEntry> ordered) {
        checkMutable();
        Map<String, List<PlanEntry>> nodes = byService.get(service);
        if (nodes == null || !nodes.containsKey(nodeId)) {
            throw new IllegalStateException("no entries for " + service + " on " + nodeId);
        }
        nodes.put(nodeId, new ArrayList<>(ordered));
    }

    void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    private void checkMutable() {
        if (sealed) {
            throw new IllegalStateException("plan is sealed");
        }
    }

    public boolean isEmpty() {
        return byService.isEmpty();
    }

    /** Services with at least one entry, in the order they were first planned. */
    public Set<String> services() {
        return Collections.unmodifiableSet(byService.keySet());
    }

    public boolean hasService(String service) {
        return byService.containsKey(service);
    }

    /** Nodes with entries for {@code service}, in the order they were first planned. */
    public Set<String> nodes(String service) {
        Map<String, List<PlanEntry>> nodes = byService.get(service);
        return nodes == null ? Set.of() : Collections.unmodifiableSet(nodes.keySet());
    }

    public List<PlanEntry> entries(String service, String nodeId) {
        Map<String, List<PlanEntry>> nodes = byService.get(service);
        List<PlanEntry> list = nodes == null ? null : nodes.get(nodeId);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    public int size() {
        int n = 0;
        for (Map<String, List<PlanEntry>> nodes : byService.values()) {
            for (List<PlanEntry> list : nodes.values()) {
                n += list.size();
            }
        }
        return n;
    }

    /**
     * Every entry in execution order: services in canonical catalog order,
     * nodes in planning order, entries in orderer order.
     */
    public List<PlanEntry> flatten(ServiceCatalog catalog) {
        List<PlanEntry> out = new ArrayList<>();
        for (String svc : catalog.names()) {
            Map<String, List<PlanEntry>> nodes = byService.get(svc);
            if (nodes == null) {
                continue;
            }
            nodes.values().forEach(out::addAll);
        }
        return out;
    }

    public List<PlanRecord> records(ServiceCatalog catalog) {
        return flatten(catalog).stream().map(PlanRecord::of).toList();
    }
}
