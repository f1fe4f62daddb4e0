package io.fleetplan.engine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thread-safe record of what an execution did, per (service, node).
 * <p>
 * Node workers of one service append concurrently; readers get snapshots.
 */
public final class ExecutionResults {

    private final Map<String, Map<String, List<ActionResult>>> byService = new LinkedHashMap<>();

    synchronized void record(String service, String nodeId, ActionResult result) {
        byService.computeIfAbsent(service, s -> new LinkedHashMap<>())
                .computeIfAbsent(nodeId, n -> new ArrayList<>())
                .add(result);
    }

    /** Services in the order they were first executed. */
    public synchronized List<String> services() {
        return List.copyOf(byService.keySet());
    }

    public synchronized List<ActionResult> results(String service, String nodeId) {
        Map<String, List<ActionResult>> nodes = byService.get(service);
        List<ActionResult> list = nodes == null ? null : nodes.get(nodeId);
        return list == null ? List.of() : List.copyOf(list);
    }

    /** Nodes of {@code service} with at least one failed action. */
    public synchronized List<String> failedNodes(String service) {
        Map<String, List<ActionResult>> nodes = byService.get(service);
        if (nodes == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        nodes.forEach((node, results) -> {
            if (results.stream().anyMatch(r -> !r.succeeded())) {
                out.add(node);
            }
        });
        return out;
    }

    public synchronized List<ActionResult> all() {
        List<ActionResult> out = new ArrayList<>();
        byService.values().forEach(nodes -> nodes.values().forEach(out::addAll));
        return out;
    }

    public synchronized boolean hasFailures() {
        return all().stream().anyMatch(r -> !r.succeeded());
    }
}
