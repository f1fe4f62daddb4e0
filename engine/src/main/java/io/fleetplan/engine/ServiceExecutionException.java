package io.fleetplan.engine;

import java.util.List;
import java.util.Map;

/**
 * One or more nodes of a service failed. Each node's failure is attached as a
 * suppressed exception, in node order.
 */
public class ServiceExecutionException extends RuntimeException {

    private final String service;
    private final List<String> failedNodes;

    public ServiceExecutionException(String service, Map<String, ? extends Throwable> failures) {
        super(message(service, failures));
        this.service = service;
        this.failedNodes = List.copyOf(failures.keySet());
        failures.values().forEach(this::addSuppressed);
    }

    private static String message(String service, Map<String, ? extends Throwable> failures) {
        StringBuilder sb = new StringBuilder()
                .append("service \"").append(service).append("\": ")
                .append(failures.size()).append(" node(s) failed");
        failures.forEach((node, err) -> sb.append("; ").append(node).append(": ").append(err.getMessage()));
        return sb.toString();
    }

    public String service() {
        return service;
    }

    public List<String> failedNodes() {
        return failedNodes;
    }
}
