package io.fleetplan.core.plan;

import java.util.List;

/**
 * The plan would create new instances of experimental services and the
 * operator did not opt in. Names every offending service at once.
 */
public class ExperimentalServiceException extends RuntimeException {

    private final List<String> services;

    public ExperimentalServiceException(List<String> services) {
        super("refusing to deploy new instances of experimental service(s): "
                + String.join(", ", services)
                + " (opt in to experimental services to proceed)");
        this.services = List.copyOf(services);
    }

    public List<String> services() {
        return services;
    }
}
