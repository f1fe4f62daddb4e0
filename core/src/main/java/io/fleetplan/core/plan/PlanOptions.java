package io.fleetplan.core.plan;

/**
 * Knobs for one planning run.
 *
 * @param serviceFilter     only plan this service (null plans every service)
 * @param allowExperimental permit new instances of experimental services
 * @param noReprovision     never fuse provision + deprovision into reprovision
 */
public record PlanOptions(
        String serviceFilter,
        boolean allowExperimental,
        boolean noReprovision
) {
    public static PlanOptions defaults() {
        return new PlanOptions(null, false, false);
    }

    public PlanOptions withServiceFilter(String service) {
        return new PlanOptions(service, allowExperimental, noReprovision);
    }

    public PlanOptions withExperimental(boolean allow) {
        return new PlanOptions(serviceFilter, allow, noReprovision);
    }

    public PlanOptions withNoReprovision(boolean value) {
        return new PlanOptions(serviceFilter, allowExperimental, value);
    }
}
