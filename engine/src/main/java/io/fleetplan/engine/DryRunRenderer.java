package io.fleetplan.engine;

import io.fleetplan.core.plan.PlanAction;
import io.fleetplan.core.plan.PlanEntry;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Renders what an execution would do, one block per service and node:
 *
 * <pre>
 * service "moray"
 *   cn "cn001":
 *     shard 2: reprovision zone 6c1e...
 *         (old image: img002)
 *         (new image: img003)
 *     shard 1: provision (image img002)
 * </pre>
 */
final class DryRunRenderer {

    private final PrintStream out;

    DryRunRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    void service(String service) {
        out.printf("service \"%s\"%n", service);
    }

    void node(String nodeId) {
        out.printf("  cn \"%s\":%n", nodeId);
    }

    void entry(PlanEntry e) {
        String prefix = e.shard() == null ? "" : "shard " + e.shard() + ": ";
        if (e.action() == PlanAction.REPROVISION) {
            out.printf("    %sreprovision zone %s%n", prefix, e.instanceId());
            out.printf("        (old image: %s)%n", e.oldImage());
            out.printf("        (new image: %s)%n", e.newImage());
        } else if (e.action() == PlanAction.PROVISION) {
            out.printf("    %sprovision (image %s)%n", prefix, e.image());
        } else {
            out.printf("    %sdeprovision zone %s%n", prefix, e.instanceId());
            out.printf("        (image: %s)%n", e.image());
        }
    }

    void nothingToDo() {
        out.println("nothing to do");
    }
}
