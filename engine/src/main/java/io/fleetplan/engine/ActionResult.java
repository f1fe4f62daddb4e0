package io.fleetplan.engine;

import io.fleetplan.core.plan.PlanEntry;

import java.util.Objects;

/**
 * Outcome of one executed plan entry.
 *
 * @param entry      the entry that ran
 * @param instanceId new instance for a provision, the bound instance otherwise
 * @param error      failure, or null on success
 */
public record ActionResult(PlanEntry entry, String instanceId, RuntimeException error) {

    public ActionResult {
        Objects.requireNonNull(entry, "entry");
    }

    static ActionResult ok(PlanEntry entry, String instanceId) {
        return new ActionResult(entry, instanceId, null);
    }

    static ActionResult failed(PlanEntry entry, RuntimeException error) {
        return new ActionResult(entry, entry.instanceId(), Objects.requireNonNull(error, "error"));
    }

    public boolean succeeded() {
        return error == null;
    }
}
