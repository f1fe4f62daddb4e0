package io.fleetplan.engine;

import io.fleetplan.core.DeployedState;
import io.fleetplan.core.DesiredConfiguration;
import io.fleetplan.core.ServiceCatalog;
import io.fleetplan.core.plan.Plan;
import io.fleetplan.core.plan.PlanGenerator;
import io.fleetplan.core.plan.PlanOptions;
import io.fleetplan.core.plan.PlanRecord;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

/**
 * One update of the fleet: plan once against a snapshot of deployed state,
 * then execute (or dry-run) that plan once.
 * <p>
 * A session is {@code NOT_BUILT} until {@link #generatePlan} succeeds and
 * {@code BUILT} afterwards. Planning twice, or reading or executing the plan
 * before it exists, is an {@link IllegalStateException}. Re-running an update
 * means starting a new session against fresh deployed state.
 */
public final class UpdateSession {

    enum State { NOT_BUILT, BUILT }

    private final ServiceCatalog catalog;
    private final DesiredConfiguration desired;
    private final DeployedState deployed;

    private State state = State.NOT_BUILT;
    private Plan plan;
    private PlanExecutor executor;

    public UpdateSession(ServiceCatalog catalog, DesiredConfiguration desired, DeployedState deployed) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.desired = Objects.requireNonNull(desired, "desired");
        this.deployed = Objects.requireNonNull(deployed, "deployed");
    }

    public synchronized Plan generatePlan(PlanOptions options) {
        if (state != State.NOT_BUILT) {
            throw new IllegalStateException("plan already generated for this session");
        }
        // A validation or policy failure leaves the session unbuilt.
        plan = new PlanGenerator(catalog).generate(desired, deployed, options);
        state = State.BUILT;
        return plan;
    }

    public synchronized Plan plan() {
        checkBuilt();
        return plan;
    }

    /** Flattened plan in execution order. */
    public synchronized List<PlanRecord> dumpPlan() {
        checkBuilt();
        return plan.records(catalog);
    }

    /**
     * Execute the generated plan.
     *
     * @param provisioner may be null when {@code dryRun}
     * @return number of services processed
     * @throws ServiceExecutionException when a service fails; later services are skipped
     */
    public int execute(Provisioner provisioner, boolean dryRun, PrintStream out, PrintStream progress) {
        PlanExecutor exec;
        synchronized (this) {
            checkBuilt();
            if (executor != null) {
                throw new IllegalStateException("plan already executed for this session");
            }
            exec = new PlanExecutor(catalog, plan, provisioner, out, progress);
            executor = exec;
        }
        return exec.execute(dryRun);
    }

    /** Results of the last execution, or null if nothing was executed. */
    public synchronized ExecutionResults results() {
        return executor == null ? null : executor.results();
    }

    State state() {
        return state;
    }

    private void checkBuilt() {
        if (state != State.BUILT) {
            throw new IllegalStateException("no plan generated yet");
        }
    }
}
