// file: engine/src/main/java/io/fleetplan/engine/PlanExecutor.java
package io.fleetplan.engine;

import io.fleetplan.core.ServiceCatalog;
import io.fleetplan.core.plan.Plan;
import io.fleetplan.core.plan.PlanAction;
import io.fleetplan.core.plan.PlanEntry;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies a sealed {@link Plan} through a {@link Provisioner}.
 * <p>
 * Responsibilities:
 *  - Walk services in catalog order; a service's failure halts the run and
 *    later services are never attempted. Nothing is rolled back.
 *  - Run a service's nodes concurrently, one worker per node, except in
 *    dry-run mode and for services that require serial deploys.
 *  - Run each node's entries strictly in plan order. A node stops at its first
 *    failed action; sibling nodes are unaffected.
 *  - In dry-run mode, describe every action to {@code out} instead.
 * <p>
 * Single use: {@code IDLE -> RUNNING -> DONE}.
 */
public final class PlanExecutor {
    private static final Logger log = Logger.getLogger(PlanExecutor.class.getName());

    enum State { IDLE, RUNNING, DONE }

    private final ServiceCatalog catalog;
    private final Plan plan;
    private final Provisioner provisioner; // null only for dry runs
    private final PrintStream out;
    private final PrintStream progress;
    private final ExecutionResults results = new ExecutionResults();
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);

    /**
     * @param out      dry-run report
     * @param progress operator progress lines for live runs
     */
    public PlanExecutor(ServiceCatalog catalog, Plan plan, Provisioner provisioner,
                        PrintStream out, PrintStream progress) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.plan = Objects.requireNonNull(plan, "plan");
        this.provisioner = provisioner;
        this.out = Objects.requireNonNull(out, "out");
        this.progress = Objects.requireNonNull(progress, "progress");
        if (!plan.isSealed()) {
            throw new IllegalArgumentException("plan is still being built");
        }
    }

    /**
     * Run the plan.
     *
     * @return number of services that had entries and were processed
     * @throws ServiceExecutionException if any node of a service failed
     */
    public int execute(boolean dryRun) {
        if (!dryRun && provisioner == null) {
            throw new IllegalStateException("a provisioner is required unless dry-running");
        }
        if (!state.compareAndSet(State.IDLE, State.RUNNING)) {
            throw new IllegalStateException("plan executor already used (state " + state.get() + ")");
        }
        try {
            return run(dryRun);
        } finally {
            state.set(State.DONE);
        }
    }

    State state() {
        return state.get();
    }

    public ExecutionResults results() {
        return results;
    }

    private int run(boolean dryRun) {
        DryRunRenderer renderer = new DryRunRenderer(out);
        int count = 0;

        for (String svc : catalog.names()) {
            if (!plan.hasService(svc)) {
                continue;
            }
            count++;
            List<String> nodes = new ArrayList<>(plan.nodes(svc));

            if (dryRun) {
                renderer.service(svc);
                for (String node : nodes) {
                    renderer.node(node);
                    plan.entries(svc, node).forEach(renderer::entry);
                }
                continue;
            }

            log.info(() -> "executing service " + svc + " on " + nodes.size() + " node(s)");
            Map<String, RuntimeException> failures = catalog.requiresSerialDeploy(svc)
                    ? runSerially(svc, nodes)
                    : runConcurrently(svc, nodes);

            if (!failures.isEmpty()) {
                ServiceExecutionException e = new ServiceExecutionException(svc, failures);
                log.log(Level.SEVERE, "halting: " + e.getMessage());
                throw e;
            }
        }

        if (count == 0) {
            renderer.nothingToDo();
        }
        return count;
    }

    private Map<String, RuntimeException> runSerially(String svc, List<String> nodes) {
        Map<String, RuntimeException> failures = new LinkedHashMap<>();
        for (String node : nodes) {
            RuntimeException err = runNode(svc, node);
            if (err != null) {
                failures.put(node, err);
            }
        }
        return failures;
    }

    private Map<String, RuntimeException> runConcurrently(String svc, List<String> nodes) {
        AtomicInteger seq = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(nodes.size(), r -> {
            Thread t = new Thread(r, "plan-exec-" + svc + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        try {
            Map<String, Future<RuntimeException>> futures = new LinkedHashMap<>();
            for (String node : nodes) {
                futures.put(node, pool.submit(() -> runNode(svc, node)));
            }

            Map<String, RuntimeException> failures = new LinkedHashMap<>();
            for (var e : futures.entrySet()) {
                RuntimeException err;
                try {
                    err = e.getValue().get();
                } catch (ExecutionException ex) {
                    err = new ProvisioningException("node " + e.getKey() + " worker failed", ex.getCause());
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    pool.shutdownNow();
                    throw new IllegalStateException("interrupted while executing service " + svc, ex);
                }
                if (err != null) {
                    failures.put(e.getKey(), err);
                }
            }
            return failures;
        } finally {
            pool.shutdown();
        }
    }

    /** Returns the node's first failure, or null if every entry succeeded. */
    private RuntimeException runNode(String svc, String node) {
        for (PlanEntry entry : plan.entries(svc, node)) {
            try {
                String instanceId = apply(svc, node, entry);
                results.record(svc, node, ActionResult.ok(entry, instanceId));
            } catch (RuntimeException e) {
                log.log(Level.SEVERE, svc + " on " + node + ": " + entry.action().label() + " failed", e);
                results.record(svc, node, ActionResult.failed(entry, e));
                return e;
            }
        }
        return null;
    }

    private String apply(String svc, String node, PlanEntry entry) {
        if (entry.action() == PlanAction.PROVISION) {
            DeployOptions options = DeployOptions.forEntry(entry);
            log.info(() -> "provisioning " + svc + " " + options.params());
            progress.printf("service \"%s\": provisioning%n", svc);
            printParams(options.params());
            String id = provisioner.deploy(options, svc);
            log.info(() -> "provisioned " + svc + " " + id);
            progress.printf("service \"%s\": provisioned %s%n", svc, id);
            printParams(options.params());
            return id;
        }

        Map<String, String> params = new LinkedHashMap<>();
        params.put("server_uuid", node);
        if (entry.shard() != null) {
            params.put("shard", entry.shard());
        }

        if (entry.action() == PlanAction.DEPROVISION) {
            log.info(() -> "removing " + svc + " " + entry.instanceId());
            progress.printf("service \"%s\": removing %s%n", svc, entry.instanceId());
            printParams(params);
            provisioner.undeploy(entry.instanceId());
            log.info(() -> "removed " + svc + " " + entry.instanceId());
            progress.printf("service \"%s\": removed %s%n", svc, entry.instanceId());
        } else {
            params.put("new image", entry.newImage());
            log.info(() -> "reprovisioning " + svc + " " + entry.instanceId() + " to " + entry.newImage());
            progress.printf("service \"%s\": reprovisioning \"%s\"%n", svc, entry.instanceId());
            printParams(params);
            provisioner.reprovision(entry.instanceId(), entry.newImage());
            log.info(() -> "reprovisioned " + svc + " " + entry.instanceId());
            progress.printf("service \"%s\": reprovisioned \"%s\"%n", svc, entry.instanceId());
        }
        return entry.instanceId();
    }

    private void printParams(Map<String, String> params) {
        params.forEach((k, v) -> progress.printf("    %11s: %s%n", k, v));
    }
}
