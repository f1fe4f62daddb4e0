// file: core/src/main/java/io/fleetplan/core/plan/PlanGenerator.java
package io.fleetplan.core.plan;

import io.fleetplan.core.ConfigKey;
import io.fleetplan.core.DeployedState;
import io.fleetplan.core.DesiredConfiguration;
import io.fleetplan.core.NodeIds;
import io.fleetplan.core.PlanValidationException;
import io.fleetplan.core.ServiceCatalog;
import io.fleetplan.core.ServiceConfiguration;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Diffs a desired configuration against what is deployed and produces an
 * ordered {@link Plan}.
 * <p>
 * Responsibilities:
 *  - For each desired node and service, compare desired counts to deployed
 *    counts (datacenter-wide for {@link NodeIds#ANY}, per node otherwise) and
 *    queue provisions or deprovisions for the difference.
 *  - Deprovision images, services and nodes the desired tree no longer
 *    mentions.
 *  - Refuse new instances of experimental services unless allowed.
 *  - Hand each (service, node) list to {@link PlanOrderer}.
 * <p>
 * Pure: no I/O, and the inputs are never modified.
 */
public final class PlanGenerator {
    private static final Logger log = Logger.getLogger(PlanGenerator.class.getName());

    static final String MORE_WANTED = "more wanted";
    static final String FEWER_WANTED = "fewer wanted";
    static final String IMAGE_UNUSED = "image no longer used";
    static final String SERVICE_UNUSED = "service no longer used";
    static final String NODE_UNUSED = "node no longer used";

    private final ServiceCatalog catalog;

    public PlanGenerator(ServiceCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    /**
     * @throws PlanValidationException      if the service filter names an unknown service
     * @throws ExperimentalServiceException if new experimental instances were planned without opt-in
     */
    public Plan generate(DesiredConfiguration desired, DeployedState deployed, PlanOptions options) {
        Objects.requireNonNull(desired, "desired");
        Objects.requireNonNull(deployed, "deployed");
        Objects.requireNonNull(options, "options");

        String filter = options.serviceFilter();
        if (filter != null && !catalog.isValid(filter)) {
            throw new PlanValidationException("unrecognized service: \"" + filter + "\"");
        }

        log.info("generating plan");
        Plan plan = new Plan();

        for (String nodeId : desired.nodes()) {
            Map<String, ServiceConfiguration> wanted = desired.services(nodeId);

            for (var svcEntry : wanted.entrySet()) {
                String svc = svcEntry.getKey();
                if (!matches(filter, svc)) {
                    continue;
                }
                ServiceConfiguration want = svcEntry.getValue();
                ServiceConfiguration have = NodeIds.isAny(nodeId)
                        ? deployed.global(svc)
                        : deployed.onNode(svc, nodeId);

                for (var e : want.entries().entrySet()) {
                    ConfigKey key = e.getKey();
                    int desiredCount = e.getValue();
                    int actualCount = have.get(key);
                    int delta = desiredCount - actualCount;
                    if (log.isLoggable(Level.FINE)) {
                        log.fine(String.format("node=%s service=%s config=%s wanted=%d have=%d delta=%d",
                                nodeId, svc, key, desiredCount, actualCount, delta));
                    }
                    if (delta > 0) {
                        queue(plan, nodeId, svc, key, PlanAction.PROVISION, delta, MORE_WANTED);
                    } else if (delta < 0) {
                        queue(plan, nodeId, svc, key, PlanAction.DEPROVISION, -delta, FEWER_WANTED);
                    }
                }

                for (var e : have.entries().entrySet()) {
                    if (want.has(e.getKey())) {
                        continue;
                    }
                    log.fine(() -> "node=" + nodeId + " service=" + svc + " config=" + e.getKey()
                            + ": image not present in new config");
                    queue(plan, nodeId, svc, e.getKey(), PlanAction.DEPROVISION, e.getValue(), IMAGE_UNUSED);
                }
            }

            for (String svc : catalog.names()) {
                if (!matches(filter, svc) || wanted.containsKey(svc) || !deployed.hasOnNode(svc, nodeId)) {
                    continue;
                }
                log.fine(() -> "node=" + nodeId + " service=" + svc + ": service not present in new config");
                deprovisionAll(plan, nodeId, svc, deployed.onNode(svc, nodeId), SERVICE_UNUSED);
            }
        }

        if (!desired.usesAnyNode()) {
            for (String svc : catalog.names()) {
                if (!matches(filter, svc)) {
                    continue;
                }
                for (String nodeId : deployed.nodesFor(svc)) {
                    if (desired.hasNode(nodeId)) {
                        continue;
                    }
                    log.fine(() -> "node=" + nodeId + " service=" + svc + ": node not present in new config");
                    deprovisionAll(plan, nodeId, svc, deployed.onNode(svc, nodeId), NODE_UNUSED);
                }
            }
        }

        if (!options.allowExperimental()) {
            List<String> offending = experimentalProvisions(plan);
            if (!offending.isEmpty()) {
                throw new ExperimentalServiceException(offending);
            }
        }

        // Services are never updated concurrently, so ordering only has to be
        // decided within one (service, node) list.
        PlanOrderer orderer = new PlanOrderer(deployed);
        for (String svc : List.copyOf(plan.services())) {
            boolean fuse = !options.noReprovision()
                    && catalog.allowsReprovision(svc)
                    && !catalog.requiresSerialDeploy(svc);
            for (String nodeId : List.copyOf(plan.nodes(svc))) {
                plan.replace(svc, nodeId, orderer.order(svc, nodeId, plan.entries(svc, nodeId), fuse));
            }
        }
        plan.seal();

        log.info(() -> "plan generated: " + plan.size() + " action(s) across "
                + plan.services().size() + " service(s)");
        return plan;
    }

    private List<String> experimentalProvisions(Plan plan) {
        Set<String> out = new LinkedHashSet<>();
        for (String svc : catalog.names()) {
            if (!plan.hasService(svc) || !catalog.isExperimental(svc)) {
                continue;
            }
            for (String nodeId : plan.nodes(svc)) {
                for (PlanEntry e : plan.entries(svc, nodeId)) {
                    if (e.action() == PlanAction.PROVISION) {
                        out.add(svc);
                    }
                }
            }
        }
        return new ArrayList<>(out);
    }

    private static void deprovisionAll(Plan plan, String nodeId, String svc, ServiceConfiguration have, String reason) {
        have.entries().forEach((key, count) ->
                queue(plan, nodeId, svc, key, PlanAction.DEPROVISION, count, reason));
    }

    private static void queue(Plan plan, String nodeId, String svc, ConfigKey key,
                              PlanAction action, int count, String reason) {
        for (int i = 0; i < count; i++) {
            plan.add(action == PlanAction.PROVISION
                    ? PlanEntry.provision(nodeId, svc, key, reason)
                    : PlanEntry.deprovision(nodeId, svc, key, reason));
        }
    }

    private static boolean matches(String filter, String svc) {
        return filter == null || filter.equals(svc);
    }
}
