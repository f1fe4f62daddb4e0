package io.fleetplan.core.plan;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fleetplan.core.DeployedInstance;
import io.fleetplan.core.DeployedState;
import io.fleetplan.core.DesiredConfiguration;
import io.fleetplan.core.DesiredConfigurationReader;
import io.fleetplan.core.Fixtures;
import io.fleetplan.core.PlanValidationException;
import io.fleetplan.core.ServiceCatalog;
import io.fleetplan.core.ServiceDescriptor;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

import static io.fleetplan.core.plan.PlanAction.DEPROVISION;
import static io.fleetplan.core.plan.PlanAction.PROVISION;
import static io.fleetplan.core.plan.PlanAction.REPROVISION;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Planner behavior against a fixed four-node fleet and small ad hoc layouts.
 *
 * Each fleet case edits a copy of the deployed layout and feeds it back as the
 * desired configuration, so the expected plan is exactly the edit.
 */
class PlanGeneratorTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final PlanGenerator generator = new PlanGenerator(Fixtures.CATALOG);
    private final DeployedState fleet = Fixtures.deployed(Fixtures.FLEET);

    // ---------- helpers ----------

    private static DesiredConfiguration edit(Consumer<ObjectNode> change) {
        try {
            ObjectNode root = (ObjectNode) JSON.readTree(Fixtures.FLEET);
            change.accept(root);
            return Fixtures.desired(JSON.writeValueAsString(root));
        } catch (Exception e) {
            throw new AssertionError(e);
        }
    }

    private static ObjectNode at(ObjectNode root, String... path) {
        ObjectNode n = root;
        for (String p : path) {
            n = (ObjectNode) n.get(p);
        }
        return n;
    }

    private List<PlanRecord> plan(DesiredConfiguration desired) {
        return generator.generate(desired, fleet, PlanOptions.defaults()).records(Fixtures.CATALOG);
    }

    private static PlanRecord rec(String node, String svc, PlanAction action, String image, String shard) {
        return new PlanRecord(node, svc, action, null, image, shard);
    }

    /** Compare ignoring bound instance ids. */
    private static void assertPlan(List<PlanRecord> expected, List<PlanRecord> actual) {
        assertEquals(expected, actual.stream()
                .map(r -> new PlanRecord(r.node(), r.service(), r.action(), null, r.image(), r.shard()))
                .toList());
    }

    // ---------- properties ----------

    @Test
    void identical_desired_and_actual_yield_empty_plan() {
        Plan plan = generator.generate(Fixtures.desired(Fixtures.FLEET), fleet, PlanOptions.defaults());
        assertTrue(plan.isEmpty());
        assertEquals(0, plan.size());
    }

    @Test
    void repeated_planning_on_unchanged_inputs_is_identical() {
        var desired = edit(root -> {
            at(root, "cn001", "marlin").put("img001", 4).put("img009", 3);
            root.remove("cn004");
        });

        var first = new PlanGenerator(Fixtures.CATALOG).generate(desired, fleet, PlanOptions.defaults());
        var second = new PlanGenerator(Fixtures.CATALOG).generate(desired, fleet, PlanOptions.defaults());

        assertEquals(first.flatten(Fixtures.CATALOG), second.flatten(Fixtures.CATALOG));
    }

    @Test
    void bound_instances_never_repeat() {
        var desired = edit(root -> {
            at(root, "cn001", "marlin").put("img001", 1);
            at(root, "cn002", "moray", "1").put("img002", 0);
            root.remove("cn004");
        });

        var entries = generator.generate(desired, fleet, PlanOptions.defaults().withNoReprovision(true))
                .flatten(Fixtures.CATALOG);
        Set<String> seen = new HashSet<>();
        int deprovisions = 0;
        for (PlanEntry e : entries) {
            if (e.action() == DEPROVISION) {
                deprovisions++;
                assertNotNull(e.instanceId());
                assertTrue(seen.add(e.instanceId()), "bound twice: " + e.instanceId());
            }
        }
        assertEquals(9 + 3 + 4, deprovisions);
    }

    // ---------- scenarios ----------

    @Test
    void any_node_provisions_the_difference_against_global_counts() {
        var deployed = Fixtures.deployed("{ \"cn1\": { \"webapi\": { \"imgA\": 1 } } }");
        var desired = Fixtures.desired("{ \"<any>\": { \"webapi\": { \"imgA\": 3 } } }");

        Plan plan = generator.generate(desired, deployed, PlanOptions.defaults());

        List<PlanEntry> entries = plan.entries("webapi", "<any>");
        assertEquals(2, entries.size());
        for (PlanEntry e : entries) {
            assertEquals(PROVISION, e.action());
            assertEquals("imgA", e.image());
            assertEquals("more wanted", e.reason());
        }
        assertEquals(Set.of("webapi"), plan.services());
    }

    @Test
    void any_node_deprovisions_bind_across_nodes_in_sorted_order() {
        var deployed = Fixtures.deployed("""
                { "cn2": { "webapi": { "img-a": 1 } },
                  "cn1": { "webapi": { "img-a": 2 }, "medusa": { "img-m": 1 } } }
                """);
        var desired = Fixtures.desired("{ \"<any>\": { \"webapi\": { \"img-a\": 1 } } }");

        Plan plan = generator.generate(desired, deployed, PlanOptions.defaults());

        assertEquals(List.of("cn1-webapi-000", "cn1-webapi-001"),
                plan.entries("webapi", "<any>").stream().map(PlanEntry::instanceId).toList());
        // Nodes are never "unused" when placement is deferred to any node.
        assertFalse(plan.hasService("medusa"));
    }

    @Test
    void node_missing_from_desired_tree_is_emptied() {
        var deployed = Fixtures.deployed("""
                { "cn1": { "authcache": { "imgX": 2 } },
                  "cn2": { "webapi": { "img-w": 1 } } }
                """);
        var desired = Fixtures.desired("{ \"cn2\": { \"webapi\": { \"img-w\": 1 } } }");

        Plan plan = generator.generate(desired, deployed, PlanOptions.defaults());

        List<PlanEntry> entries = plan.entries("authcache", "cn1");
        assertEquals(2, entries.size());
        for (PlanEntry e : entries) {
            assertEquals(DEPROVISION, e.action());
            assertEquals("imgX", e.image());
            assertEquals("node no longer used", e.reason());
        }
        assertEquals(List.of("cn1-authcache-000", "cn1-authcache-001"),
                entries.stream().map(PlanEntry::instanceId).toList());
        assertEquals(1, plan.services().size());
    }

    @Test
    void unused_image_in_a_shard_is_deprovisioned() {
        var deployed = Fixtures.deployed("{ \"cn1\": { \"moray\": { \"shard1\": { \"imgA\": 1, \"imgB\": 1 } } } }");
        var desired = Fixtures.desired("{ \"cn1\": { \"moray\": { \"shard1\": { \"imgA\": 2 } } } }");

        List<PlanEntry> entries = generator
                .generate(desired, deployed, PlanOptions.defaults().withNoReprovision(true))
                .entries("moray", "cn1");

        assertEquals(2, entries.size());
        assertEquals(PROVISION, entries.get(0).action());
        assertEquals("imgA", entries.get(0).image());
        assertEquals("shard1", entries.get(0).shard());
        assertEquals("more wanted", entries.get(0).reason());
        assertEquals(DEPROVISION, entries.get(1).action());
        assertEquals("imgB", entries.get(1).image());
        assertEquals("image no longer used", entries.get(1).reason());
        assertEquals("cn1-moray-001", entries.get(1).instanceId());
    }

    @Test
    void unused_image_in_a_shard_is_reprovisioned_when_allowed() {
        var deployed = Fixtures.deployed("{ \"cn1\": { \"moray\": { \"shard1\": { \"imgA\": 1, \"imgB\": 1 } } } }");
        var desired = Fixtures.desired("{ \"cn1\": { \"moray\": { \"shard1\": { \"imgA\": 2 } } } }");

        List<PlanEntry> entries = generator.generate(desired, deployed, PlanOptions.defaults())
                .entries("moray", "cn1");

        assertEquals(1, entries.size());
        PlanEntry e = entries.get(0);
        assertEquals(REPROVISION, e.action());
        assertEquals("cn1-moray-001", e.instanceId());
        assertEquals("imgB", e.oldImage());
        assertEquals("imgA", e.newImage());
        assertEquals("image no longer used", e.oldReason());
        assertEquals("more wanted", e.newReason());
    }

    // ---------- policy and validation ----------

    @Test
    void experimental_services_need_opt_in_and_all_offenders_are_named() {
        var desired = Fixtures.desired("""
                { "cn1": { "propeller": { "img-p": 2 }, "webapi": { "img-w": 1 }, "reshard": { "img-r": 1 } } }
                """);
        var empty = DeployedState.empty(Fixtures.CATALOG);

        var e = assertThrows(ExperimentalServiceException.class,
                () -> generator.generate(desired, empty, PlanOptions.defaults()));
        assertEquals(List.of("reshard", "propeller"), e.services());
        assertTrue(e.getMessage().contains("reshard, propeller"), e.getMessage());

        Plan plan = generator.generate(desired, empty, PlanOptions.defaults().withExperimental(true));
        assertEquals(4, plan.size());
    }

    @Test
    void removing_experimental_instances_needs_no_opt_in() {
        var deployed = Fixtures.deployed("{ \"cn1\": { \"reshard\": { \"img-r\": 1 } } }");
        var desired = Fixtures.desired("{ \"cn1\": { } }");

        Plan plan = generator.generate(desired, deployed, PlanOptions.defaults());
        assertEquals("service no longer used", plan.entries("reshard", "cn1").get(0).reason());
    }

    @Test
    void unknown_service_filter_is_rejected_before_diffing() {
        var e = assertThrows(PlanValidationException.class,
                () -> generator.generate(Fixtures.desired(Fixtures.FLEET), fleet,
                        PlanOptions.defaults().withServiceFilter("nosuch")));
        assertTrue(e.getMessage().contains("nosuch"));
    }

    @Test
    void service_filter_limits_every_step() {
        var desired = edit(root -> {
            at(root, "cn001", "medusa").put("img004", 1);
            at(root, "cn001", "marlin").put("img001", 9);
            root.remove("cn004");
        });

        var records = generator.generate(desired, fleet, PlanOptions.defaults().withServiceFilter("medusa"))
                .records(Fixtures.CATALOG);

        assertPlan(List.of(rec("cn001", "medusa", DEPROVISION, "img004", null)), records);
    }

    // ---------- fleet edits ----------

    @Test
    void remove_one_instance() {
        var records = plan(edit(root -> at(root, "cn001", "medusa").put("img004", 1)));
        assertEquals(List.of(new PlanRecord("cn001", "medusa", DEPROVISION, "cn001-medusa-000", "img004", null)),
                records);
    }

    @Test
    void deploy_two_instances() {
        assertPlan(List.of(
                rec("cn001", "medusa", PROVISION, "img004", null),
                rec("cn001", "medusa", PROVISION, "img004", null)
        ), plan(edit(root -> at(root, "cn001", "medusa").put("img004", 4))));
    }

    @Test
    void remove_a_service() {
        var plan = generator.generate(edit(root -> at(root, "cn001").remove("medusa")), fleet,
                PlanOptions.defaults());
        assertPlan(List.of(
                rec("cn001", "medusa", DEPROVISION, "img004", null),
                rec("cn001", "medusa", DEPROVISION, "img004", null)
        ), plan.records(Fixtures.CATALOG));
        assertEquals("service no longer used", plan.entries("medusa", "cn001").get(0).reason());
    }

    @Test
    void remove_a_node() {
        var plan = generator.generate(edit(root -> root.remove("cn004")), fleet, PlanOptions.defaults());
        assertPlan(List.of(
                rec("cn004", "postgres", DEPROVISION, "img003", "1"),
                rec("cn004", "postgres", DEPROVISION, "img003", "2"),
                rec("cn004", "marlin", DEPROVISION, "img001", null),
                rec("cn004", "marlin", DEPROVISION, "img001", null)
        ), plan.records(Fixtures.CATALOG));
        for (PlanEntry e : plan.flatten(Fixtures.CATALOG)) {
            assertEquals("node no longer used", e.reason());
        }
    }

    @Test
    void add_a_service() {
        assertPlan(List.of(
                rec("cn004", "medusa", PROVISION, "img004", null),
                rec("cn004", "medusa", PROVISION, "img004", null)
        ), plan(edit(root -> at(root, "cn004").putObject("medusa").put("img004", 2))));
    }

    @Test
    void add_a_node() {
        assertPlan(List.of(rec("cn005", "medusa", PROVISION, "img004", null)),
                plan(edit(root -> root.putObject("cn005").putObject("medusa").put("img004", 1))));
    }

    @Test
    void upgrade_fuses_into_reprovision() {
        assertPlan(List.of(
                rec("cn001", "medusa", REPROVISION, "img005", null),
                rec("cn001", "medusa", PROVISION, "img005", null)
        ), plan(edit(root -> at(root, "cn001", "medusa").put("img004", 1).put("img005", 2))));
    }

    @Test
    void upgrade_of_a_non_reprovisionable_service_is_staggered() {
        assertPlan(List.of(
                rec("cn001", "marlin", PROVISION, "img002", null),
                rec("cn001", "marlin", DEPROVISION, "img001", null),
                rec("cn001", "marlin", PROVISION, "img002", null),
                rec("cn001", "marlin", DEPROVISION, "img001", null)
        ), plan(edit(root -> at(root, "cn001", "marlin").put("img001", 8).put("img002", 2))));
    }

    @Test
    void upgrade_within_a_shard() {
        assertPlan(List.of(
                rec("cn001", "moray", REPROVISION, "img003", "2"),
                rec("cn001", "moray", DEPROVISION, "img002", "2")
        ), plan(edit(root -> at(root, "cn001", "moray", "2").put("img003", 1).put("img002", 1))));
    }

    @Test
    void changes_in_different_shards_are_not_fused() {
        assertPlan(List.of(
                rec("cn001", "moray", DEPROVISION, "img002", "1"),
                rec("cn001", "moray", PROVISION, "img003", "2")
        ), plan(edit(root -> {
            at(root, "cn001", "moray", "2").put("img003", 1);
            at(root, "cn001", "moray", "1").put("img002", 2);
        })));
    }

    @Test
    void no_reprovision_override_staggers_instead() {
        var plan = generator.generate(
                edit(root -> at(root, "cn001", "medusa").put("img004", 1).put("img005", 2)),
                fleet, PlanOptions.defaults().withNoReprovision(true));
        assertPlan(List.of(
                rec("cn001", "medusa", PROVISION, "img005", null),
                rec("cn001", "medusa", DEPROVISION, "img004", null),
                rec("cn001", "medusa", PROVISION, "img005", null)
        ), plan.records(Fixtures.CATALOG));
    }

    @Test
    void serial_service_upgrade_is_staggered_not_fused() {
        var deployed = Fixtures.deployed("{ \"cn1\": { \"nameservice\": { \"img1\": 1 } } }");
        var desired = Fixtures.desired("{ \"cn1\": { \"nameservice\": { \"img2\": 1 } } }");

        var entries = generator.generate(desired, deployed, PlanOptions.defaults()).entries("nameservice", "cn1");

        assertEquals(List.of(PROVISION, DEPROVISION), entries.stream().map(PlanEntry::action).toList());
        assertEquals("img2", entries.get(0).image());
        assertEquals("cn1-nameservice-000", entries.get(1).instanceId());
    }

    @Test
    void serial_deploy_disables_fusion_even_when_reprovision_is_allowed() {
        ServiceCatalog catalog = new ServiceCatalog(List.of(
                new ServiceDescriptor("coord", false, false, true, true),
                ServiceDescriptor.plain("web")));
        var deployed = DeployedState.fromInstances(catalog, List.of(
                new DeployedInstance("c1", "coord", "cn1", null, "img1"),
                new DeployedInstance("w1", "web", "cn1", null, "img1")));
        var desired = new DesiredConfigurationReader(catalog)
                .parse("{ \"cn1\": { \"coord\": { \"img2\": 1 }, \"web\": { \"img2\": 1 } } }");

        Plan plan = new PlanGenerator(catalog).generate(desired, deployed, PlanOptions.defaults());

        assertEquals(List.of(PROVISION, DEPROVISION),
                plan.entries("coord", "cn1").stream().map(PlanEntry::action).toList());
        assertEquals(List.of(REPROVISION),
                plan.entries("web", "cn1").stream().map(PlanEntry::action).toList());
    }

    @Test
    void generated_plan_is_sealed() {
        Plan plan = generator.generate(edit(root -> at(root, "cn001", "medusa").put("img004", 4)), fleet,
                PlanOptions.defaults());
        assertTrue(plan.isSealed());
        assertThrows(UnsupportedOperationException.class,
                () -> plan.entries("medusa", "cn001").clear());
    }
}
