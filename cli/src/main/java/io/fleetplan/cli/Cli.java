// file: cli/src/main/java/io/fleetplan/cli/Cli.java
package io.fleetplan.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.fleetplan.core.ConfigKey;
import io.fleetplan.core.DeployedState;
import io.fleetplan.core.DesiredConfiguration;
import io.fleetplan.core.DesiredConfigurationReader;
import io.fleetplan.core.InventorySnapshotReader;
import io.fleetplan.core.ServiceCatalog;
import io.fleetplan.core.ServiceConfiguration;
import io.fleetplan.core.plan.ExperimentalServiceException;
import io.fleetplan.core.plan.Plan;
import io.fleetplan.core.plan.PlanOptions;
import io.fleetplan.engine.HttpProvisioner;
import io.fleetplan.engine.ServiceExecutionException;
import io.fleetplan.engine.UpdateSession;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeSet;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * fleetplan-adm: show deployed services, or update them to match a desired
 * configuration.
 *
 * Usage:
 *   fleetplan-adm show   --inventory snapshot.json [--json]
 *   fleetplan-adm update --inventory snapshot.json --dry-run config.json
 *   fleetplan-adm update --inventory snapshot.json --endpoint http://prov:8080 config.json moray
 *
 * Exit codes: 0 ok, 1 usage/validation/policy error, 2 execution failure.
 */
public final class Cli {
    private static final Logger log = Logger.getLogger(Cli.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILED = 2;

    private final ServiceCatalog catalog;
    private final PrintStream out;
    private final PrintStream err;

    Cli(ServiceCatalog catalog, PrintStream out, PrintStream err) {
        this.catalog = catalog;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        configureLogging();
        int code = new Cli(ServiceCatalog.standard(), System.out, System.err).run(args, System.getenv());
        System.exit(code);
    }

    int run(String[] args, Map<String, String> env) {
        CliOptions opts;
        try {
            opts = CliOptions.fromArgs(args, env);
        } catch (CliException e) {
            err.println("error: " + e.getMessage());
            err.println(CliOptions.USAGE);
            return EXIT_USAGE;
        }

        try {
            return switch (opts.command()) {
                case HELP -> {
                    out.println(CliOptions.USAGE);
                    yield EXIT_OK;
                }
                case SHOW -> show(opts);
                case UPDATE -> update(opts);
            };
        } catch (ServiceExecutionException e) {
            err.println("error: " + e.getMessage());
            return EXIT_FAILED;
        } catch (ExperimentalServiceException | IllegalArgumentException | UncheckedIOException e) {
            err.println("error: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    private int show(CliOptions opts) {
        DeployedState deployed = new InventorySnapshotReader(catalog).read(Path.of(opts.inventory()));

        if (opts.json()) {
            ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
            try {
                out.println(mapper.writeValueAsString(deployed.exportByNode()));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("encoding deployed configuration", e);
            }
            return EXIT_OK;
        }

        out.printf("%-24s %-18s %-6s %-38s %5s%n", "NODE", "SERVICE", "SHARD", "IMAGE", "COUNT");
        for (String node : new TreeSet<>(deployed.nodes())) {
            for (String svc : catalog.names()) {
                if (!deployed.hasOnNode(svc, node)) {
                    continue;
                }
                ServiceConfiguration sc = deployed.onNode(svc, node);
                for (Map.Entry<ConfigKey, Integer> e : sc.entries().entrySet()) {
                    ConfigKey key = e.getKey();
                    String shard = key.partition().isEmpty() ? "-" : key.get(0);
                    out.printf("%-24s %-18s %-6s %-38s %5d%n", node, svc, shard, key.image(), e.getValue());
                }
            }
        }
        return EXIT_OK;
    }

    private int update(CliOptions opts) {
        DeployedState deployed = new InventorySnapshotReader(catalog).read(Path.of(opts.inventory()));
        DesiredConfiguration desired = new DesiredConfigurationReader(catalog).read(Path.of(opts.configPath()));

        PlanOptions planOptions = PlanOptions.defaults()
                .withServiceFilter(opts.service())
                .withExperimental(opts.experimental())
                .withNoReprovision(opts.noReprovision());

        UpdateSession session = new UpdateSession(catalog, desired, deployed);
        Plan plan = session.generatePlan(planOptions);
        log.info(() -> "executing " + plan.size() + " action(s)" + (opts.dryRun() ? " (dry run)" : ""));

        if (opts.dryRun()) {
            session.execute(null, true, out, err);
        } else {
            int services = session.execute(new HttpProvisioner(opts.endpoint(), opts.timeout()), false, out, err);
            if (services > 0) {
                out.printf("updated %d service(s)%n", services);
            }
        }
        return EXIT_OK;
    }

    /**
     * Load the bundled logging setup unless one was given with
     * -Djava.util.logging.config.file.
     */
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Cli.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("warning: could not load logging configuration: " + e.getMessage());
        }
    }
}
