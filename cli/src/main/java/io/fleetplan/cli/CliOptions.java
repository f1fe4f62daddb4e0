// file: cli/src/main/java/io/fleetplan/cli/CliOptions.java
package io.fleetplan.cli;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Parsed fleetplan-adm command line.
 *
 * Supports:
 *  - command:        show | update | help
 *  - inventory:      JSON snapshot of deployed instances (env FLEETPLAN_INVENTORY)
 *  - json:           show: print the deployed configuration as JSON
 *  - dryRun:         update: print the plan instead of executing it
 *  - noReprovision:  update: never upgrade instances in place
 *  - experimental:   update: allow new instances of experimental services
 *  - endpoint:       update: provisioning API base URL (env FLEETPLAN_ENDPOINT)
 *  - timeout:        update: per-request timeout, null for none
 *  - configPath:     update: desired configuration file
 *  - service:        update: only plan this service, null for all
 */
public record CliOptions(
        Command command,
        String inventory,
        boolean json,
        boolean dryRun,
        boolean noReprovision,
        boolean experimental,
        URI endpoint,
        Duration timeout,
        String configPath,
        String service
) {

    public enum Command { SHOW, UPDATE, HELP }

    static final String ENV_ENDPOINT = "FLEETPLAN_ENDPOINT";
    static final String ENV_INVENTORY = "FLEETPLAN_INVENTORY";

    static final String USAGE = """
            Usage:
              fleetplan-adm show   --inventory <file> [--json]
              fleetplan-adm update --inventory <file> [--dry-run|-n] [--no-reprovision]
                                   [--experimental] [--endpoint <url>] [--timeout-seconds <n>]
                                   <config-file> [service]
              fleetplan-adm --help

            Options:
              --inventory,  -i     Deployed-instance snapshot (default: $FLEETPLAN_INVENTORY)
              --json               show: print JSON instead of a table
              --dry-run,    -n     update: print what would be done, change nothing
              --no-reprovision     update: deploy-then-remove instead of upgrading in place
              --experimental       update: allow new instances of experimental services
              --endpoint,   -e     update: provisioning API URL (default: $FLEETPLAN_ENDPOINT)
              --timeout-seconds    update: per-request timeout (default: none)
              --help,       -h     Show this help message
            """;

    /**
     * Very small CLI parser.
     *
     * @param env environment used for defaults
     * @throws CliException on any usage error
     */
    public static CliOptions fromArgs(String[] args, Map<String, String> env) {
        if (args.length == 0) {
            throw new CliException("missing command");
        }

        Command command;
        switch (args[0]) {
            case "--help", "-h", "help" -> {
                return new CliOptions(Command.HELP, null, false, false, false, false, null, null, null, null);
            }
            case "show" -> command = Command.SHOW;
            case "update" -> command = Command.UPDATE;
            default -> throw new CliException("unknown command: " + args[0]);
        }

        String inventory = env.get(ENV_INVENTORY);
        String endpoint = env.get(ENV_ENDPOINT);
        boolean json = false;
        boolean dryRun = false;
        boolean noReprovision = false;
        boolean experimental = false;
        Duration timeout = null;
        String configPath = null;
        String service = null;

        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--help", "-h" -> {
                    return new CliOptions(Command.HELP, null, false, false, false, false, null, null, null, null);
                }

                case "--inventory", "-i" -> {
                    ensureValue(args, i);
                    inventory = args[++i];
                }

                case "--json" -> json = true;

                case "--dry-run", "-n" -> dryRun = true;

                case "--no-reprovision" -> noReprovision = true;

                case "--experimental" -> experimental = true;

                case "--endpoint", "-e" -> {
                    ensureValue(args, i);
                    endpoint = args[++i];
                }

                case "--timeout-seconds" -> {
                    ensureValue(args, i);
                    long seconds;
                    try {
                        seconds = Long.parseLong(args[++i]);
                    } catch (NumberFormatException e) {
                        throw new CliException("invalid timeout-seconds: " + args[i]);
                    }
                    if (seconds <= 0) {
                        throw new CliException("timeout-seconds must be positive: " + seconds);
                    }
                    timeout = Duration.ofSeconds(seconds);
                }

                default -> {
                    if (arg.startsWith("-")) {
                        throw new CliException("unknown option: " + arg);
                    }
                    if (configPath == null) {
                        configPath = arg;
                    } else if (service == null) {
                        service = arg;
                    } else {
                        throw new CliException("unexpected argument: " + arg);
                    }
                }
            }
        }

        if (inventory == null || inventory.isBlank()) {
            throw new CliException("--inventory is required");
        }

        if (command == Command.SHOW) {
            if (configPath != null) {
                throw new CliException("show takes no arguments");
            }
            if (dryRun || noReprovision || experimental) {
                throw new CliException("update options are not valid for show");
            }
            return new CliOptions(command, inventory, json, false, false, false, null, null, null, null);
        }

        if (json) {
            throw new CliException("--json is only valid for show");
        }
        if (configPath == null) {
            throw new CliException("update requires <config-file>");
        }
        URI endpointUri = null;
        if (endpoint != null && !endpoint.isBlank()) {
            try {
                endpointUri = URI.create(endpoint);
            } catch (IllegalArgumentException e) {
                throw new CliException("invalid endpoint: " + endpoint);
            }
            if (endpointUri.getScheme() == null || endpointUri.getHost() == null) {
                throw new CliException("invalid endpoint: " + endpoint);
            }
        }
        if (!dryRun && endpointUri == null) {
            throw new CliException("--endpoint (or " + ENV_ENDPOINT + ") is required unless --dry-run");
        }
        return new CliOptions(command, inventory, false, dryRun, noReprovision, experimental,
                endpointUri, timeout, configPath, service);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new CliException("missing value for option: " + args[i]);
        }
    }
}
