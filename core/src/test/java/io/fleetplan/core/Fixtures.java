package io.fleetplan.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds deployed state from a nested node/service/[shard]/image/count document,
 * the same shape operators write, so tests can describe "what is running" and
 * "what is wanted" the same way.
 */
public final class Fixtures {

    public static final ServiceCatalog CATALOG = ServiceCatalog.standard();

    private Fixtures() {
    }

    public static DesiredConfiguration desired(String json) {
        return new DesiredConfigurationReader(CATALOG).parse(json);
    }

    /**
     * Instance ids are "{node}-{service}-{n}" with a per-(node, service)
     * counter, zero-padded so lexical and numeric order agree.
     */
    public static DeployedState deployed(String json) {
        DesiredConfiguration layout = desired(json);
        List<DeployedInstance> instances = new ArrayList<>();
        for (String node : layout.nodes()) {
            layout.services(node).forEach((svc, sc) -> {
                int n = 0;
                for (var e : sc.entries().entrySet()) {
                    ConfigKey key = e.getKey();
                    String shard = key.partition().isEmpty() ? null : key.get(0);
                    for (int i = 0; i < e.getValue(); i++) {
                        String id = String.format("%s-%s-%03d", node, svc, n++);
                        instances.add(new DeployedInstance(id, svc, node, shard, key.image()));
                    }
                }
            });
        }
        return DeployedState.fromInstances(CATALOG, instances);
    }

    /** The historical test fleet: marlin everywhere, moray and postgres split across four nodes. */
    public static final String FLEET = """
            {
              "cn001": {
                "marlin": { "img001": 10 },
                "moray": { "1": { "img002": 3 }, "2": { "img002": 3 }, "3": { "img002": 3 } },
                "medusa": { "img004": 2 }
              },
              "cn002": {
                "marlin": { "img001": 10 },
                "moray": { "1": { "img002": 3 }, "2": { "img002": 3 }, "3": { "img002": 3 } }
              },
              "cn003": {
                "marlin": { "img001": 10 },
                "postgres": { "1": { "img003": 3 }, "2": { "img003": 3 }, "3": { "img003": 3 } }
              },
              "cn004": {
                "marlin": { "img001": 2 },
                "postgres": { "1": { "img003": 1 }, "2": { "img003": 1 } }
              }
            }
            """;
}
