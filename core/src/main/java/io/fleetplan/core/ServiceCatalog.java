// file: core/src/main/java/io/fleetplan/core/ServiceCatalog.java
package io.fleetplan.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical, ordered list of services known to the fleet.
 * <p>
 * The order is significant: it is the order in which services are deployed
 * and the order in which a plan is executed, one service at a time.
 */
public final class ServiceCatalog {

    private static final List<ConfigField> SHARDED_FIELDS = List.of(ConfigField.SHARD, ConfigField.IMAGE);
    private static final List<ConfigField> IMAGE_FIELDS = List.of(ConfigField.IMAGE);

    private final Map<String, ServiceDescriptor> byName;

    public ServiceCatalog(List<ServiceDescriptor> services) {
        if (services == null || services.isEmpty()) {
            throw new IllegalArgumentException("catalog must contain at least one service");
        }
        Map<String, ServiceDescriptor> m = new LinkedHashMap<>();
        for (ServiceDescriptor s : services) {
            if (m.put(s.name(), s) != null) {
                throw new IllegalArgumentException("duplicate service in catalog: " + s.name());
            }
        }
        this.byName = m;
    }

    /**
     * Services of the storage deployment, in deployment order.
     *
     *  - nameservice: membership of the coordination ensemble is kept in shared
     *    application metadata, so deploys must not race.
     *  - postgres, moray: sharded.
     *  - marlin: compute zones are always replaced, never reprovisioned.
     *  - reshard, propeller: experimental.
     */
    public static ServiceCatalog standard() {
        List<ServiceDescriptor> s = new ArrayList<>();
        s.add(new ServiceDescriptor("nameservice", false, false, false, true));
        s.add(new ServiceDescriptor("postgres", true, false, true, false));
        s.add(new ServiceDescriptor("moray", true, false, true, false));
        s.add(ServiceDescriptor.plain("electric-moray"));
        s.add(ServiceDescriptor.plain("storage"));
        s.add(ServiceDescriptor.plain("authcache"));
        s.add(ServiceDescriptor.plain("webapi"));
        s.add(ServiceDescriptor.plain("loadbalancer"));
        s.add(ServiceDescriptor.plain("jobsupervisor"));
        s.add(ServiceDescriptor.plain("jobpuller"));
        s.add(ServiceDescriptor.plain("medusa"));
        s.add(ServiceDescriptor.plain("ops"));
        s.add(ServiceDescriptor.plain("madtom"));
        s.add(ServiceDescriptor.plain("marlin-dashboard"));
        s.add(new ServiceDescriptor("marlin", false, false, false, false));
        s.add(new ServiceDescriptor("reshard", false, true, true, false));
        s.add(new ServiceDescriptor("propeller", false, true, true, false));
        return new ServiceCatalog(s);
    }

    /** Service names in canonical order. */
    public List<String> names() {
        return List.copyOf(byName.keySet());
    }

    public boolean isValid(String name) {
        return name != null && byName.containsKey(name);
    }

    public ServiceDescriptor descriptor(String name) {
        ServiceDescriptor d = name == null ? null : byName.get(name);
        if (d == null) {
            throw new IllegalArgumentException("unrecognized service: \"" + name + "\"");
        }
        return d;
    }

    public boolean isSharded(String name) {
        return descriptor(name).sharded();
    }

    public boolean isExperimental(String name) {
        return descriptor(name).experimental();
    }

    public boolean allowsReprovision(String name) {
        return descriptor(name).reprovisionable();
    }

    public boolean requiresSerialDeploy(String name) {
        return descriptor(name).serialDeploy();
    }

    /** Fields making up a {@link ConfigKey} for this service; the last is always IMAGE. */
    public List<ConfigField> configFields(String name) {
        return isSharded(name) ? SHARDED_FIELDS : IMAGE_FIELDS;
    }

    /** Position of {@code name} in the canonical order. */
    public int ordinal(String name) {
        int i = 0;
        for (String n : byName.keySet()) {
            if (n.equals(name)) return i;
            i++;
        }
        throw new IllegalArgumentException("unrecognized service: \"" + name + "\"");
    }
}
