package io.fleetplan.core;

import java.util.Objects;

/**
 * Static properties of one deployable service.
 *
 * @param name            service name, unique within a catalog
 * @param sharded         instances are bucketed by shard as well as image
 * @param experimental    provisioning new instances requires an explicit opt-in
 * @param reprovisionable a provision/deprovision pair may be fused into an in-place reprovision
 * @param serialDeploy    the service keeps shared coordination state in external metadata,
 *                        so its compute nodes are updated one at a time and never fused
 */
public record ServiceDescriptor(
        String name,
        boolean sharded,
        boolean experimental,
        boolean reprovisionable,
        boolean serialDeploy
) {
    public ServiceDescriptor {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) throw new IllegalArgumentException("service name must not be blank");
    }

    public static ServiceDescriptor plain(String name) {
        return new ServiceDescriptor(name, false, false, true, false);
    }
}
