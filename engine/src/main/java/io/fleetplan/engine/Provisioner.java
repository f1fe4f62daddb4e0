// file: engine/src/main/java/io/fleetplan/engine/Provisioner.java
package io.fleetplan.engine;

/**
 * Abstraction over whatever actually creates, destroys and upgrades service
 * instances.
 *
 * Implementations:
 *  - HttpProvisioner: calls a provisioning API over HTTP.
 *  - test fakes: scripted in-memory provisioners.
 *
 * Calls are blocking and may be made from several threads at once (one per
 * node of the service being updated). Failures are reported as
 * {@link ProvisioningException}; callers never retry.
 */
public interface Provisioner {

    /**
     * Create one instance of {@code service}.
     *
     * @return id of the new instance
     */
    String deploy(DeployOptions options, String service);

    /** Destroy the instance {@code instanceId}. */
    void undeploy(String instanceId);

    /** Replace the image of {@code instanceId} in place. */
    void reprovision(String instanceId, String imageId);
}
