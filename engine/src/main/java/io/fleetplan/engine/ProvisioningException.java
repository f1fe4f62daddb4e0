package io.fleetplan.engine;

/**
 * A single deploy, undeploy or reprovision call failed.
 * <p>
 * {@link #status()} is the HTTP status when the failure came from a response,
 * or -1 for transport and local failures.
 */
public class ProvisioningException extends RuntimeException {

    private final int status;

    public ProvisioningException(String message) {
        this(message, -1, null);
    }

    public ProvisioningException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public ProvisioningException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int status() {
        return status;
    }
}
