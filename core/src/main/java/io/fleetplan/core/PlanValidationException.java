package io.fleetplan.core;

/**
 * Input rejected before any diffing starts: unknown service names, malformed
 * desired configuration, or a desired tree mixing the sentinel node with
 * concrete nodes. No partial plan exists when this is thrown.
 */
public class PlanValidationException extends IllegalArgumentException {

    public PlanValidationException(String message) {
        super(message);
    }

    public PlanValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
