package io.fleetplan.core;

/**
 * Well-known node identifiers.
 */
public final class NodeIds {

    /** Sentinel meaning "any compute node in this datacenter". */
    public static final String ANY = "<any>";

    private NodeIds() {
        // constants
    }

    public static boolean isAny(String nodeId) {
        return ANY.equals(nodeId);
    }
}
