package io.fleetplan.core.plan;

import java.util.Locale;

public enum PlanAction {
    PROVISION,
    DEPROVISION,
    REPROVISION;

    /** Lower-case name used in reports and JSON output. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
