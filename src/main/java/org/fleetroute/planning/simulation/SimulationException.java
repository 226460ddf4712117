package org.fleetroute.planning.simulation;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Reason-coded failure for illegal states reached while expanding one chromosome.
 *
 * <p>The fitness boundary converts these into an infinite cost.</p>
 */
@Getter
@Accessors(fluent = true)
public final class SimulationException extends RuntimeException {
    static final String REASON_DEMAND_OVERSHOOT = "SIM_DEMAND_OVERSHOOT";
    static final String REASON_UNKNOWN_POINT = "SIM_UNKNOWN_POINT";
    static final String REASON_INVALID_ORDER = "SIM_INVALID_ORDER";

    private final String reasonCode;

    SimulationException(String reasonCode, String message) {
        super(message);
        this.reasonCode = reasonCode;
    }
}
