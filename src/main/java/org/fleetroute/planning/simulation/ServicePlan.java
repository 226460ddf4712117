package org.fleetroute.planning.simulation;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.fleetroute.model.Point;
import org.fleetroute.model.Vehicle;

import java.util.List;

/**
 * Concrete route set produced by expanding one visitation order.
 *
 * <p>Carries the demand ledger so callers can see which demand, if any, was left
 * unmet by the greedy expansion.</p>
 */
@Getter
@Accessors(fluent = true)
public final class ServicePlan {
    private final List<Vehicle> vehicles;
    private final DemandLedger ledger;
    private final List<Point> warehouses;

    ServicePlan(List<Vehicle> vehicles, DemandLedger ledger, List<Point> warehouses) {
        this.vehicles = List.copyOf(vehicles);
        this.ledger = ledger;
        this.warehouses = warehouses;
    }

    /**
     * Sum of absolute remaining demand over all service points.
     */
    public int totalUnmetDemand() {
        return ledger.totalUnmetDemand();
    }

    public boolean fullyServiced() {
        return totalUnmetDemand() == 0;
    }
}
