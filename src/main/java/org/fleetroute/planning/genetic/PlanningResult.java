package org.fleetroute.planning.genetic;

import it.unimi.dsi.fastutil.doubles.DoubleList;
import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;
import org.fleetroute.model.Vehicle;
import org.fleetroute.planning.simulation.ServicePlan;

import java.util.List;

/**
 * Outcome of one search run.
 */
@Value
@Builder
@Accessors(fluent = true)
public class PlanningResult {
    /** Expanded route set of the best order. */
    ServicePlan plan;
    /** Best visiting order as service-point indices. */
    int[] bestOrder;
    /** Fitness of the best order (total travelled distance). */
    double bestFitness;
    /** Best fitness observed in each generation, oldest first. */
    DoubleList generationBestFitness;

    /**
     * Vehicles of the best plan, each with its full route.
     */
    public List<Vehicle> vehicles() {
        return plan.vehicles();
    }

    /**
     * Demand the best plan leaves unserved.
     */
    public int unmetDemand() {
        return plan.totalUnmetDemand();
    }
}
