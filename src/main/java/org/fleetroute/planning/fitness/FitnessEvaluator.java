package org.fleetroute.planning.fitness;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.fleetroute.core.geo.Euclidean;
import org.fleetroute.model.Point;
import org.fleetroute.model.Stop;
import org.fleetroute.model.Vehicle;
import org.fleetroute.planning.RoutingScenario;
import org.fleetroute.planning.simulation.ServicePlan;
import org.fleetroute.planning.simulation.ServicePlanSimulator;

import java.util.Objects;
import java.util.Random;

/**
 * Scores visitation orders by the total distance of the route set they expand into.
 *
 * <p>Lower is better. Malformed orders and orders that break the simulator score
 * {@link Double#POSITIVE_INFINITY}; neither case propagates to the caller.</p>
 *
 * <p>Every evaluation draws its random decisions from a stream seeded by the caller,
 * so a scored order can be replayed into exactly the plan that produced its score.</p>
 */
public final class FitnessEvaluator {
    private static final Logger LOGGER = LogManager.getLogger(FitnessEvaluator.class);

    private final RoutingScenario scenario;
    private final PlanExpansion expansion;

    public FitnessEvaluator(ServicePlanSimulator simulator) {
        this(Objects.requireNonNull(simulator, "simulator").scenario(), simulator::simulate);
    }

    FitnessEvaluator(RoutingScenario scenario, PlanExpansion expansion) {
        this.scenario = Objects.requireNonNull(scenario, "scenario");
        this.expansion = Objects.requireNonNull(expansion, "expansion");
    }

    /**
     * Expands an order into routes under one evaluation's random stream.
     */
    @FunctionalInterface
    interface PlanExpansion {
        ServicePlan expand(int[] order, Random random);
    }

    /**
     * Scores one order.
     *
     * @param order candidate permutation of service-point indices.
     * @param evaluationSeed seed of the evaluation's private random stream.
     * @return total travelled distance, or {@code +INF} when the order is unusable.
     */
    public double evaluate(int[] order, long evaluationSeed) {
        if (!scenario.isPermutation(order)) {
            return Double.POSITIVE_INFINITY;
        }
        try {
            return travelledDistance(expansion.expand(order, new Random(evaluationSeed)));
        } catch (RuntimeException ex) {
            LOGGER.debug("Simulation failed for evaluation seed {}; scoring as unfit", evaluationSeed, ex);
            return Double.POSITIVE_INFINITY;
        }
    }

    /**
     * Re-expands an order with the seed it was scored under.
     */
    public ServicePlan expand(int[] order, long evaluationSeed) {
        return expansion.expand(order, new Random(evaluationSeed));
    }

    /**
     * Sums each vehicle's legs from its assigned warehouse through every stop, plus a
     * closing leg from the last stop to the warehouse nearest to it.
     */
    public static double travelledDistance(ServicePlan plan) {
        double total = 0.0d;
        for (Vehicle vehicle : plan.vehicles()) {
            if (vehicle.route().isEmpty()) {
                continue;
            }
            Point last = vehicle.assignedWarehouse();
            for (Stop stop : vehicle.route()) {
                total += Euclidean.distance(last, stop.point());
                last = stop.point();
            }
            Point closing = vehicle.nearestWarehouse(plan.warehouses());
            total += Euclidean.distance(last, closing);
        }
        return total;
    }
}
