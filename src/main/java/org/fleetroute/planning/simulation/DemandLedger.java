package org.fleetroute.planning.simulation;

import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.fleetroute.model.GoodCatalog;
import org.fleetroute.model.Point;
import org.fleetroute.planning.RoutingScenario;

/**
 * Remaining demand of every service point within one simulation.
 *
 * <p>Initialized from the point demands and owned by a single simulation.
 * Remaining values only move toward zero: deliveries decrease positive entries and
 * pickups increase negative entries.</p>
 */
public final class DemandLedger {
    private final RoutingScenario scenario;
    private final ObjectArrayList<Object2IntLinkedOpenHashMap<String>> remaining;

    DemandLedger(RoutingScenario scenario) {
        this.scenario = scenario;
        this.remaining = new ObjectArrayList<>(scenario.serviceCount());
        for (Point point : scenario.servicePoints()) {
            remaining.add(new Object2IntLinkedOpenHashMap<>(point.demands()));
        }
    }

    /**
     * Remaining signed demand of one good at one point.
     */
    public int remaining(Point point, String good) {
        return entry(point).getInt(good);
    }

    /**
     * Immutable snapshot of a point's remaining demand.
     */
    public Object2IntMap<String> snapshot(Point point) {
        return GoodCatalog.snapshot(entry(point));
    }

    /**
     * Records a delivery of {@code amount} units.
     */
    void deliver(Point point, String good, int amount) {
        Object2IntLinkedOpenHashMap<String> entry = entry(point);
        int current = entry.getInt(good);
        if (amount <= 0 || amount > current) {
            throw new SimulationException(
                    SimulationException.REASON_DEMAND_OVERSHOOT,
                    "delivery of " + amount + " " + good + " exceeds remaining " + current + " at " + point.label()
            );
        }
        entry.put(good, current - amount);
    }

    /**
     * Records a pickup of {@code amount} units.
     */
    void pickup(Point point, String good, int amount) {
        Object2IntLinkedOpenHashMap<String> entry = entry(point);
        int current = entry.getInt(good);
        if (amount <= 0 || amount > -current) {
            throw new SimulationException(
                    SimulationException.REASON_DEMAND_OVERSHOOT,
                    "pickup of " + amount + " " + good + " exceeds remaining " + (-current) + " at " + point.label()
            );
        }
        entry.put(good, current + amount);
    }

    /**
     * Returns whether every remaining entry of the point is zero.
     */
    public boolean isFullyServiced(Point point) {
        for (int value : entry(point).values()) {
            if (value != 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Sum of absolute remaining demand at one point.
     */
    public int unmetDemand(Point point) {
        int total = 0;
        for (int value : entry(point).values()) {
            total += Math.abs(value);
        }
        return total;
    }

    /**
     * Sum of absolute remaining demand across all service points.
     */
    public int totalUnmetDemand() {
        int total = 0;
        for (Point point : scenario.servicePoints()) {
            total += unmetDemand(point);
        }
        return total;
    }

    private Object2IntLinkedOpenHashMap<String> entry(Point point) {
        int index = scenario.indexOf(point);
        if (index < 0) {
            throw new SimulationException(
                    SimulationException.REASON_UNKNOWN_POINT,
                    "point is not a service point of this scenario: " + point
            );
        }
        return remaining.get(index);
    }
}
