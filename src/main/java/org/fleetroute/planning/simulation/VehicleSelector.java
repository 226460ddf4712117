package org.fleetroute.planning.simulation;

import org.fleetroute.core.geo.Euclidean;
import org.fleetroute.model.Point;
import org.fleetroute.model.Vehicle;

import java.util.List;

/**
 * Greedy cheapest-vehicle rules used by the simulator.
 */
final class VehicleSelector {
    private final List<Point> warehouses;

    VehicleSelector(List<Point> warehouses) {
        this.warehouses = warehouses;
    }

    /**
     * Selects the vehicle serving the next delivery slice of {@code good} at {@code point}.
     *
     * <p>Vehicles already carrying the good compete on direct distance. On an exact
     * tie the candidate replaces the incumbent when it covers the whole need and the
     * incumbent does not, or when it carries more than an incumbent that cannot cover
     * it. Any vehicle with enough headroom outside this good may also compete as a
     * reload candidate, costed as a detour through its nearest warehouse.</p>
     *
     * @return selected vehicle, or {@code null} when no vehicle qualifies.
     */
    Vehicle selectForDelivery(List<Vehicle> vehicles, Point point, String good, int amountNeeded) {
        Vehicle best = null;
        double minCost = Double.POSITIVE_INFINITY;

        for (Vehicle vehicle : vehicles) {
            Point position = vehicle.currentPosition();
            int carried = vehicle.load(good);

            if (carried > 0) {
                double cost = Euclidean.distance(position, point);
                if (cost < minCost) {
                    minCost = cost;
                    best = vehicle;
                } else if (cost == minCost && best != null && prefersOnTie(vehicle, best, good, amountNeeded)) {
                    best = vehicle;
                }
            }

            int otherGoodsLoad = vehicle.currentTotalLoad() - carried;
            if (vehicle.capacity() - otherGoodsLoad >= amountNeeded) {
                Point warehouse = vehicle.nearestWarehouse(warehouses);
                if (warehouse == null) {
                    continue;
                }
                double reloadCost = Euclidean.distance(position, warehouse) + Euclidean.distance(warehouse, point);
                if (reloadCost < minCost) {
                    minCost = reloadCost;
                    best = vehicle;
                }
            }
        }
        return best;
    }

    private static boolean prefersOnTie(Vehicle candidate, Vehicle incumbent, String good, int amountNeeded) {
        int candidateLoad = candidate.load(good);
        int incumbentLoad = incumbent.load(good);
        if (incumbentLoad >= amountNeeded) {
            return false;
        }
        return candidateLoad >= amountNeeded || candidateLoad > incumbentLoad;
    }

    /**
     * Selects the vehicle collecting the next pickup slice at {@code point}.
     *
     * <p>Prefers the nearest vehicle that can take the whole remaining amount. When no
     * vehicle can, falls back to the vehicle with the most available capacity, provided
     * it can take at least one unit. The earlier vehicle wins capacity ties.</p>
     *
     * @return selected vehicle, or {@code null} when every vehicle is full.
     */
    Vehicle selectForPickup(List<Vehicle> vehicles, Point point, int amountNeeded) {
        Vehicle best = nearest(vehicles, point, amountNeeded);
        if (best != null) {
            return best;
        }
        return roomiest(vehicles);
    }

    private static Vehicle roomiest(List<Vehicle> vehicles) {
        Vehicle best = null;
        for (Vehicle vehicle : vehicles) {
            if (!vehicle.canPickup(1)) {
                continue;
            }
            if (best == null || vehicle.availableCapacity() > best.availableCapacity()) {
                best = vehicle;
            }
        }
        return best;
    }

    private static Vehicle nearest(List<Vehicle> vehicles, Point point, int requiredRoom) {
        Vehicle best = null;
        double minCost = Double.POSITIVE_INFINITY;
        for (Vehicle vehicle : vehicles) {
            if (!vehicle.canPickup(requiredRoom)) {
                continue;
            }
            double cost = Euclidean.distance(vehicle.currentPosition(), point);
            if (cost < minCost) {
                minCost = cost;
                best = vehicle;
            }
        }
        return best;
    }
}
