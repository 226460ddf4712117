package org.fleetroute.planning.simulation;

import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import lombok.Builder;
import org.fleetroute.model.GoodCatalog;
import org.fleetroute.model.Point;
import org.fleetroute.model.StopOperation;
import org.fleetroute.model.Vehicle;
import org.fleetroute.planning.RoutingScenario;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Expands a visitation order into concrete vehicle routes.
 *
 * <p>Each call builds its own fleet and {@link DemandLedger}; the scenario is only
 * read. Expansion flow:</p>
 * <ul>
 * <li>Create one vehicle per capacity and bind it to a warehouse.</li>
 * <li>Give every vehicle the same fixed launch load per good and record it.</li>
 * <li>Walk the order; delivery points pull goods from the cheapest vehicle, reloading
 * at the nearest warehouse when that vehicle carries none of the good.</li>
 * <li>Pickup points push goods into the cheapest vehicle with room, forcing a warehouse
 * unload once the vehicle crosses the unload threshold.</li>
 * </ul>
 *
 * <p>Demand that no vehicle can serve is left in the ledger and reported through
 * {@link ServicePlan#totalUnmetDemand()}.</p>
 */
public final class ServicePlanSimulator {
    public static final double DEFAULT_INITIAL_LOAD_FRACTION = 0.25d;
    public static final double DEFAULT_UNLOAD_THRESHOLD = 0.8d;

    private final RoutingScenario scenario;
    private final GoodCatalog catalog;
    private final WarehouseAssignmentPolicy assignmentPolicy;
    private final double initialLoadFraction;
    private final double unloadThreshold;
    private final VehicleSelector selector;

    /**
     * Creates a simulator bound to one scenario.
     *
     * @param scenario validated scenario.
     * @param assignmentPolicy warehouse binding policy ({@code RANDOM} when null).
     * @param initialLoadFraction share of capacity split evenly across goods at launch.
     * @param unloadThreshold load ratio that forces an unload after a pickup.
     */
    @Builder
    public ServicePlanSimulator(
            RoutingScenario scenario,
            WarehouseAssignmentPolicy assignmentPolicy,
            Double initialLoadFraction,
            Double unloadThreshold
    ) {
        this.scenario = Objects.requireNonNull(scenario, "scenario");
        this.catalog = scenario.goodCatalog();
        this.assignmentPolicy = assignmentPolicy == null ? WarehouseAssignmentPolicy.RANDOM : assignmentPolicy;
        this.initialLoadFraction = requireFraction(
                "initialLoadFraction",
                initialLoadFraction == null ? DEFAULT_INITIAL_LOAD_FRACTION : initialLoadFraction
        );
        this.unloadThreshold = requireFraction(
                "unloadThreshold",
                unloadThreshold == null ? DEFAULT_UNLOAD_THRESHOLD : unloadThreshold
        );
        this.selector = new VehicleSelector(scenario.warehouses());
    }

    private static double requireFraction(String name, double value) {
        if (!(value >= 0.0d && value <= 1.0d)) {
            throw new IllegalArgumentException(name + " must be within [0, 1], got " + value);
        }
        return value;
    }

    public RoutingScenario scenario() {
        return scenario;
    }

    /**
     * Expands an order of service-point indices.
     *
     * @param order service-point indices in visiting order.
     * @param random random stream used for warehouse assignment.
     * @return route set with its demand ledger.
     * @throws SimulationException when the order references unknown indices.
     */
    public ServicePlan simulate(int[] order, Random random) {
        Objects.requireNonNull(order, "order");
        Objects.requireNonNull(random, "random");

        DemandLedger ledger = new DemandLedger(scenario);
        List<Vehicle> vehicles = launchFleet(random);

        for (int index : order) {
            if (index < 0 || index >= scenario.serviceCount()) {
                throw new SimulationException(
                        SimulationException.REASON_INVALID_ORDER,
                        "service index out of range: " + index
                );
            }
            Point point = scenario.servicePoint(index);
            switch (point.type()) {
                case DELIVERY -> handleDelivery(vehicles, ledger, point);
                case PICKUP -> handlePickup(vehicles, ledger, point);
                case WAREHOUSE -> throw new SimulationException(
                        SimulationException.REASON_INVALID_ORDER,
                        "warehouse in visiting order: " + point.label()
                );
            }
        }
        return new ServicePlan(vehicles, ledger, scenario.warehouses());
    }

    /**
     * Expands an order expressed as scenario points.
     */
    public ServicePlan simulate(List<Point> order, Random random) {
        int[] indices = new int[order.size()];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = scenario.indexOf(order.get(i));
        }
        return simulate(indices, random);
    }

    /**
     * Launch load per good: the configured share of capacity split evenly across goods.
     */
    int initialLoadPerGood(int capacity) {
        int budget = (int) Math.floor(capacity * initialLoadFraction);
        return budget / catalog.size();
    }

    private List<Vehicle> launchFleet(Random random) {
        List<Vehicle> vehicles = new ArrayList<>(scenario.vehicleCount());
        for (int i = 0; i < scenario.vehicleCount(); i++) {
            Point warehouse = assignmentPolicy.assign(i, scenario.warehouses(), random);
            vehicles.add(new Vehicle(i + 1, scenario.vehicleCapacity(i), warehouse, catalog));
        }
        for (Vehicle vehicle : vehicles) {
            int perGood = initialLoadPerGood(vehicle.capacity());
            Object2IntLinkedOpenHashMap<String> requested = catalog.zeroes();
            if (perGood > 0) {
                for (String good : catalog.goods()) {
                    requested.put(good, perGood);
                }
            }
            Map<String, Integer> loaded = vehicle.partialLoad(requested);
            vehicle.recordWarehouseStop(vehicle.assignedWarehouse(), StopOperation.INITIAL_LOAD, loaded);
        }
        return vehicles;
    }

    private void handleDelivery(List<Vehicle> vehicles, DemandLedger ledger, Point point) {
        for (String good : catalog.goods()) {
            int need = ledger.remaining(point, good);
            while (need > 0) {
                Vehicle vehicle = selector.selectForDelivery(vehicles, point, good, need);
                if (vehicle == null) {
                    break;
                }
                if (vehicle.load(good) == 0) {
                    reloadForDelivery(vehicle, good, need);
                }
                int amount = Math.min(vehicle.load(good), need);
                if (amount <= 0) {
                    break;
                }
                ledger.deliver(point, good, amount);
                vehicle.deliver(point, good, amount, ledger.snapshot(point));
                need -= amount;
            }
        }
    }

    private void reloadForDelivery(Vehicle vehicle, String good, int need) {
        Point warehouse = vehicle.nearestWarehouse(scenario.warehouses());
        if (vehicle.currentPosition() != warehouse) {
            vehicle.recordWarehouseStop(warehouse, StopOperation.TRAVEL_TO_RELOAD, null);
        }
        int headroom = vehicle.capacity() - vehicle.currentTotalLoad() + vehicle.load(good);
        int loaded = vehicle.reload(good, Math.min(need, headroom));
        vehicle.recordWarehouseStop(warehouse, StopOperation.RELOAD_SPECIFIC_GOOD, catalog.single(good, loaded));
    }

    private void handlePickup(List<Vehicle> vehicles, DemandLedger ledger, Point point) {
        for (String good : catalog.goods()) {
            int need = -ledger.remaining(point, good);
            while (need > 0) {
                Vehicle vehicle = selector.selectForPickup(vehicles, point, need);
                if (vehicle == null) {
                    break;
                }
                int amount = Math.min(vehicle.availableCapacity(), need);
                if (amount <= 0) {
                    break;
                }
                ledger.pickup(point, good, amount);
                vehicle.pickup(point, good, amount, ledger.snapshot(point));
                need -= amount;

                if (vehicle.currentTotalLoad() >= vehicle.capacity() * unloadThreshold) {
                    Point warehouse = vehicle.nearestWarehouse(scenario.warehouses());
                    Map<String, Integer> unloaded = vehicle.unloadAll();
                    vehicle.recordWarehouseStop(warehouse, StopOperation.UNLOAD_IF_FULL, unloaded);
                }
            }
        }
    }
}
