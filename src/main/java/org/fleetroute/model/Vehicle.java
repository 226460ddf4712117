package org.fleetroute.model;

import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.fleetroute.core.geo.Euclidean;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Capacity-constrained vehicle with per-good loads and an append-only route.
 *
 * <p>Instances are created fresh for every simulation and are not thread-safe.
 * Every mutator keeps {@code currentTotalLoad() <= capacity()}.</p>
 */
@Accessors(fluent = true)
public final class Vehicle {
    @Getter
    private final int id;
    @Getter
    private final int capacity;
    @Getter
    private final Point assignedWarehouse;
    private final GoodCatalog catalog;
    private final Object2IntLinkedOpenHashMap<String> currentLoads;
    private final List<Stop> route = new ArrayList<>();
    private final List<Stop> routeView = Collections.unmodifiableList(route);

    /**
     * Creates an empty vehicle.
     *
     * @param id 1-based vehicle id.
     * @param capacity maximum summed load across all goods.
     * @param assignedWarehouse depot the vehicle launches from.
     * @param catalog good catalog shared by the scenario.
     */
    public Vehicle(int id, int capacity, Point assignedWarehouse, GoodCatalog catalog) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got " + capacity);
        }
        Objects.requireNonNull(assignedWarehouse, "assignedWarehouse");
        if (!assignedWarehouse.isWarehouse()) {
            throw new IllegalArgumentException("assigned point is not a warehouse: " + assignedWarehouse.label());
        }
        this.id = id;
        this.capacity = capacity;
        this.assignedWarehouse = assignedWarehouse;
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.currentLoads = catalog.zeroes();
    }

    /**
     * Read-only view of the route recorded so far.
     */
    public List<Stop> route() {
        return routeView;
    }

    /**
     * Snapshot of the current per-good loads.
     */
    public Object2IntMap<String> currentLoads() {
        return GoodCatalog.snapshot(currentLoads);
    }

    public int load(String good) {
        return currentLoads.getInt(good);
    }

    public int currentTotalLoad() {
        int total = 0;
        for (int value : currentLoads.values()) {
            total += value;
        }
        return total;
    }

    public int availableCapacity() {
        return capacity - currentTotalLoad();
    }

    /**
     * Last visited point, or the assigned warehouse while the route is empty.
     */
    public Point currentPosition() {
        return route.isEmpty() ? assignedWarehouse : route.get(route.size() - 1).point();
    }

    /**
     * Warehouse closest to the current position.
     */
    public Point nearestWarehouse(List<Point> warehouses) {
        return Euclidean.nearest(currentPosition(), warehouses);
    }

    public boolean canPickup(int amount) {
        return currentTotalLoad() + amount <= capacity;
    }

    public boolean canDeliver(String good, int amount) {
        return currentLoads.getInt(good) >= amount;
    }

    /**
     * Loads goods in catalog order, each bounded by the remaining headroom.
     *
     * <p>Loading stops as soon as the vehicle is full.</p>
     *
     * @return amounts actually loaded, all catalog goods present.
     */
    public Object2IntLinkedOpenHashMap<String> partialLoad(Map<String, Integer> requested) {
        Object2IntLinkedOpenHashMap<String> wanted = catalog.normalize(requested);
        Object2IntLinkedOpenHashMap<String> loaded = catalog.zeroes();
        for (String good : catalog.goods()) {
            int amount = Math.min(wanted.getInt(good), availableCapacity());
            if (amount <= 0) {
                if (availableCapacity() <= 0) {
                    break;
                }
                continue;
            }
            currentLoads.addTo(good, amount);
            loaded.put(good, amount);
        }
        return loaded;
    }

    /**
     * Adds up to {@code amount} of one good, bounded by the remaining headroom.
     *
     * @return amount actually loaded.
     */
    public int reload(String good, int amount) {
        catalog.requireGood(good);
        int loaded = Math.max(0, Math.min(amount, availableCapacity()));
        currentLoads.addTo(good, loaded);
        return loaded;
    }

    /**
     * Zeroes every load.
     *
     * @return amounts removed from the vehicle.
     */
    public Object2IntLinkedOpenHashMap<String> unloadAll() {
        Object2IntLinkedOpenHashMap<String> removed = new Object2IntLinkedOpenHashMap<>(currentLoads);
        for (String good : catalog.goods()) {
            currentLoads.put(good, 0);
        }
        return removed;
    }

    /**
     * Records a warehouse stop; loads must already reflect the operation.
     */
    public void recordWarehouseStop(Point warehouse, StopOperation operation, Map<String, Integer> amounts) {
        route.add(new Stop(
                warehouse,
                GoodCatalog.snapshot(catalog.normalize(amounts)),
                operation,
                currentLoads(),
                null
        ));
    }

    /**
     * Hands {@code amount} of one good to a delivery point and records the stop.
     *
     * @param remainingDemandAfter point remaining demand after this delivery.
     * @throws IllegalStateException when the vehicle carries less than {@code amount}.
     */
    public void deliver(Point point, String good, int amount, Object2IntMap<String> remainingDemandAfter) {
        if (amount <= 0 || !canDeliver(good, amount)) {
            throw new IllegalStateException(
                    "vehicle " + id + " cannot deliver " + amount + " " + good + " (carrying " + load(good) + ")"
            );
        }
        currentLoads.addTo(good, -amount);
        route.add(new Stop(point, GoodCatalog.snapshot(catalog.single(good, amount)), StopOperation.DELIVERY,
                currentLoads(), remainingDemandAfter));
    }

    /**
     * Takes {@code amount} of one good from a pickup point and records the stop.
     *
     * @param remainingDemandAfter point remaining demand after this pickup.
     * @throws IllegalStateException when the pickup would exceed capacity.
     */
    public void pickup(Point point, String good, int amount, Object2IntMap<String> remainingDemandAfter) {
        if (amount <= 0 || !canPickup(amount)) {
            throw new IllegalStateException(
                    "vehicle " + id + " cannot pick up " + amount + " " + good
                            + " (load " + currentTotalLoad() + "/" + capacity + ")"
            );
        }
        currentLoads.addTo(catalog.requireGood(good), amount);
        route.add(new Stop(point, GoodCatalog.snapshot(catalog.single(good, amount)), StopOperation.PICKUP,
                currentLoads(), remainingDemandAfter));
    }

    /**
     * Sum of the legs between consecutive recorded stops.
     */
    public double routeDistance() {
        double distance = 0.0d;
        for (int i = 1; i < route.size(); i++) {
            distance += Euclidean.distance(route.get(i - 1).point(), route.get(i).point());
        }
        return distance;
    }

    @Override
    public String toString() {
        return "Vehicle{id=" + id + ", capacity=" + capacity + ", warehouse=" + assignedWarehouse.label()
                + ", stops=" + route.size() + "}";
    }
}
