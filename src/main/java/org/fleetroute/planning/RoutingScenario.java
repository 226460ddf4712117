package org.fleetroute.planning;

import it.unimi.dsi.fastutil.objects.Reference2IntOpenHashMap;
import lombok.Builder;
import org.fleetroute.model.GoodCatalog;
import org.fleetroute.model.Point;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Validated planner input: service points, warehouses, fleet capacities and good catalog.
 *
 * <p>Service points are indexed densely in input order. Chromosomes are expressed as
 * permutations of these indices, so a scenario is shared read-only by every evaluation.</p>
 */
public final class RoutingScenario {
    public static final String REASON_POINTS_REQUIRED = "VRP_POINTS_REQUIRED";
    public static final String REASON_SERVICE_POINTS_REQUIRED = "VRP_SERVICE_POINTS_REQUIRED";
    public static final String REASON_VEHICLES_REQUIRED = "VRP_VEHICLES_REQUIRED";
    public static final String REASON_CAPACITY_INVALID = "VRP_CAPACITY_INVALID";
    public static final String REASON_WAREHOUSES_REQUIRED = "VRP_WAREHOUSES_REQUIRED";
    public static final String REASON_WAREHOUSE_TYPE_MISMATCH = "VRP_WAREHOUSE_TYPE_MISMATCH";
    public static final String REASON_DUPLICATE_POINT = "VRP_DUPLICATE_POINT";
    public static final String REASON_GOOD_CATALOG_MISMATCH = "VRP_GOOD_CATALOG_MISMATCH";

    private final List<Point> servicePoints;
    private final List<Point> warehouses;
    private final int[] vehicleCapacities;
    private final GoodCatalog goodCatalog;
    private final Reference2IntOpenHashMap<Point> serviceIndex;

    /**
     * Builds and validates a scenario.
     *
     * @param points all points; warehouses among them are separated out.
     * @param warehouses explicit warehouse list; when empty, points flagged as
     *                   warehouses are used.
     * @param vehicleCapacities one entry per vehicle.
     * @param goodCatalog catalog the points were created against (default catalog when null).
     * @throws RoutePlanningException when the inputs cannot form a plannable scenario.
     */
    @Builder
    private RoutingScenario(
            List<Point> points,
            List<Point> warehouses,
            List<Integer> vehicleCapacities,
            GoodCatalog goodCatalog
    ) {
        if (points == null || points.isEmpty()) {
            throw new RoutePlanningException(REASON_POINTS_REQUIRED, "point list must be non-empty");
        }
        this.goodCatalog = goodCatalog == null ? GoodCatalog.defaultCatalog() : goodCatalog;
        this.warehouses = resolveWarehouses(points, warehouses);
        this.vehicleCapacities = toCapacities(vehicleCapacities);

        Reference2IntOpenHashMap<Point> seenWarehouses = new Reference2IntOpenHashMap<>(this.warehouses.size());
        for (Point warehouse : this.warehouses) {
            seenWarehouses.put(warehouse, 0);
        }

        List<Point> services = new ArrayList<>();
        this.serviceIndex = new Reference2IntOpenHashMap<>(points.size());
        this.serviceIndex.defaultReturnValue(-1);
        for (Point point : points) {
            if (point == null) {
                throw new RoutePlanningException(REASON_POINTS_REQUIRED, "point list must not contain null entries");
            }
            if (seenWarehouses.containsKey(point)) {
                continue;
            }
            if (point.isWarehouse()) {
                throw new RoutePlanningException(
                        REASON_WAREHOUSE_TYPE_MISMATCH,
                        "warehouse " + point.label() + " is missing from the warehouse list"
                );
            }
            if (serviceIndex.containsKey(point)) {
                throw new RoutePlanningException(REASON_DUPLICATE_POINT, "service point listed twice: " + point.label());
            }
            requireCatalog(point);
            serviceIndex.put(point, services.size());
            services.add(point);
        }
        if (services.isEmpty()) {
            throw new RoutePlanningException(REASON_SERVICE_POINTS_REQUIRED, "scenario has no delivery or pickup points");
        }
        this.servicePoints = List.copyOf(services);
    }

    private static List<Point> resolveWarehouses(List<Point> points, List<Point> explicit) {
        List<Point> resolved = new ArrayList<>();
        if (explicit != null && !explicit.isEmpty()) {
            for (Point warehouse : explicit) {
                if (warehouse == null || !warehouse.isWarehouse()) {
                    throw new RoutePlanningException(
                            REASON_WAREHOUSE_TYPE_MISMATCH,
                            "warehouse list contains a non-warehouse point: " + warehouse
                    );
                }
                resolved.add(warehouse);
            }
        } else {
            for (Point point : points) {
                if (point != null && point.isWarehouse()) {
                    resolved.add(point);
                }
            }
        }
        if (resolved.isEmpty()) {
            throw new RoutePlanningException(REASON_WAREHOUSES_REQUIRED, "scenario needs at least one warehouse");
        }
        return List.copyOf(resolved);
    }

    private static int[] toCapacities(List<Integer> capacities) {
        if (capacities == null || capacities.isEmpty()) {
            throw new RoutePlanningException(REASON_VEHICLES_REQUIRED, "at least one vehicle capacity is required");
        }
        int[] result = new int[capacities.size()];
        for (int i = 0; i < result.length; i++) {
            Integer capacity = capacities.get(i);
            if (capacity == null || capacity <= 0) {
                throw new RoutePlanningException(
                        REASON_CAPACITY_INVALID,
                        "vehicle " + (i + 1) + " capacity must be > 0, got " + capacity
                );
            }
            result[i] = capacity;
        }
        return result;
    }

    private void requireCatalog(Point point) {
        if (!point.demands().keySet().equals(Set.copyOf(goodCatalog.goods()))) {
            throw new RoutePlanningException(
                    REASON_GOOD_CATALOG_MISMATCH,
                    "point " + point.label() + " demands " + point.demands().keySet()
                            + " do not match " + goodCatalog
            );
        }
    }

    public List<Point> servicePoints() {
        return servicePoints;
    }

    public Point servicePoint(int index) {
        return servicePoints.get(index);
    }

    public int serviceCount() {
        return servicePoints.size();
    }

    /**
     * Dense index of a service point, or {@code -1} when the point is not a service point.
     */
    public int indexOf(Point point) {
        return serviceIndex.getInt(point);
    }

    public List<Point> warehouses() {
        return warehouses;
    }

    public int vehicleCount() {
        return vehicleCapacities.length;
    }

    public int vehicleCapacity(int vehicleIndex) {
        return vehicleCapacities[vehicleIndex];
    }

    public GoodCatalog goodCatalog() {
        return goodCatalog;
    }

    /**
     * Checks that {@code order} visits every service point exactly once.
     *
     * <p>Rejects wrong lengths, out-of-range or sentinel ({@code -1}) slots and duplicates.</p>
     */
    public boolean isPermutation(int[] order) {
        if (order == null || order.length != servicePoints.size()) {
            return false;
        }
        boolean[] seen = new boolean[order.length];
        for (int index : order) {
            if (index < 0 || index >= order.length || seen[index]) {
                return false;
            }
            seen[index] = true;
        }
        return true;
    }
}
