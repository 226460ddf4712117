package org.fleetroute.model;

import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntMaps;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Map;
import java.util.Objects;

/**
 * Immutable delivery, pickup or warehouse location.
 *
 * <p>Demands are signed per good: positive values are delivery quantities, negative
 * values are pickup quantities. Points use identity equality, so two points with the
 * same coordinates and demands are still distinct service points.</p>
 *
 * <p>Remaining demand is not stored here. Each simulation tracks it in its own
 * {@code DemandLedger}, which keeps concurrent evaluations isolated.</p>
 */
@Getter
@Accessors(fluent = true)
public final class Point {
    private final String label;
    private final double x;
    private final double y;
    private final PointType type;
    private final Object2IntMap<String> demands;

    private Point(String label, double x, double y, PointType type, Object2IntLinkedOpenHashMap<String> demands) {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException("coordinates must be finite, got (" + x + ", " + y + ")");
        }
        this.label = label == null ? "(" + x + "," + y + ")" : label;
        this.x = x;
        this.y = y;
        this.type = Objects.requireNonNull(type, "type");
        this.demands = Object2IntMaps.unmodifiable(demands);
    }

    /**
     * Creates a warehouse with zero demand for every catalog good.
     */
    public static Point warehouse(String label, double x, double y, GoodCatalog catalog) {
        return new Point(label, x, y, PointType.WAREHOUSE, catalog.zeroes());
    }

    /**
     * Creates a warehouse against the default good catalog.
     */
    public static Point warehouse(String label, double x, double y) {
        return warehouse(label, x, y, GoodCatalog.defaultCatalog());
    }

    /**
     * Creates a service point whose type is inferred from the signed demand total.
     */
    public static Point service(String label, double x, double y, Map<String, Integer> demands, GoodCatalog catalog) {
        Object2IntLinkedOpenHashMap<String> normalized = catalog.normalize(demands);
        return new Point(label, x, y, PointType.fromDemandTotal(sum(normalized)), normalized);
    }

    /**
     * Creates a service point against the default good catalog.
     */
    public static Point service(String label, double x, double y, Map<String, Integer> demands) {
        return service(label, x, y, demands, GoodCatalog.defaultCatalog());
    }

    /**
     * Creates a service point with an explicitly supplied type.
     *
     * @throws IllegalArgumentException when {@code type} is {@code WAREHOUSE}.
     */
    public static Point service(
            String label,
            double x,
            double y,
            Map<String, Integer> demands,
            PointType type,
            GoodCatalog catalog
    ) {
        if (type == PointType.WAREHOUSE) {
            throw new IllegalArgumentException("use Point.warehouse(...) for warehouse points");
        }
        return new Point(label, x, y, type, catalog.normalize(demands));
    }

    public boolean isWarehouse() {
        return type == PointType.WAREHOUSE;
    }

    /**
     * Signed demand for one good (zero when the good is not demanded).
     */
    public int demand(String good) {
        return demands.getInt(good);
    }

    /**
     * Sum of absolute demands across all goods.
     */
    public int totalDemand() {
        int total = 0;
        for (int value : demands.values()) {
            total += Math.abs(value);
        }
        return total;
    }

    /**
     * Signed sum of demands across all goods.
     */
    public int demandTotal() {
        return sum(demands);
    }

    private static int sum(Object2IntMap<String> amounts) {
        int total = 0;
        for (int value : amounts.values()) {
            total += value;
        }
        return total;
    }

    @Override
    public String toString() {
        return label;
    }
}
