package org.fleetroute.model;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import lombok.Value;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Immutable record of one vehicle stop.
 *
 * <p>Load and demand snapshots are taken immediately after the operation. Warehouse
 * stops carry no demand snapshot ({@code remainingDemandAfter} is {@code null}).</p>
 */
@Value
@Accessors(fluent = true)
public class Stop {
    /** Visited point (service point or warehouse). */
    Point point;
    /** Amounts transferred per good. */
    Object2IntMap<String> amounts;
    /** Operation tag. */
    StopOperation operation;
    /** Vehicle load per good after the operation. */
    Object2IntMap<String> loadAfter;
    /** Point remaining demand per good after the operation; null at warehouses. */
    Object2IntMap<String> remainingDemandAfter;

    public Stop(
            Point point,
            Object2IntMap<String> amounts,
            StopOperation operation,
            Object2IntMap<String> loadAfter,
            Object2IntMap<String> remainingDemandAfter
    ) {
        this.point = Objects.requireNonNull(point, "point");
        this.amounts = Objects.requireNonNull(amounts, "amounts");
        this.operation = Objects.requireNonNull(operation, "operation");
        this.loadAfter = Objects.requireNonNull(loadAfter, "loadAfter");
        if (operation.atWarehouse() != point.isWarehouse()) {
            throw new IllegalArgumentException(
                    operation + " stop cannot be recorded at " + (point.isWarehouse() ? "warehouse " : "service point ")
                            + point.label()
            );
        }
        this.remainingDemandAfter = operation.atWarehouse() ? null : Objects.requireNonNull(remainingDemandAfter, "remainingDemandAfter");
    }

    /**
     * Amount of one good transferred at this stop.
     */
    public int amount(String good) {
        return amounts.getInt(good);
    }

    /**
     * Total vehicle load after the operation.
     */
    public int totalLoadAfter() {
        int total = 0;
        for (int value : loadAfter.values()) {
            total += value;
        }
        return total;
    }
}
