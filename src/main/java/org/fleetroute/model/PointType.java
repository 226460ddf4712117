package org.fleetroute.model;

/**
 * Service role of a point.
 *
 * <p>{@code DELIVERY} points receive goods, {@code PICKUP} points hand goods over,
 * and {@code WAREHOUSE} points are depots where vehicles load and unload.</p>
 */
public enum PointType {
    DELIVERY,
    PICKUP,
    WAREHOUSE;

    /**
     * Infers the service role from the signed demand total.
     *
     * <p>A zero total is treated as delivery.</p>
     */
    public static PointType fromDemandTotal(int demandTotal) {
        return demandTotal < 0 ? PICKUP : DELIVERY;
    }
}
