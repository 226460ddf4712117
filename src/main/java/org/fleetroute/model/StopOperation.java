package org.fleetroute.model;

/**
 * Operation performed by a vehicle at one route stop.
 */
public enum StopOperation {
    /** Launch load taken at the assigned warehouse. */
    INITIAL_LOAD,
    /** Warehouse reload of the single good needed by the next delivery. */
    RELOAD_SPECIFIC_GOOD,
    /** Empty leg to the nearest warehouse ahead of a reload. */
    TRAVEL_TO_RELOAD,
    DELIVERY,
    PICKUP,
    /** Forced warehouse drop-off once the load crosses the unload threshold. */
    UNLOAD_IF_FULL;

    /**
     * Returns whether this operation happens at a warehouse.
     */
    public boolean atWarehouse() {
        return this != DELIVERY && this != PICKUP;
    }
}
