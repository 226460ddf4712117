package org.fleetroute.planning.simulation;

import it.unimi.dsi.fastutil.HashCommon;
import org.fleetroute.model.Point;

import java.util.List;
import java.util.Random;

/**
 * Strategy binding each freshly created vehicle to its launch warehouse.
 *
 * <p>{@code RANDOM} draws a warehouse uniformly per vehicle and per evaluation, so two
 * evaluations of the same order can score differently. {@code STABLE} derives the
 * warehouse from a mixed hash of the vehicle index and never changes across evaluations.</p>
 */
public enum WarehouseAssignmentPolicy {
    RANDOM {
        @Override
        Point assign(int vehicleIndex, List<Point> warehouses, Random random) {
            return warehouses.get(random.nextInt(warehouses.size()));
        }
    },
    STABLE {
        @Override
        Point assign(int vehicleIndex, List<Point> warehouses, Random random) {
            return warehouses.get(Math.floorMod(HashCommon.mix(vehicleIndex), warehouses.size()));
        }
    };

    /**
     * Picks the launch warehouse for the vehicle at {@code vehicleIndex} (0-based).
     */
    abstract Point assign(int vehicleIndex, List<Point> warehouses, Random random);
}
