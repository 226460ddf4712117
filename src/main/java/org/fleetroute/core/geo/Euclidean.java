package org.fleetroute.core.geo;

import lombok.experimental.UtilityClass;
import org.fleetroute.model.Point;

import java.util.List;

/**
 * Planar distance helpers shared by the simulator, fitness evaluator and 2-opt refinement.
 */
@UtilityClass
public final class Euclidean {

    /**
     * Computes Euclidean distance in raw coordinate space.
     */
    public static double distance(double x1, double y1, double x2, double y2) {
        return Math.hypot(x2 - x1, y2 - y1);
    }

    /**
     * Computes Euclidean distance between two points.
     */
    public static double distance(Point from, Point to) {
        return distance(from.x(), from.y(), to.x(), to.y());
    }

    /**
     * Returns the warehouse closest to {@code origin}.
     *
     * <p>The first warehouse in list order wins exact ties.</p>
     *
     * @return nearest warehouse, or {@code null} when the list is empty.
     */
    public static Point nearest(Point origin, List<Point> warehouses) {
        Point best = null;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (Point warehouse : warehouses) {
            double d = distance(origin, warehouse);
            if (d < bestDistance) {
                bestDistance = d;
                best = warehouse;
            }
        }
        return best;
    }
}
