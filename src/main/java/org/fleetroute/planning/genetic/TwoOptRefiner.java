package org.fleetroute.planning.genetic;

import org.fleetroute.core.geo.Euclidean;
import org.fleetroute.model.Point;
import org.fleetroute.planning.RoutingScenario;

/**
 * First-improvement 2-opt over a visiting order treated as one closed tour.
 *
 * <p>The tour starts at the warehouse nearest to the first point and ends at that same
 * warehouse, appended as a virtual closing stop. The first point and the closing stop
 * never move. Segment reversals are accepted while they strictly shorten the tour;
 * the result is a local optimum.</p>
 */
final class TwoOptRefiner {
    private static final int CLOSING_STOP = -1;
    private static final double IMPROVEMENT_EPSILON = 1e-9d;

    private final RoutingScenario scenario;

    TwoOptRefiner(RoutingScenario scenario) {
        this.scenario = scenario;
    }

    /**
     * Returns a refined copy of {@code order}; the input is left untouched.
     */
    int[] refine(int[] order) {
        if (order.length == 0) {
            return order.clone();
        }
        Point warehouse = Euclidean.nearest(scenario.servicePoint(order[0]), scenario.warehouses());

        int n = order.length + 1;
        int[] tour = new int[n];
        System.arraycopy(order, 0, tour, 0, order.length);
        tour[n - 1] = CLOSING_STOP;

        boolean improved = true;
        while (improved) {
            improved = false;
            for (int i = 1; i < n - 2; i++) {
                for (int j = i + 1; j < n - 1; j++) {
                    Point before = point(tour[i - 1], warehouse);
                    Point segmentStart = point(tour[i], warehouse);
                    Point segmentEnd = point(tour[j], warehouse);
                    Point after = point(tour[j + 1], warehouse);
                    double delta = Euclidean.distance(before, segmentEnd)
                            + Euclidean.distance(segmentStart, after)
                            - Euclidean.distance(before, segmentStart)
                            - Euclidean.distance(segmentEnd, after);
                    if (delta < -IMPROVEMENT_EPSILON) {
                        reverse(tour, i, j);
                        improved = true;
                    }
                }
            }
        }

        int[] refined = new int[order.length];
        System.arraycopy(tour, 0, refined, 0, order.length);
        return refined;
    }

    private Point point(int slot, Point warehouse) {
        return slot == CLOSING_STOP ? warehouse : scenario.servicePoint(slot);
    }

    private static void reverse(int[] tour, int from, int to) {
        while (from < to) {
            int tmp = tour[from];
            tour[from++] = tour[to];
            tour[to--] = tmp;
        }
    }
}
