package org.fleetroute.planning.genetic;

import it.unimi.dsi.fastutil.ints.IntArrays;
import org.fleetroute.core.geo.Euclidean;
import org.fleetroute.model.Point;
import org.fleetroute.planning.RoutingScenario;

import java.util.Arrays;
import java.util.Random;

/**
 * Crossover and mutation operators over permutations of service-point indices.
 *
 * <p>Every operator returns a permutation when its inputs are permutations of the same
 * index set.</p>
 */
final class PermutationOperators {
    private static final int EMPTY = -1;

    private final RoutingScenario scenario;

    PermutationOperators(RoutingScenario scenario) {
        this.scenario = scenario;
    }

    /**
     * Random permutation of all service-point indices.
     */
    int[] randomOrder(Random random) {
        int[] order = new int[scenario.serviceCount()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        IntArrays.shuffle(order, random);
        return order;
    }

    /**
     * Ordered crossover (OX): copies a random slice of {@code parent1} in place and fills
     * the remaining slots with the other genes in {@code parent2} order.
     */
    int[] orderedCrossover(int[] parent1, int[] parent2, Random random) {
        int size = parent1.length;
        if (size < 2) {
            return parent1.clone();
        }
        int first = random.nextInt(size);
        int second = random.nextInt(size - 1);
        if (second >= first) {
            second++;
        }
        int start = Math.min(first, second);
        int end = Math.max(first, second);

        int[] child = new int[size];
        Arrays.fill(child, EMPTY);
        boolean[] inSegment = new boolean[size];
        for (int i = start; i <= end; i++) {
            child[i] = parent1[i];
            inSegment[parent1[i]] = true;
        }

        int cursor = 0;
        for (int i = 0; i < size; i++) {
            if (child[i] != EMPTY) {
                continue;
            }
            while (cursor < size && inSegment[parent2[cursor]]) {
                cursor++;
            }
            if (cursor < size) {
                child[i] = parent2[cursor++];
            }
        }
        return child;
    }

    /**
     * Spatial crossover: sorts both parents by distance to a random reference point and
     * interleaves the two sorted orders, skipping genes already taken.
     */
    int[] spatialCrossover(int[] parent1, int[] parent2, Random random) {
        int size = parent1.length;
        Point reference = scenario.servicePoint(random.nextInt(scenario.serviceCount()));
        double[] distance = new double[scenario.serviceCount()];
        for (int i = 0; i < distance.length; i++) {
            distance[i] = Euclidean.distance(scenario.servicePoint(i), reference);
        }

        int[] sorted1 = parent1.clone();
        int[] sorted2 = parent2.clone();
        IntArrays.mergeSort(sorted1, (a, b) -> Double.compare(distance[a], distance[b]));
        IntArrays.mergeSort(sorted2, (a, b) -> Double.compare(distance[a], distance[b]));

        int[] child = new int[size];
        boolean[] used = new boolean[distance.length];
        int filled = 0;
        int i = 0;
        int j = 0;
        while (filled < size && (i < size || j < size)) {
            while (i < size && used[sorted1[i]]) {
                i++;
            }
            if (i < size) {
                used[sorted1[i]] = true;
                child[filled++] = sorted1[i++];
            }
            while (j < size && used[sorted2[j]]) {
                j++;
            }
            if (j < size && filled < size) {
                used[sorted2[j]] = true;
                child[filled++] = sorted2[j++];
            }
        }
        return child;
    }

    /**
     * Swaps two distinct random positions in place with probability {@code rate}.
     *
     * @return whether a swap happened.
     */
    boolean swapMutation(int[] order, double rate, Random random) {
        if (order.length < 2 || random.nextDouble() >= rate) {
            return false;
        }
        int first = random.nextInt(order.length);
        int second = random.nextInt(order.length - 1);
        if (second >= first) {
            second++;
        }
        int tmp = order[first];
        order[first] = order[second];
        order[second] = tmp;
        return true;
    }
}
