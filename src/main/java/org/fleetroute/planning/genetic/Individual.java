package org.fleetroute.planning.genetic;

import java.util.Arrays;

/**
 * One scored visitation order.
 *
 * <p>The fitness is memoized together with the seed of the evaluation that produced
 * it, so elites keep their score across generations and the winning order can be
 * re-expanded into the exact plan it was scored on.</p>
 */
public final class Individual {
    private final int[] genes;
    private final double fitness;
    private final long evaluationSeed;

    Individual(int[] genes, double fitness, long evaluationSeed) {
        this.genes = genes;
        this.fitness = fitness;
        this.evaluationSeed = evaluationSeed;
    }

    /**
     * Copy of the visiting order as service-point indices.
     */
    public int[] order() {
        return genes.clone();
    }

    int[] genes() {
        return genes;
    }

    public double fitness() {
        return fitness;
    }

    public long evaluationSeed() {
        return evaluationSeed;
    }

    @Override
    public String toString() {
        return "Individual{fitness=" + fitness + ", order=" + Arrays.toString(genes) + "}";
    }
}
