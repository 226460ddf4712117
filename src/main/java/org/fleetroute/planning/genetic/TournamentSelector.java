package org.fleetroute.planning.genetic;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Tournament selection over a scored population.
 */
final class TournamentSelector {
    private final int tournamentSize;

    TournamentSelector(int tournamentSize) {
        if (tournamentSize < 1) {
            throw new IllegalArgumentException("tournamentSize must be >= 1, got " + tournamentSize);
        }
        this.tournamentSize = tournamentSize;
    }

    /**
     * Runs {@code poolSize} tournaments and collects their winners.
     */
    List<Individual> selectPool(List<Individual> population, int poolSize, Random random) {
        List<Individual> pool = new ArrayList<>(poolSize);
        for (int i = 0; i < poolSize; i++) {
            pool.add(tournament(population, random));
        }
        return pool;
    }

    /**
     * Samples {@code tournamentSize} distinct individuals uniformly and returns the fittest.
     *
     * <p>The earliest sampled individual wins fitness ties.</p>
     */
    Individual tournament(List<Individual> population, Random random) {
        int size = Math.min(tournamentSize, population.size());
        IntOpenHashSet sampled = new IntOpenHashSet(size);
        Individual winner = null;
        while (sampled.size() < size) {
            int index = random.nextInt(population.size());
            if (!sampled.add(index)) {
                continue;
            }
            Individual candidate = population.get(index);
            if (winner == null || candidate.fitness() < winner.fitness()) {
                winner = candidate;
            }
        }
        return winner;
    }
}
