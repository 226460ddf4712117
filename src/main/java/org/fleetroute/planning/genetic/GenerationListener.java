package org.fleetroute.planning.genetic;

import java.util.List;

/**
 * Callback invoked once per generation with the scored, fitness-sorted population.
 */
@FunctionalInterface
public interface GenerationListener {
    GenerationListener NONE = (generation, population) -> {
    };

    /**
     * @param generation 0-based generation index.
     * @param population scored population, best first; read-only.
     */
    void onGeneration(int generation, List<Individual> population);
}
