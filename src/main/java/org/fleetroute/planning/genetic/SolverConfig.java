package org.fleetroute.planning.genetic;

import lombok.Builder;
import lombok.Value;
import org.fleetroute.planning.RoutePlanningException;
import org.fleetroute.planning.simulation.ServicePlanSimulator;
import org.fleetroute.planning.simulation.WarehouseAssignmentPolicy;

import java.util.Locale;

/**
 * Hyperparameters of the genetic route planner.
 *
 * <p>Defaults reproduce the reference search: 50 individuals, 100 generations,
 * swap mutation at 0.2, tournaments of 3, ordered crossover at 0.7, 2-opt on 20% of
 * children, two elites, and ten fresh individuals every fifth generation.</p>
 */
@Value
@Builder(toBuilder = true)
public class SolverConfig {
    public static final String REASON_INVALID_CONFIG = "VRP_INVALID_SOLVER_CONFIG";

    static final String PROP_POPULATION_SIZE = "fleetroute.ga.populationSize";
    static final String PROP_GENERATIONS = "fleetroute.ga.generations";
    static final String PROP_MUTATION_RATE = "fleetroute.ga.mutationRate";
    static final String PROP_TOURNAMENT_SIZE = "fleetroute.ga.tournamentSize";
    static final String PROP_SEED = "fleetroute.ga.seed";
    static final String PROP_WAREHOUSE_ASSIGNMENT = "fleetroute.ga.warehouseAssignment";

    @Builder.Default
    int populationSize = 50;
    @Builder.Default
    int generations = 100;
    @Builder.Default
    double mutationRate = 0.2d;
    @Builder.Default
    int tournamentSize = 3;
    /** Probability of ordered crossover; spatial crossover otherwise. */
    @Builder.Default
    double orderedCrossoverRate = 0.7d;
    /** Probability of running 2-opt on a child. */
    @Builder.Default
    double localSearchRate = 0.2d;
    @Builder.Default
    int eliteCount = 2;
    @Builder.Default
    int diversityInterval = 5;
    @Builder.Default
    int diversityInjectionCount = 10;
    @Builder.Default
    double initialLoadFraction = ServicePlanSimulator.DEFAULT_INITIAL_LOAD_FRACTION;
    @Builder.Default
    double unloadThreshold = ServicePlanSimulator.DEFAULT_UNLOAD_THRESHOLD;
    @Builder.Default
    WarehouseAssignmentPolicy warehouseAssignment = WarehouseAssignmentPolicy.RANDOM;
    @Builder.Default
    long seed = 1L;

    /**
     * Returns the default configuration.
     */
    public static SolverConfig defaults() {
        return SolverConfig.builder().build();
    }

    /**
     * Loads overrides from {@code fleetroute.ga.*} system properties.
     *
     * <p>Missing or unparsable values keep their defaults.</p>
     */
    public static SolverConfig fromSystemProperties() {
        SolverConfig base = defaults();
        return base.toBuilder()
                .populationSize(readInt(PROP_POPULATION_SIZE, base.populationSize))
                .generations(readInt(PROP_GENERATIONS, base.generations))
                .mutationRate(readDouble(PROP_MUTATION_RATE, base.mutationRate))
                .tournamentSize(readInt(PROP_TOURNAMENT_SIZE, base.tournamentSize))
                .seed(readLong(PROP_SEED, base.seed))
                .warehouseAssignment(readPolicy(PROP_WAREHOUSE_ASSIGNMENT, base.warehouseAssignment))
                .build();
    }

    /**
     * Validates every bound before search starts.
     *
     * @return this config.
     * @throws RoutePlanningException when a value is out of range.
     */
    public SolverConfig validate() {
        require(populationSize >= 2, "populationSize must be >= 2, got " + populationSize);
        require(generations >= 0, "generations must be >= 0, got " + generations);
        require(tournamentSize >= 1 && tournamentSize <= populationSize,
                "tournamentSize must be within [1, populationSize], got " + tournamentSize);
        require(eliteCount >= 0 && eliteCount <= populationSize,
                "eliteCount must be within [0, populationSize], got " + eliteCount);
        require(diversityInterval >= 1, "diversityInterval must be >= 1, got " + diversityInterval);
        require(diversityInjectionCount >= 0, "diversityInjectionCount must be >= 0, got " + diversityInjectionCount);
        requireProbability("mutationRate", mutationRate);
        requireProbability("orderedCrossoverRate", orderedCrossoverRate);
        requireProbability("localSearchRate", localSearchRate);
        requireProbability("initialLoadFraction", initialLoadFraction);
        requireProbability("unloadThreshold", unloadThreshold);
        require(warehouseAssignment != null, "warehouseAssignment must be set");
        return this;
    }

    private static void requireProbability(String name, double value) {
        require(value >= 0.0d && value <= 1.0d, name + " must be within [0, 1], got " + value);
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new RoutePlanningException(REASON_INVALID_CONFIG, message);
        }
    }

    private static int readInt(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static long readLong(String property, long fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static double readDouble(String property, double fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static WarehouseAssignmentPolicy readPolicy(String property, WarehouseAssignmentPolicy fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return WarehouseAssignmentPolicy.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return fallback;
        }
    }
}
