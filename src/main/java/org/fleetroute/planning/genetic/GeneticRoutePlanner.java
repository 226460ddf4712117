package org.fleetroute.planning.genetic;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.fleetroute.planning.RoutePlanningException;
import org.fleetroute.planning.RoutingScenario;
import org.fleetroute.planning.fitness.FitnessEvaluator;
import org.fleetroute.planning.simulation.ServicePlan;
import org.fleetroute.planning.simulation.ServicePlanSimulator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Genetic search over service-point visiting orders.
 *
 * <p>Search flow:</p>
 * <ul>
 * <li>Seed the population with random permutations, then run the diversity pass that
 * overwrites the tail of the population every {@code diversityInterval} generations.</li>
 * <li>Each generation: score, sort ascending, keep the elites, fill a tournament pool,
 * and breed children by ordered or spatial crossover, swap mutation and occasional 2-opt.</li>
 * <li>After the last generation, re-expand the best order into vehicle routes.</li>
 * </ul>
 *
 * <p>All randomness flows from one {@link Random} seeded by {@link SolverConfig#getSeed()},
 * so equal inputs and seed produce identical output. Each individual is scored once and
 * keeps its score; elites therefore make the best fitness non-increasing.</p>
 */
public final class GeneticRoutePlanner {
    public static final String REASON_PLAN_EXPANSION_FAILED = "VRP_PLAN_EXPANSION_FAILED";

    private static final Logger LOGGER = LogManager.getLogger(GeneticRoutePlanner.class);
    private static final Comparator<Individual> BY_FITNESS = Comparator.comparingDouble(Individual::fitness);

    private final RoutingScenario scenario;
    private final SolverConfig config;
    private final GenerationListener listener;
    private final FitnessEvaluator evaluator;
    private final PermutationOperators operators;
    private final TwoOptRefiner refiner;
    private final TournamentSelector selector;

    /**
     * Creates a planner with no generation listener.
     */
    public GeneticRoutePlanner(RoutingScenario scenario, SolverConfig config) {
        this(scenario, config, GenerationListener.NONE);
    }

    /**
     * Creates a planner.
     *
     * @param scenario validated scenario.
     * @param config search hyperparameters; validated here.
     * @param listener per-generation callback.
     * @throws RoutePlanningException when the configuration is invalid.
     */
    public GeneticRoutePlanner(RoutingScenario scenario, SolverConfig config, GenerationListener listener) {
        this.scenario = Objects.requireNonNull(scenario, "scenario");
        this.config = Objects.requireNonNull(config, "config").validate();
        this.listener = listener == null ? GenerationListener.NONE : listener;

        ServicePlanSimulator simulator = ServicePlanSimulator.builder()
                .scenario(scenario)
                .assignmentPolicy(config.getWarehouseAssignment())
                .initialLoadFraction(config.getInitialLoadFraction())
                .unloadThreshold(config.getUnloadThreshold())
                .build();
        this.evaluator = new FitnessEvaluator(simulator);
        this.operators = new PermutationOperators(scenario);
        this.refiner = new TwoOptRefiner(scenario);
        this.selector = new TournamentSelector(config.getTournamentSize());
    }

    /**
     * Runs the search to completion.
     *
     * @return best plan with its order, fitness and per-generation history.
     * @throws RoutePlanningException when the best order cannot be expanded.
     */
    public PlanningResult run() {
        Random random = new Random(config.getSeed());
        LOGGER.info(
                "Starting route search: {} service points, {} warehouses, {} vehicles, population {}, {} generations",
                scenario.serviceCount(),
                scenario.warehouses().size(),
                scenario.vehicleCount(),
                config.getPopulationSize(),
                config.getGenerations()
        );

        List<int[]> seeds = new ArrayList<>(config.getPopulationSize());
        for (int i = 0; i < config.getPopulationSize(); i++) {
            seeds.add(operators.randomOrder(random));
        }
        injectDiversity(seeds, random);

        List<Individual> population = new ArrayList<>(seeds.size());
        for (int[] order : seeds) {
            population.add(score(order, random));
        }

        DoubleArrayList history = new DoubleArrayList(config.getGenerations());
        for (int generation = 0; generation < config.getGenerations(); generation++) {
            population.sort(BY_FITNESS);
            history.add(population.get(0).fitness());
            listener.onGeneration(generation, Collections.unmodifiableList(population));
            LOGGER.debug("Generation {}: best fitness {}", generation, population.get(0).fitness());
            population = breed(population, random);
        }

        Individual best = Collections.min(population, BY_FITNESS);
        ServicePlan plan = expand(best);
        LOGGER.info(
                "Route search finished: best fitness {}, unmet demand {}",
                best.fitness(),
                plan.totalUnmetDemand()
        );
        if (!plan.fullyServiced()) {
            LOGGER.warn("Best plan leaves {} units of demand unmet", plan.totalUnmetDemand());
        }

        return PlanningResult.builder()
                .plan(plan)
                .bestOrder(best.order())
                .bestFitness(best.fitness())
                .generationBestFitness(history)
                .build();
    }

    /**
     * Overwrites the population tail with fresh orders on every {@code diversityInterval}-th
     * generation index. Runs once, before scoring.
     */
    private void injectDiversity(List<int[]> seeds, Random random) {
        int replaced = Math.min(config.getDiversityInjectionCount(), seeds.size());
        if (replaced == 0) {
            return;
        }
        for (int generation = 0; generation < config.getGenerations(); generation++) {
            if (generation % config.getDiversityInterval() != 0) {
                continue;
            }
            for (int i = seeds.size() - replaced; i < seeds.size(); i++) {
                seeds.set(i, operators.randomOrder(random));
            }
        }
    }

    /**
     * Builds the next generation from a population sorted best first.
     */
    private List<Individual> breed(List<Individual> sorted, Random random) {
        int size = config.getPopulationSize();
        List<Individual> next = new ArrayList<>(size);
        next.addAll(sorted.subList(0, config.getEliteCount()));

        List<Individual> pool = selector.selectPool(sorted, size, random);
        while (next.size() < size) {
            int[] parent1 = pool.get(random.nextInt(pool.size())).genes();
            int[] parent2 = pool.get(random.nextInt(pool.size())).genes();

            int[] child = random.nextDouble() < config.getOrderedCrossoverRate()
                    ? operators.orderedCrossover(parent1, parent2, random)
                    : operators.spatialCrossover(parent1, parent2, random);
            operators.swapMutation(child, config.getMutationRate(), random);
            if (random.nextDouble() < config.getLocalSearchRate()) {
                child = refiner.refine(child);
            }
            next.add(score(child, random));
        }
        return next;
    }

    private Individual score(int[] order, Random random) {
        long evaluationSeed = random.nextLong();
        return new Individual(order, evaluator.evaluate(order, evaluationSeed), evaluationSeed);
    }

    private ServicePlan expand(Individual best) {
        try {
            return evaluator.expand(best.genes(), best.evaluationSeed());
        } catch (RuntimeException ex) {
            throw new RoutePlanningException(
                    REASON_PLAN_EXPANSION_FAILED,
                    "best order could not be expanded into routes",
                    ex
            );
        }
    }
}
