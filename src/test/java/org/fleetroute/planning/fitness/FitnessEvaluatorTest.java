package org.fleetroute.planning.fitness;

import org.fleetroute.planning.RoutingScenario;
import org.fleetroute.planning.simulation.ServicePlan;
import org.fleetroute.planning.simulation.ServicePlanSimulator;
import org.fleetroute.testutil.ScenarioFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Fitness Evaluator Tests")
class FitnessEvaluatorTest {
    private static final double EPSILON = 1e-9d;

    private static FitnessEvaluator evaluator(RoutingScenario scenario) {
        return new FitnessEvaluator(ServicePlanSimulator.builder().scenario(scenario).build());
    }

    @Test
    @DisplayName("Orange deliveries score their reload detours and the closing leg")
    void testOrangeDeliveryDistance() {
        FitnessEvaluator evaluator = evaluator(ScenarioFixtures.orangeDeliveries());

        // Warehouse-to-warehouse legs are free, so both orders cost six 30-unit legs.
        assertEquals(180.0d, evaluator.evaluate(new int[]{1, 0}, 1L), EPSILON);
        assertEquals(180.0d, evaluator.evaluate(new int[]{0, 1}, 1L), EPSILON);
    }

    @Test
    @DisplayName("Uranium pickup scores two round trips")
    void testUraniumPickupDistance() {
        FitnessEvaluator evaluator = evaluator(ScenarioFixtures.uraniumPickup());

        assertEquals(40.0d, evaluator.evaluate(new int[]{0}, 1L), EPSILON);
    }

    static Stream<Arguments> malformedOrders() {
        return Stream.of(
                Arguments.of("too short", new int[]{0}),
                Arguments.of("too long", new int[]{0, 1, 1}),
                Arguments.of("duplicate", new int[]{1, 1}),
                Arguments.of("sentinel", new int[]{0, -1}),
                Arguments.of("out of range", new int[]{0, 2}),
                Arguments.of("null", null)
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("malformedOrders")
    @DisplayName("Malformed orders score infinity")
    void testMalformedOrdersScoreInfinity(String label, int[] order) {
        FitnessEvaluator evaluator = evaluator(ScenarioFixtures.orangeDeliveries());

        assertEquals(Double.POSITIVE_INFINITY, evaluator.evaluate(order, 1L));
    }

    @Test
    @DisplayName("Failures while expanding a valid permutation score infinity")
    void testExpansionFailureScoresInfinity() {
        RoutingScenario scenario = ScenarioFixtures.orangeDeliveries();
        FitnessEvaluator evaluator = new FitnessEvaluator(scenario, (order, random) -> {
            throw new IllegalStateException("vehicle 1 cannot deliver 90 oranges (carrying 83)");
        });

        assertTrue(scenario.isPermutation(new int[]{0, 1}));
        assertEquals(Double.POSITIVE_INFINITY, evaluator.evaluate(new int[]{0, 1}, 1L));
        assertThrows(IllegalStateException.class, () -> evaluator.expand(new int[]{0, 1}, 1L));
    }

    @Test
    @DisplayName("Expanding with the scoring seed reproduces the scored distance")
    void testExpandReproducesScore() {
        RoutingScenario scenario = ScenarioFixtures.mixed(17L, 6, 4, List.of(250, 400));
        FitnessEvaluator evaluator = evaluator(scenario);
        int[] order = {9, 0, 8, 1, 7, 2, 6, 3, 5, 4};

        for (long seed = 0L; seed < 5L; seed++) {
            double score = evaluator.evaluate(order, seed);
            ServicePlan plan = evaluator.expand(order, seed);

            assertTrue(Double.isFinite(score));
            assertEquals(score, FitnessEvaluator.travelledDistance(plan), EPSILON);
        }
    }

    @Test
    @DisplayName("Travelled distance adds the assigned-warehouse leg and the closing leg to route distance")
    void testTravelledDistanceIncludesBoundaryLegs() {
        RoutingScenario scenario = ScenarioFixtures.orangeDeliveries();
        ServicePlan plan = evaluator(scenario).expand(new int[]{1, 0}, 1L);

        assertEquals(150.0d, plan.vehicles().get(0).routeDistance(), EPSILON);
        assertEquals(180.0d, FitnessEvaluator.travelledDistance(plan), EPSILON);
    }
}
