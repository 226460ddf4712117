package org.fleetroute.planning;

import org.fleetroute.model.GoodCatalog;
import org.fleetroute.model.Point;
import org.fleetroute.testutil.ScenarioFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Routing Scenario Tests")
class RoutingScenarioTest {
    private final Point warehouse = Point.warehouse("W1", 0, 0);
    private final Point delivery = Point.service("D1", 1, 0, Map.of(GoodCatalog.ORANGES, 5));
    private final Point pickup = Point.service("P1", 0, 1, Map.of(GoodCatalog.TUNA, -5));

    private static void assertReason(String reasonCode, Executable executable) {
        RoutePlanningException ex = assertThrows(RoutePlanningException.class, executable);
        assertEquals(reasonCode, ex.reasonCode());
    }

    @Nested
    @DisplayName("Indexing")
    class Indexing {

        @Test
        @DisplayName("Service points are indexed densely in input order, skipping warehouses")
        void testDenseIndexing() {
            RoutingScenario scenario = RoutingScenario.builder()
                    .points(List.of(delivery, warehouse, pickup))
                    .vehicleCapacities(List.of(10, 20))
                    .build();

            assertEquals(2, scenario.serviceCount());
            assertSame(delivery, scenario.servicePoint(0));
            assertSame(pickup, scenario.servicePoint(1));
            assertEquals(1, scenario.indexOf(pickup));
            assertEquals(-1, scenario.indexOf(warehouse));
            assertEquals(List.of(warehouse), scenario.warehouses());
            assertEquals(2, scenario.vehicleCount());
            assertEquals(20, scenario.vehicleCapacity(1));
            assertEquals(GoodCatalog.defaultCatalog().goods(), scenario.goodCatalog().goods());
        }

        @Test
        @DisplayName("Indexing is by identity, not by equal content")
        void testIdentityIndexing() {
            RoutingScenario scenario = ScenarioFixtures.orangeDeliveries();
            Point lookalike = Point.service("D1", 20, 50, Map.of(GoodCatalog.ORANGES, 100));

            assertEquals(-1, scenario.indexOf(lookalike));
        }

        @Test
        @DisplayName("Permutation check rejects wrong length, duplicates and sentinels")
        void testIsPermutation() {
            RoutingScenario scenario = ScenarioFixtures.mixed(3L, 3, 1, List.of(100));

            assertTrue(scenario.isPermutation(new int[]{3, 1, 0, 2}));
            assertFalse(scenario.isPermutation(new int[]{0, 1, 2}));
            assertFalse(scenario.isPermutation(new int[]{0, 1, 1, 2}));
            assertFalse(scenario.isPermutation(new int[]{0, 1, 2, -1}));
            assertFalse(scenario.isPermutation(new int[]{0, 1, 2, 4}));
            assertFalse(scenario.isPermutation(null));
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Missing points, service points, vehicles or warehouses are rejected")
        void testMissingParts() {
            assertReason(RoutingScenario.REASON_POINTS_REQUIRED,
                    () -> RoutingScenario.builder().points(List.of()).vehicleCapacities(List.of(1)).build());
            assertReason(RoutingScenario.REASON_SERVICE_POINTS_REQUIRED,
                    () -> RoutingScenario.builder().points(List.of(warehouse)).vehicleCapacities(List.of(1)).build());
            assertReason(RoutingScenario.REASON_VEHICLES_REQUIRED,
                    () -> RoutingScenario.builder().points(List.of(warehouse, delivery)).build());
            assertReason(RoutingScenario.REASON_WAREHOUSES_REQUIRED,
                    () -> RoutingScenario.builder().points(List.of(delivery)).vehicleCapacities(List.of(1)).build());
        }

        @Test
        @DisplayName("Non-positive capacities are rejected")
        void testCapacityValidation() {
            assertReason(RoutingScenario.REASON_CAPACITY_INVALID,
                    () -> RoutingScenario.builder()
                            .points(List.of(warehouse, delivery))
                            .vehicleCapacities(List.of(10, 0))
                            .build());
            assertReason(RoutingScenario.REASON_CAPACITY_INVALID,
                    () -> RoutingScenario.builder()
                            .points(List.of(warehouse, delivery))
                            .vehicleCapacities(Arrays.asList(10, null))
                            .build());
        }

        @Test
        @DisplayName("Warehouse lists must hold warehouses and cover flagged points")
        void testWarehouseTypeMismatch() {
            assertReason(RoutingScenario.REASON_WAREHOUSE_TYPE_MISMATCH,
                    () -> RoutingScenario.builder()
                            .points(List.of(warehouse, delivery))
                            .warehouses(List.of(delivery))
                            .vehicleCapacities(List.of(1))
                            .build());
            Point other = Point.warehouse("W2", 5, 5);
            assertReason(RoutingScenario.REASON_WAREHOUSE_TYPE_MISMATCH,
                    () -> RoutingScenario.builder()
                            .points(List.of(warehouse, other, delivery))
                            .warehouses(List.of(warehouse))
                            .vehicleCapacities(List.of(1))
                            .build());
        }

        @Test
        @DisplayName("Service points listed twice are rejected")
        void testDuplicatePoint() {
            assertReason(RoutingScenario.REASON_DUPLICATE_POINT,
                    () -> RoutingScenario.builder()
                            .points(List.of(warehouse, delivery, delivery))
                            .vehicleCapacities(List.of(1))
                            .build());
        }

        @Test
        @DisplayName("Points built against another catalog are rejected")
        void testCatalogMismatch() {
            GoodCatalog fruit = GoodCatalog.of("apples", "pears");
            Point apples = Point.service("A1", 1, 1, Map.of("apples", 3), fruit);

            assertReason(RoutingScenario.REASON_GOOD_CATALOG_MISMATCH,
                    () -> RoutingScenario.builder()
                            .points(List.of(warehouse, apples))
                            .vehicleCapacities(List.of(1))
                            .build());

            RoutingScenario scenario = RoutingScenario.builder()
                    .points(List.of(Point.warehouse("W", 0, 0, fruit), apples))
                    .vehicleCapacities(List.of(1))
                    .goodCatalog(fruit)
                    .build();
            assertEquals(1, scenario.serviceCount());
        }
    }
}
