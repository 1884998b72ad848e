package com.ryuqq.smokestack.core.model;

import com.ryuqq.smokestack.core.statemachine.OperationState;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OperationFilter 테스트.
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
class OperationFilterTest {

    private final Operation operation = new Operation(1234L, "Migrate", "Index", URI.create("https://example.com"),
        List.of("api", "db"), List.of("db"), List.of("urgent"), List.of(), List.of("alice"),
        OperationState.IN_PROGRESS, Map.of());

    @Test
    void all_MatchesEverything() {
        assertTrue(OperationFilter.all().matches(operation));
    }

    @Test
    void valuesWithinField_AreOred() {
        assertTrue(OperationFilter.all().withComponents(List.of("cache", "db")).matches(operation));
        assertFalse(OperationFilter.all().withComponents(List.of("cache")).matches(operation));
        assertTrue(OperationFilter.all()
            .withStatuses(List.of(OperationState.PLANNED, OperationState.IN_PROGRESS)).matches(operation));
    }

    @Test
    void fields_AreAnded() {
        OperationFilter filter = OperationFilter.all()
            .withComponents(List.of("db"))
            .withOperators(List.of("alice"));

        assertTrue(filter.matches(operation));
        assertFalse(filter.withTags(List.of("later")).matches(operation));
        assertFalse(filter.withStatuses(List.of(OperationState.COMPLETED)).matches(operation));
    }
}
