package com.ryuqq.smokestack.testkit.contract;

import com.ryuqq.smokestack.application.request.UpdateOperationRequest;
import com.ryuqq.smokestack.core.error.ErrorKind;
import com.ryuqq.smokestack.core.error.SmokestackException;
import com.ryuqq.smokestack.core.model.Operation;
import com.ryuqq.smokestack.core.statemachine.OperationState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract test for the completion-order gate between operations.
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
class DependencyGateContractTest extends AbstractEngineContractTest {

    @Test
    void start_WithPlannedDependency_FailsUntilDependencyCompleted() {
        // Given
        Operation first = createOperation("first", List.of(DB), List.of());
        Operation second = engine.createOperation(ALICE,
            operationRequest("second", List.of(DB), List.of()).withDependsOn(List.of(first.id())));

        // When & Then: dependency still planned
        SmokestackException exception = assertFails(ErrorKind.UNMET_DEPENDENCY, () -> start(second.id()));
        assertEquals(String.valueOf(first.id()), exception.detail("operation"));
        assertEquals(424, exception.kind().statusCode());
        assertStatus(second.id(), OperationState.PLANNED);

        // When & Then: dependency running
        start(first.id());
        assertFails(ErrorKind.UNMET_DEPENDENCY, () -> start(second.id()));

        // When & Then: dependency completed
        complete(first.id());
        assertDoesNotThrow(() -> start(second.id()));
        assertStatus(second.id(), OperationState.IN_PROGRESS);
    }

    @Test
    void start_WithAbortedDependency_Fails() {
        // Given
        Operation first = createOperation("first", List.of(DB), List.of());
        start(first.id());
        transition(first.id(), OperationState.ABORTED);
        Operation second = engine.createOperation(ALICE,
            operationRequest("second", List.of(DB), List.of()).withDependsOn(List.of(first.id())));

        // When & Then
        assertFails(ErrorKind.UNMET_DEPENDENCY, () -> start(second.id()));
    }

    @Test
    void start_WithMultipleDependencies_RequiresAllCompleted() {
        // Given
        Operation a = createOperation("a", List.of(DB), List.of());
        Operation b = createOperation("b", List.of(DB), List.of());
        Operation dependent = engine.createOperation(ALICE,
            operationRequest("dependent", List.of(DB), List.of()).withDependsOn(List.of(b.id(), a.id())));
        start(a.id());
        complete(a.id());

        // When & Then
        SmokestackException exception = assertFails(ErrorKind.UNMET_DEPENDENCY, () -> start(dependent.id()));
        assertEquals(String.valueOf(b.id()), exception.detail("operation"));

        start(b.id());
        complete(b.id());
        assertDoesNotThrow(() -> start(dependent.id()));
    }

    @Test
    void addingUnmetDependency_ToRunningOperation_Fails() {
        // Given
        Operation prerequisite = createOperation("prerequisite", List.of(DB), List.of());
        Operation running = createOperation("running", List.of(DB), List.of());
        start(running.id());

        // When & Then
        assertFails(ErrorKind.UNMET_DEPENDENCY, () -> engine.updateOperation(running.id(),
            UpdateOperationRequest.empty().withDependsOn(List.of(prerequisite.id()))));
        assertTrue(engine.getOperation(running.id()).dependsOn().isEmpty());
    }

    @Test
    void gate_DoesNotApplyToOtherTransitions() {
        // Given
        Operation first = createOperation("first", List.of(DB), List.of());
        Operation second = engine.createOperation(ALICE,
            operationRequest("second", List.of(DB), List.of()).withDependsOn(List.of(first.id())));

        // When & Then
        assertDoesNotThrow(() -> transition(second.id(), OperationState.CANCELED));
    }
}
