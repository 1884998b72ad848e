package com.ryuqq.smokestack.testkit.contract;

import com.ryuqq.smokestack.core.error.ErrorKind;
import com.ryuqq.smokestack.core.error.SmokestackException;
import com.ryuqq.smokestack.core.model.Operation;
import com.ryuqq.smokestack.core.statemachine.OperationState;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.ryuqq.smokestack.core.statemachine.OperationState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract test for the operation lifecycle driven through the engine.
 *
 * <p>Every one of the 36 ordered (from, to) pairs is exercised on a stored operation.
 * Legal pairs commit the new status; illegal ones fail with INVALID_STATE_TRANSITION
 * and leave the stored status untouched.</p>
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
class StateTransitionContractTest extends AbstractEngineContractTest {

    private static final Map<OperationState, Set<OperationState>> LEGAL = Map.of(
        PLANNED, EnumSet.of(PLANNED, IN_PROGRESS, CANCELED),
        IN_PROGRESS, EnumSet.of(IN_PROGRESS, PAUSED, COMPLETED, ABORTED),
        PAUSED, EnumSet.of(PAUSED, IN_PROGRESS),
        COMPLETED, EnumSet.of(COMPLETED),
        ABORTED, EnumSet.of(ABORTED),
        CANCELED, EnumSet.of(CANCELED)
    );

    @Test
    void allOrderedPairs_MatchTransitionTable() {
        for (OperationState from : OperationState.values()) {
            for (OperationState to : OperationState.values()) {
                // Given
                Operation operation = createOperation(from + "-to-" + to, List.of(DB), List.of());
                driveTo(operation.id(), from);

                // When & Then
                if (LEGAL.get(from).contains(to)) {
                    assertDoesNotThrow(() -> transition(operation.id(), to), from + " -> " + to);
                    assertStatus(operation.id(), to);
                } else {
                    SmokestackException exception = assertFails(ErrorKind.INVALID_STATE_TRANSITION,
                        () -> transition(operation.id(), to));
                    assertEquals(from.wireName(), exception.detail("from"));
                    assertEquals(to.wireName(), exception.detail("to"));
                    assertStatus(operation.id(), from);
                }
            }
        }
    }

    @Test
    void createdOperation_IsAlwaysPlanned() {
        // When
        Operation operation = createOperation("fresh", List.of(DB), List.of(DB));

        // Then
        assertEquals(PLANNED, operation.status());
        assertTrue(engine.locks().isEmpty(), "Planned operations hold no locks");
    }

    @Test
    void terminalOperation_CannotBeRestarted() {
        // Given
        Operation operation = createOperation("done", List.of(DB), List.of());
        start(operation.id());
        complete(operation.id());

        // When & Then
        assertFails(ErrorKind.INVALID_STATE_TRANSITION, () -> start(operation.id()));
        assertStatus(operation.id(), COMPLETED);
    }

    private void driveTo(long id, OperationState target) {
        switch (target) {
            case PLANNED -> { }
            case IN_PROGRESS -> start(id);
            case PAUSED -> {
                start(id);
                transition(id, PAUSED);
            }
            case COMPLETED -> {
                start(id);
                complete(id);
            }
            case ABORTED -> {
                start(id);
                transition(id, ABORTED);
            }
            case CANCELED -> transition(id, CANCELED);
        }
        assertStatus(id, target);
    }
}
