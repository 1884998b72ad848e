/**
 * Operation state machine package.
 *
 * <p>This package implements the lifecycle rules of a change Operation.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.smokestack.core.statemachine.OperationState} - Operation lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.smokestack.core.statemachine.StateTransition} - State transition validation</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * PLANNED     → IN_PROGRESS, CANCELED
 * PAUSED      → IN_PROGRESS
 * IN_PROGRESS → PAUSED, COMPLETED, ABORTED
 * any state   → itself (no-op)
 *
 * Forbidden:
 * - COMPLETED, ABORTED, CANCELED → * (terminal states)
 * - PLANNED → PAUSED, COMPLETED, ABORTED
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * StateTransition.canTransition(OperationState.PLANNED, OperationState.IN_PROGRESS); // true
 * StateTransition.validate(OperationState.IN_PROGRESS, OperationState.COMPLETED);   // ok
 *
 * // This will throw SmokestackException (INVALID_STATE_TRANSITION)
 * StateTransition.validate(OperationState.COMPLETED, OperationState.IN_PROGRESS);
 * </pre>
 *
 * @since 1.0.0
 * @author Smokestack Team
 */
package com.ryuqq.smokestack.core.statemachine;
