/**
 * Execution request state machine package.
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * IDLE → DISPATCHED (submit)
 * DISPATCHED → COMPLETED (result published)
 *
 * Forbidden:
 * - COMPLETED → * (terminal state)
 * - Backward transitions (e.g., DISPATCHED → IDLE)
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * RequestState state = RequestState.IDLE;
 * state = StateTransition.transition(state, RequestState.DISPATCHED);
 * state = StateTransition.transition(state, RequestState.COMPLETED);
 * </pre>
 *
 * @since 1.0.0
 * @author Toolbox Team
 */
package com.ryuqq.toolbox.core.statemachine;
