/**
 * Roster lifecycle state machine.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.statemachine.RosterState} - States derived from an entity's state periods</li>
 *   <li>{@link com.ryuqq.lifecycle.core.statemachine.StateTransition} - Legal edges and guard validation</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * UNEMPLOYED / RELEASED / RETIRED  --employ-->    EMPLOYED
 * EMPLOYED                         --suspend-->   SUSPENDED
 * SUSPENDED                        --reinstate--> EMPLOYED
 * EMPLOYED                         --injure-->    INJURED
 * EMPLOYED / SUSPENDED / INJURED   --release-->   RELEASED
 * EMPLOYED / SUSPENDED / INJURED   --retire-->    RETIRED
 * </pre>
 *
 * <p>No state is terminal. FUTURE_EMPLOYED entities accept no transition until the
 * scheduled employment starts.</p>
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.core.statemachine;
