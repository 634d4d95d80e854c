/**
 * Transition Pipeline: the single-entity state machine core.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.application.transition.StatusTransitionPipeline} - validate, end prior state, mutate, cascade</li>
 *   <li>{@link com.ryuqq.lifecycle.application.transition.ValidationStrategy} - pluggable veto</li>
 *   <li>{@link com.ryuqq.lifecycle.application.transition.CascadeStrategy} - pluggable follow-up transitions</li>
 *   <li>{@link com.ryuqq.lifecycle.application.transition.CascadeContext} - per-call visited path, depth bound and visited-sets</li>
 * </ul>
 *
 * <h2>Transaction Discipline</h2>
 * <p>The outermost {@code execute()} opens the ambient transaction. Pipelines spawned by
 * cascades join it, so a failure anywhere in the chain rolls back the whole call.</p>
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.application.transition;
