/**
 * Cascade strategy library.
 *
 * <p>Factory methods returning {@link com.ryuqq.lifecycle.application.transition.CascadeStrategy}
 * closures. Each one is guarded by the transition it reacts to and checks relationship
 * capabilities (through {@link com.ryuqq.lifecycle.application.cascade.Relationship}) before
 * traversing them.</p>
 *
 * <h2>Strategies</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.application.cascade.EmploymentCascadeStrategy} - employ related entities</li>
 *   <li>{@link com.ryuqq.lifecycle.application.cascade.SuspensionCascadeStrategy} - suspend employed, active related entities</li>
 *   <li>{@link com.ryuqq.lifecycle.application.cascade.ReinstatementCascadeStrategy} - reinstate suspended related entities</li>
 *   <li>{@link com.ryuqq.lifecycle.application.cascade.RetirementCascadeStrategy} - close membership and management edges</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.application.cascade;
