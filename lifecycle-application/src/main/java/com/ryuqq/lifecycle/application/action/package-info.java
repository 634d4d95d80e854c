/**
 * Batch Convenience Actions.
 *
 * <p>Type-aware entry points that assemble a Transition Pipeline with the cascades and
 * validations appropriate for the entity's roster type.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.application.action.LifecycleActions} - action contract</li>
 *   <li>{@link com.ryuqq.lifecycle.application.action.DefaultLifecycleActions} - type-based cascade selection</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.application.action;
