/**
 * Value types shared by every layer of the lifecycle engine.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.model.EntityKey} - Stable (type, id) identity used by visited-sets and lookups</li>
 *   <li>{@link com.ryuqq.lifecycle.core.model.EntityType} - Roster entity type (individuals and groups)</li>
 *   <li>{@link com.ryuqq.lifecycle.core.model.Transition} - The six named lifecycle transitions</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.core.model;
