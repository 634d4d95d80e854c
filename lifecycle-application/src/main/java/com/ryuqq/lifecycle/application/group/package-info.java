/**
 * Group Membership Orchestrator.
 *
 * <p>Queues merge, split and member-transfer operations against a group (stable) and runs them,
 * followed by employment, suspension or source-retirement cascades, inside one transaction.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.application.group.GroupMembershipOrchestrator} - operation queue and execution</li>
 *   <li>{@link com.ryuqq.lifecycle.application.group.GroupOrchestrationResult} - distinct resulting groups</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.application.group;
