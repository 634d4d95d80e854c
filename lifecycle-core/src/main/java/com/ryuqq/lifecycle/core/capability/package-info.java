/**
 * Capability model: typed interfaces describing what a roster entity supports.
 *
 * <h2>Transition Capabilities</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.capability.Employable} - employ / release</li>
 *   <li>{@link com.ryuqq.lifecycle.core.capability.Suspendable} - suspend / reinstate</li>
 *   <li>{@link com.ryuqq.lifecycle.core.capability.Injurable} - injure (individuals only)</li>
 *   <li>{@link com.ryuqq.lifecycle.core.capability.Retirable} - retire</li>
 * </ul>
 *
 * <h2>Relationship Capabilities</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.capability.HasManagers} - managers assigned to the entity</li>
 *   <li>{@link com.ryuqq.lifecycle.core.capability.HasSubMembers} - group members
 *       ({@link com.ryuqq.lifecycle.core.capability.HasWrestlers},
 *       {@link com.ryuqq.lifecycle.core.capability.HasTagTeams},
 *       {@link com.ryuqq.lifecycle.core.capability.MemberGroup})</li>
 *   <li>{@link com.ryuqq.lifecycle.core.capability.BelongsToGroup} - current stable</li>
 *   <li>{@link com.ryuqq.lifecycle.core.capability.TeamMember} - current tag team</li>
 *   <li>{@link com.ryuqq.lifecycle.core.capability.ManagesMembers} - wrestlers and tag teams a manager manages</li>
 * </ul>
 *
 * <h2>Roster Type Matrix</h2>
 * <pre>
 *             employ  suspend  injure  retire
 * Wrestler      O       O        O       O
 * Manager       O       O        O       O
 * Referee       O       O        O       O
 * Tag Team      O       O        X       O
 * Stable        O       O        X       O
 * </pre>
 *
 * <p>Callers check capabilities with {@code instanceof} (or
 * {@link com.ryuqq.lifecycle.core.capability.Capabilities}) before traversing a relationship.</p>
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.core.capability;
