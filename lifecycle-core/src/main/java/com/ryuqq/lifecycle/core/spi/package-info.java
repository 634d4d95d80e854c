/**
 * Service Provider Interfaces the lifecycle engine consumes.
 *
 * <h2>Collaborators</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.spi.RosterRepository} - State-period mutations per entity type</li>
 *   <li>{@link com.ryuqq.lifecycle.core.spi.MembershipRepository} - Group membership and management edges</li>
 *   <li>{@link com.ryuqq.lifecycle.core.spi.RepositoryRegistry} - Explicit type to repository mapping</li>
 *   <li>{@link com.ryuqq.lifecycle.core.spi.TransactionManager} - Re-entrant ambient transaction scope</li>
 * </ul>
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li><strong>Ambient transactions:</strong> nested runInTransaction calls join the outer scope</li>
 *   <li><strong>No entity creation:</strong> repositories only open/close state periods and edges
 *       (the one exception is {@code createGroup} used by stable splits)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.core.spi;
