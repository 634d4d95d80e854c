/**
 * Roster entity views backed by the in-memory store.
 *
 * <h2>Capability Matrix</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.adapter.inmemory.roster.Wrestler} - employable, suspendable, injurable, retirable; has managers; team and group member</li>
 *   <li>{@link com.ryuqq.lifecycle.adapter.inmemory.roster.Manager} - employable, suspendable, injurable, retirable; manages wrestlers and tag teams</li>
 *   <li>{@link com.ryuqq.lifecycle.adapter.inmemory.roster.Referee} - employable, suspendable, injurable, retirable</li>
 *   <li>{@link com.ryuqq.lifecycle.adapter.inmemory.roster.TagTeam} - employable, suspendable, retirable; has wrestlers and managers</li>
 *   <li>{@link com.ryuqq.lifecycle.adapter.inmemory.roster.Stable} - employable, suspendable, retirable; member group</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.adapter.inmemory.roster;
