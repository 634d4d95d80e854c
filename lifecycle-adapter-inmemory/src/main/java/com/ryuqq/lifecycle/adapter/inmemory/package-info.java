/**
 * In-memory persistence collaborator for the roster lifecycle engine.
 *
 * <h2>Packages</h2>
 * <ul>
 *   <li>{@code store} - names, status periods, membership edges, snapshots</li>
 *   <li>{@code roster} - entity views implementing the capability interfaces</li>
 *   <li>{@code repository} - roster and membership repository SPI implementations</li>
 *   <li>{@code transaction} - snapshot-based ambient transaction manager</li>
 * </ul>
 *
 * <p>{@link com.ryuqq.lifecycle.adapter.inmemory.InMemoryRoster} wires them together.</p>
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.adapter.inmemory;
