/**
 * In-memory roster state.
 *
 * <p>Holds names, status periods and membership edges behind a single synchronized store,
 * with snapshot/restore used by the in-memory transaction manager.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No durability; data lost on process restart</li>
 *   <li>Suitable for contract tests and as a reference persistence collaborator</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.adapter.inmemory.store;
