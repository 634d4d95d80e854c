/**
 * Collection Filter/Batch Manager.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.application.collection.MemberCollectionManager} - ordered AND filters, batch transitions, statistics</li>
 *   <li>Status literals: {@link com.ryuqq.lifecycle.application.collection.EmploymentFilter},
 *       {@link com.ryuqq.lifecycle.application.collection.SuspensionFilter},
 *       {@link com.ryuqq.lifecycle.application.collection.InjuryFilter},
 *       {@link com.ryuqq.lifecycle.application.collection.RetirementFilter}</li>
 *   <li>{@link com.ryuqq.lifecycle.application.collection.StatusStatistics} - read-only bucket counts</li>
 * </ul>
 *
 * <h2>Ordering</h2>
 * <p>Batch operations issue one Transition Pipeline per filtered entity, sequentially, in the
 * source collection's iteration order.</p>
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.application.collection;
