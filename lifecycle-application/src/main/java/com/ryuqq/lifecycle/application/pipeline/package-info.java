/**
 * Composite Action Pipeline.
 *
 * <p>Ordered multi-operation workflows executed in one transaction with abort or
 * continue-on-error semantics and best-effort reverse-order compensation.</p>
 *
 * <h2>Compensation</h2>
 * <ul>
 *   <li>Built-in operations record a {@link com.ryuqq.lifecycle.application.pipeline.CompensationRecord}
 *       (employ→release, release→employ, retire→unretire, suspend→reinstate,
 *       merge→restore_group_memberships, split→delete_group)</li>
 *   <li>Custom operations with a rollback callback have it invoked</li>
 *   <li>Failures become {@link com.ryuqq.lifecycle.core.exception.CompensationException}, logged and retained</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.application.pipeline;
