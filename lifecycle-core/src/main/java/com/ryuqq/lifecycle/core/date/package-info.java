/**
 * Effective-date resolution for lifecycle operations.
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.core.date;
