/**
 * Reusable validation strategies for team-level transitions.
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.application.validation;
