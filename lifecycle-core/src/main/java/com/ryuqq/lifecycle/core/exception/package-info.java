/**
 * Error taxonomy of the lifecycle engine.
 *
 * <h2>Hierarchy</h2>
 * <pre>
 * LifecycleException (unchecked, carries an error code)
 * ├── ConfigurationException          unknown names, missing repositories or mutations
 * │   └── CascadeDepthExceededException
 * ├── ValidationException             business-rule guard failures
 * │   ├── TransitionNotAllowedException
 * │   ├── UnsupportedCapabilityException
 * │   ├── InvalidStatusFilterException
 * │   ├── InvalidDateRangeException
 * │   └── MembershipConflictException
 * └── CompensationException           logged and retained, never thrown to callers
 * </pre>
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.core.exception;
