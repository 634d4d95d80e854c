/**
 * Explicit runtime wiring shared by every component of the engine.
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.application.context;
