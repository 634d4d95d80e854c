/**
 * Contract test infrastructure for the roster lifecycle engine.
 *
 * <h2>Contents</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.testkit.contract.AbstractLifecycleContractTest}: base class wiring
 *       the engine to the in-memory adapter with a fixed clock</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <p>Extend the base class and drive the engine through {@code actions}, {@code context} or the
 * application builders; seed existing status through {@code roster}.</p>
 *
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.testkit.contract;
