/**
 * In-memory implementations of the roster and membership repository SPIs.
 *
 * @see com.ryuqq.lifecycle.core.spi.RosterRepository
 * @see com.ryuqq.lifecycle.core.spi.MembershipRepository
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.adapter.inmemory.repository;
