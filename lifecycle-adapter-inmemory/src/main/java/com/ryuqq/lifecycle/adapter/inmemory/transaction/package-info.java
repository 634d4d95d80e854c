/**
 * Snapshot-based ambient transaction manager for the in-memory store.
 *
 * @see com.ryuqq.lifecycle.core.spi.TransactionManager
 * @since 1.0.0
 * @author Lifecycle Team
 */
package com.ryuqq.lifecycle.adapter.inmemory.transaction;
