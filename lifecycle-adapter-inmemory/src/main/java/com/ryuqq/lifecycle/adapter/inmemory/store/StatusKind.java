package com.ryuqq.lifecycle.adapter.inmemory.store;

/**
 * 기간으로 기록되는 상태 종류.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum StatusKind {
    EMPLOYMENT,
    SUSPENSION,
    INJURY,
    RETIREMENT
}
