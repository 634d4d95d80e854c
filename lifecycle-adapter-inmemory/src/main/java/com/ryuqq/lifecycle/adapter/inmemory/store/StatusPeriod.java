package com.ryuqq.lifecycle.adapter.inmemory.store;

import com.ryuqq.lifecycle.core.model.EntityKey;

import java.time.LocalDateTime;

/**
 * 상태 기간 (고용, 정지, 부상, 은퇴).
 *
 * @param key 엔티티 키
 * @param kind 상태 종류
 * @param start 시작 시각
 * @param end 종료 시각 (열린 기간이면 null)
 * @param notes 메모 (nullable)
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public record StatusPeriod(EntityKey key, StatusKind kind, LocalDateTime start, LocalDateTime end, String notes) {

    public StatusPeriod {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
    }

    public boolean isOpen() {
        return end == null;
    }

    /**
     * 기준 시각에 유효한지 확인 (start &lt;= at &lt; end).
     *
     * @param at 기준 시각
     * @return 유효하면 true
     */
    public boolean isActiveAt(LocalDateTime at) {
        return !start.isAfter(at) && (end == null || end.isAfter(at));
    }

    public StatusPeriod closedAt(LocalDateTime date) {
        return new StatusPeriod(key, kind, start, date, notes);
    }
}
