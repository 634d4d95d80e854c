package com.ryuqq.lifecycle.adapter.inmemory.store;

import com.ryuqq.lifecycle.core.model.EntityKey;

import java.time.LocalDateTime;

/**
 * 소속 관계 (그룹-멤버, 태그팀-레슬러, 피관리자-매니저).
 *
 * @param owner 소유 측 (스테이블, 태그팀, 또는 매니저를 둔 레슬러/태그팀)
 * @param member 멤버 측
 * @param joined 가입 시각
 * @param left 탈퇴 시각 (현재 멤버면 null)
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public record MembershipEdge(EntityKey owner, EntityKey member, LocalDateTime joined, LocalDateTime left) {

    public MembershipEdge {
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        if (member == null) {
            throw new IllegalArgumentException("member cannot be null");
        }
        if (joined == null) {
            throw new IllegalArgumentException("joined cannot be null");
        }
    }

    public boolean isCurrent() {
        return left == null;
    }

    public MembershipEdge leftAt(LocalDateTime date) {
        return new MembershipEdge(owner, member, joined, date);
    }
}
