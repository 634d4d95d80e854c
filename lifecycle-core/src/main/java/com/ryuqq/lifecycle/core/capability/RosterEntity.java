package com.ryuqq.lifecycle.core.capability;

import com.ryuqq.lifecycle.core.model.EntityKey;
import com.ryuqq.lifecycle.core.model.EntityType;

/**
 * 생명주기 전이에 참여하는 모든 로스터 엔티티의 기본 계약.
 *
 * <p>엔티티의 레코드는 영속성 계층이 소유합니다. 오케스트레이션 계층은
 * 하나의 작업 동안만 참조를 빌려 쓰며, 엔티티 객체를 직접 변경하지 않습니다.
 * 지원하는 전이와 관계는 아래 capability 인터페이스 구현 여부로 판단합니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @see Employable
 * @see Suspendable
 * @see Injurable
 * @see Retirable
 */
public interface RosterEntity {

    /**
     * 엔티티 식별자.
     *
     * @return 유형 + ID 키
     */
    EntityKey key();

    /**
     * 표시 이름.
     *
     * @return 엔티티 이름
     */
    String name();

    /**
     * 엔티티 유형 (key().type() 단축).
     *
     * @return 엔티티 유형
     */
    default EntityType type() {
        return key().type();
    }
}
