package com.ryuqq.lifecycle.core.model;

/**
 * 로스터 엔티티의 안정적인 식별자 (유형 + ID).
 *
 * <p>cascade 방문 집합(visited-set), 저장소 조회, 로그 출력에 사용됩니다.
 * 동일 ID라도 유형이 다르면 다른 엔티티입니다.</p>
 *
 * @param type 엔티티 유형
 * @param id 저장소가 부여한 ID (양수)
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public record EntityKey(EntityType type, long id) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException type이 null이거나 id가 양수가 아닌 경우
     */
    public EntityKey {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (id <= 0) {
            throw new IllegalArgumentException("id must be positive (current: " + id + ")");
        }
    }

    /**
     * EntityKey 생성.
     *
     * @param type 엔티티 유형
     * @param id 엔티티 ID
     * @return EntityKey 인스턴스
     */
    public static EntityKey of(EntityType type, long id) {
        return new EntityKey(type, id);
    }

    @Override
    public String toString() {
        return type.name() + ":" + id;
    }
}
