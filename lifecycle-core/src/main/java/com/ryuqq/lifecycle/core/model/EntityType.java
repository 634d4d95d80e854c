package com.ryuqq.lifecycle.core.model;

/**
 * 로스터 엔티티 유형.
 *
 * <p>개인(WRESTLER, MANAGER, REFEREE)과 그룹(TAG_TEAM, STABLE)으로 나뉩니다.
 * 유형은 저장소 조회 키로 사용되며, 엔티티가 지원하는 능력(capability)은
 * 유형이 아니라 구현한 인터페이스로 판단합니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum EntityType {

    WRESTLER("Wrestler", "Wrestlers"),
    MANAGER("Manager", "Managers"),
    REFEREE("Referee", "Referees"),
    TAG_TEAM("Tag Team", "Tag Teams"),
    STABLE("Stable", "Stables");

    private final String label;
    private final String pluralLabel;

    EntityType(String label, String pluralLabel) {
        this.label = label;
        this.pluralLabel = pluralLabel;
    }

    /**
     * 화면/메시지 표시용 이름.
     *
     * @return 단수 라벨 (예: "Tag Team")
     */
    public String label() {
        return label;
    }

    /**
     * 복수형 표시 이름.
     *
     * @return 복수 라벨 (예: "Tag Teams")
     */
    public String pluralLabel() {
        return pluralLabel;
    }

    /**
     * 개인 엔티티인지 확인.
     *
     * @return WRESTLER, MANAGER, REFEREE인 경우 true
     */
    public boolean isIndividual() {
        return this == WRESTLER || this == MANAGER || this == REFEREE;
    }

    /**
     * 그룹 엔티티인지 확인.
     *
     * @return TAG_TEAM, STABLE인 경우 true
     */
    public boolean isGroup() {
        return !isIndividual();
    }

    /**
     * 라벨 또는 상수 이름으로 유형 조회 (대소문자, 공백/언더스코어 무시).
     *
     * @param value "tag_team", "Tag Team", "TAG_TEAM" 등
     * @return 일치하는 EntityType
     * @throws IllegalArgumentException 일치하는 유형이 없는 경우
     */
    public static EntityType fromName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("entity type name cannot be null or blank");
        }
        String normalized = normalize(value);
        for (EntityType type : values()) {
            if (normalize(type.name()).equals(normalized) || normalize(type.label).equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown entity type: " + value);
    }

    private static String normalize(String value) {
        return value.replace("_", "").replace(" ", "").toLowerCase(java.util.Locale.ROOT);
    }
}
