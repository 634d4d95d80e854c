package com.ryuqq.lifecycle.core.config;

/**
 * 생명주기 엔진 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxCascadeDepth: cascade 체인 최대 깊이 (기본 32)</li>
 *   <li>compensationEnabled: Action Pipeline 실패 시 보상 작업 수행 여부 (기본 true)</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @param maxCascadeDepth cascade 최대 깊이 (1 이상이어야 함)
 * @param compensationEnabled 보상 작업 활성화 여부
 */
public record LifecycleConfig(int maxCascadeDepth, boolean compensationEnabled) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxCascadeDepth=32, compensationEnabled=true</p>
     */
    public LifecycleConfig() {
        this(32, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public LifecycleConfig {
        if (maxCascadeDepth <= 0) {
            throw new IllegalArgumentException(
                "maxCascadeDepth must be positive (current: " + maxCascadeDepth + ")"
            );
        }
    }

    /**
     * maxCascadeDepth만 변경한 새 인스턴스 생성.
     *
     * @param maxCascadeDepth 새 최대 깊이
     * @return 새 LifecycleConfig 인스턴스
     */
    public LifecycleConfig withMaxCascadeDepth(int maxCascadeDepth) {
        return new LifecycleConfig(maxCascadeDepth, this.compensationEnabled);
    }

    /**
     * compensationEnabled만 변경한 새 인스턴스 생성.
     *
     * @param compensationEnabled 보상 작업 활성화 여부
     * @return 새 LifecycleConfig 인스턴스
     */
    public LifecycleConfig withCompensationEnabled(boolean compensationEnabled) {
        return new LifecycleConfig(this.maxCascadeDepth, compensationEnabled);
    }
}
