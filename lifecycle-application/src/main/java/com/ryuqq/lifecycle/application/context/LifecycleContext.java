package com.ryuqq.lifecycle.application.context;

import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.config.LifecycleConfig;
import com.ryuqq.lifecycle.core.date.EffectiveDates;
import com.ryuqq.lifecycle.core.spi.MembershipRepository;
import com.ryuqq.lifecycle.core.spi.RepositoryRegistry;
import com.ryuqq.lifecycle.core.spi.RosterRepository;
import com.ryuqq.lifecycle.core.spi.TransactionManager;

import java.time.Clock;

/**
 * 엔진 런타임 배선 (불변 record).
 *
 * <p>컨테이너나 리플렉션 없이 모든 협력자를 명시적으로 전달합니다.
 * 모든 파이프라인, 컬렉션 매니저, 오케스트레이터는 이 컨텍스트 하나로 생성됩니다.</p>
 *
 * <p><strong>사용 예:</strong></p>
 * <pre>
 * LifecycleContext context = LifecycleContext.of(registry, transactionManager)
 *     .withClock(Clock.systemUTC())
 *     .withConfig(new LifecycleConfig().withMaxCascadeDepth(16));
 *
 * StatusTransitionPipeline.employ(context, wrestler, null).execute();
 * </pre>
 *
 * @param registry 유형별 저장소 레지스트리
 * @param transactionManager ambient 트랜잭션 관리자
 * @param clock "현재" 결정용 Clock
 * @param config 엔진 설정
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public record LifecycleContext(
    RepositoryRegistry registry,
    TransactionManager transactionManager,
    Clock clock,
    LifecycleConfig config
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null인 경우
     */
    public LifecycleContext {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (transactionManager == null) {
            throw new IllegalArgumentException("transactionManager cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
    }

    /**
     * 시스템 Clock과 기본 설정으로 생성.
     *
     * @param registry 저장소 레지스트리
     * @param transactionManager 트랜잭션 관리자
     * @return LifecycleContext 인스턴스
     */
    public static LifecycleContext of(RepositoryRegistry registry, TransactionManager transactionManager) {
        return new LifecycleContext(registry, transactionManager, Clock.systemDefaultZone(), new LifecycleConfig());
    }

    public LifecycleContext withClock(Clock clock) {
        return new LifecycleContext(registry, transactionManager, clock, config);
    }

    public LifecycleContext withConfig(LifecycleConfig config) {
        return new LifecycleContext(registry, transactionManager, clock, config);
    }

    /**
     * 이 컨텍스트의 Clock을 쓰는 날짜 도우미.
     *
     * @return EffectiveDates 인스턴스
     */
    public EffectiveDates dates() {
        return new EffectiveDates(clock);
    }

    /**
     * 엔티티 유형에 맞는 저장소 조회.
     *
     * @param entity 대상 엔티티
     * @return 저장소
     */
    public RosterRepository repositoryFor(RosterEntity entity) {
        return registry.forType(entity.type());
    }

    public MembershipRepository membership() {
        return registry.membership();
    }
}
