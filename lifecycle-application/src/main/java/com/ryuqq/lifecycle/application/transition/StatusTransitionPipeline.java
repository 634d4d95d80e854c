package com.ryuqq.lifecycle.application.transition;

import com.ryuqq.lifecycle.application.context.LifecycleContext;
import com.ryuqq.lifecycle.core.capability.Capabilities;
import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.model.Transition;
import com.ryuqq.lifecycle.core.spi.RosterRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 단일 엔티티 상태 전이 파이프라인 (상태 머신 코어).
 *
 * <p>하나의 파이프라인은 정확히 하나의 엔티티에 하나의 전이를 적용합니다.
 * cascade는 독립된 추가 파이프라인을 생성합니다.</p>
 *
 * <p><strong>실행 흐름 (하나의 트랜잭션 안):</strong></p>
 * <pre>
 * 1. 기본 검증 (capability 확인 + ensureCanBe*) → 사용자 검증 (등록 순서)
 * 2. 선행 상태 종료: employ 시 은퇴 중이면 endRetirement
 * 3. 핵심 변경: 유형별 저장소의 create* 호출 (entity, date, notes)
 * 4. cascade 전략 실행 (등록 순서)
 * </pre>
 *
 * <p><strong>오류 처리:</strong></p>
 * <ul>
 *   <li>저장소/변경 메서드 누락: ConfigurationException (재시도 금지)</li>
 *   <li>검증 실패: ValidationException, 트랜잭션 롤백</li>
 *   <li>cascade 실패: 그대로 전파되어 파이프라인 전체 롤백</li>
 * </ul>
 *
 * <p><strong>사용 예:</strong></p>
 * <pre>
 * StatusTransitionPipeline.employ(context, tagTeam, date)
 *     .withCascade(EmploymentCascadeStrategy.wrestlers())
 *     .withCascade(EmploymentCascadeStrategy.managers())
 *     .withNotes("re-signed")
 *     .execute();
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class StatusTransitionPipeline {

    private static final Logger log = LoggerFactory.getLogger(StatusTransitionPipeline.class);

    private final LifecycleContext context;
    private final RosterEntity entity;
    private final Transition transition;
    private final LocalDateTime date;
    private final List<ValidationStrategy> validations = new ArrayList<>();
    private final List<CascadeStrategy> cascades = new ArrayList<>();
    private String notes;
    private CascadeContext cascadeContext;

    private StatusTransitionPipeline(LifecycleContext context, RosterEntity entity,
                                     Transition transition, LocalDateTime date) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (entity == null) {
            throw new IllegalArgumentException("entity cannot be null");
        }
        if (transition == null) {
            throw new IllegalArgumentException("transition cannot be null");
        }
        this.context = context;
        this.entity = entity;
        this.transition = transition;
        this.date = context.dates().resolve(date);
    }

    /**
     * 파이프라인 생성.
     *
     * @param context 엔진 컨텍스트
     * @param entity 대상 엔티티
     * @param transition 전이
     * @param date 유효일 (null이면 now)
     * @return 새 파이프라인
     */
    public static StatusTransitionPipeline create(LifecycleContext context, RosterEntity entity,
                                                  Transition transition, LocalDateTime date) {
        return new StatusTransitionPipeline(context, entity, transition, date);
    }

    /**
     * 전이 이름으로 파이프라인 생성.
     *
     * @param transitionName "employ", "suspend" 등
     * @throws com.ryuqq.lifecycle.core.exception.ConfigurationException 알 수 없는 전이 이름인 경우
     */
    public static StatusTransitionPipeline create(LifecycleContext context, RosterEntity entity,
                                                  String transitionName, LocalDateTime date) {
        return create(context, entity, Transition.fromName(transitionName), date);
    }

    public static StatusTransitionPipeline employ(LifecycleContext context, RosterEntity entity, LocalDateTime date) {
        return create(context, entity, Transition.EMPLOY, date);
    }

    public static StatusTransitionPipeline release(LifecycleContext context, RosterEntity entity, LocalDateTime date) {
        return create(context, entity, Transition.RELEASE, date);
    }

    public static StatusTransitionPipeline suspend(LifecycleContext context, RosterEntity entity, LocalDateTime date) {
        return create(context, entity, Transition.SUSPEND, date);
    }

    public static StatusTransitionPipeline reinstate(LifecycleContext context, RosterEntity entity, LocalDateTime date) {
        return create(context, entity, Transition.REINSTATE, date);
    }

    public static StatusTransitionPipeline retire(LifecycleContext context, RosterEntity entity, LocalDateTime date) {
        return create(context, entity, Transition.RETIRE, date);
    }

    public static StatusTransitionPipeline injure(LifecycleContext context, RosterEntity entity, LocalDateTime date) {
        return create(context, entity, Transition.INJURE, date);
    }

    public StatusTransitionPipeline withValidation(ValidationStrategy validation) {
        if (validation == null) {
            throw new IllegalArgumentException("validation cannot be null");
        }
        validations.add(validation);
        return this;
    }

    public StatusTransitionPipeline withCascade(CascadeStrategy cascade) {
        if (cascade == null) {
            throw new IllegalArgumentException("cascade cannot be null");
        }
        cascades.add(cascade);
        return this;
    }

    public StatusTransitionPipeline withNotes(String notes) {
        this.notes = notes;
        return this;
    }

    /**
     * 기존 cascade 체인에 참여.
     *
     * @param cascadeContext 상위 파이프라인의 체인 컨텍스트
     * @return 이 파이프라인
     */
    StatusTransitionPipeline withinCascade(CascadeContext cascadeContext) {
        this.cascadeContext = cascadeContext;
        return this;
    }

    /**
     * 파이프라인 실행.
     *
     * <p>상위 트랜잭션이 있으면 참여하고, 없으면 새로 엽니다.</p>
     *
     * @throws com.ryuqq.lifecycle.core.exception.ValidationException 검증 실패 시
     * @throws com.ryuqq.lifecycle.core.exception.ConfigurationException 배선 오류 시
     */
    public void execute() {
        CascadeContext chain = cascadeContext != null ? cascadeContext : CascadeContext.root(context);
        context.transactionManager().runWithoutResult(() -> run(chain));
    }

    private void run(CascadeContext chain) {
        if (!chain.enter(entity.key(), transition)) {
            log.warn("Skipping re-entrant cascade: {} {} is already on the active path", transition, entity.key());
            return;
        }
        try {
            validate();
            RosterRepository repository = context.repositoryFor(entity);
            endIncompatibleState(repository);
            repository.apply(transition, entity, date, notes);
            chain.recordExecuted();
            log.debug("Applied {} to {} at {} (depth {})", transition, entity.key(), date, chain.depth());

            for (CascadeStrategy cascade : cascades) {
                cascade.cascade(entity, date, transition, chain);
            }

            if (chain.depth() == 1) {
                log.info("Transition {} completed for {}: {} pipeline(s) executed", transition, entity.key(), chain.executedCount());
            }
        } finally {
            chain.exit();
        }
    }

    private void validate() {
        Capabilities.ensureCanBe(entity, transition);
        for (ValidationStrategy validation : validations) {
            validation.validate(entity, transition);
        }
    }

    private void endIncompatibleState(RosterRepository repository) {
        if (transition == Transition.EMPLOY && Capabilities.isRetired(entity)) {
            log.debug("Ending retirement of {} before employment", entity.key());
            repository.endRetirement(entity, date);
        }
    }

    public RosterEntity entity() {
        return entity;
    }

    public Transition transition() {
        return transition;
    }

    public LocalDateTime date() {
        return date;
    }
}
