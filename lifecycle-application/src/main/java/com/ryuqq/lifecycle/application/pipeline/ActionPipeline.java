package com.ryuqq.lifecycle.application.pipeline;

import com.ryuqq.lifecycle.application.context.LifecycleContext;
import com.ryuqq.lifecycle.core.capability.MemberGroup;
import com.ryuqq.lifecycle.core.capability.MemberKind;
import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.exception.CompensationException;
import com.ryuqq.lifecycle.core.model.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 복합 액션 파이프라인.
 *
 * <p>여러 작업(그룹 병합/분할, 배치 전이, 필터 후 배치, 사용자 작업)을 순서대로 쌓고
 * 하나의 트랜잭션에서 실행합니다.</p>
 *
 * <p><strong>오류 모드:</strong></p>
 * <ul>
 *   <li>기본 (abort): 실패 시 앞서 성공한 작업을 역순으로 보상한 뒤 원래 예외를 다시 던짐</li>
 *   <li>{@link #continueOnError()}: 실패를 기록하고 다음 작업을 계속 실행</li>
 * </ul>
 *
 * <p><strong>보상:</strong> 내장 작업은 {@link CompensationRecord}만 기록하고 실행하지 않습니다.
 * 보상 콜백이 있는 사용자 작업은 콜백을 호출합니다. 보상 실패는 {@link CompensationException}으로
 * 감싸 로그와 {@link #getCompensationFailures()}에 남기며 호출자에게 던지지 않습니다.</p>
 *
 * <p><strong>사용 예:</strong></p>
 * <pre>
 * PipelineResult result = ActionPipeline.create(context)
 *     .withDefaultDate(date)
 *     .employMembers(List.of(wrestler, manager), null)
 *     .stableMerger(primary, secondary, "New Name")
 *     .customAction(() -> notifier.send(), result -> notifier.cancel())
 *     .execute();
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class ActionPipeline {

    private static final Logger log = LoggerFactory.getLogger(ActionPipeline.class);

    private final LifecycleContext context;
    private final List<PipelineOperation> operations = new ArrayList<>();
    private final Map<Integer, Object> results = new LinkedHashMap<>();
    private final Map<Integer, RuntimeException> errors = new LinkedHashMap<>();
    private final List<CompensationRecord> compensations = new ArrayList<>();
    private final List<CompensationException> compensationFailures = new ArrayList<>();
    private LocalDateTime defaultDate;
    private boolean continueOnError;

    private ActionPipeline(LifecycleContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        this.context = context;
    }

    public static ActionPipeline create(LifecycleContext context) {
        return new ActionPipeline(context);
    }

    /**
     * 자체 날짜가 없는 작업에 적용할 기본 유효일.
     *
     * <p>실행 시점에 적용되므로 작업 추가 순서와 무관합니다.</p>
     *
     * @param date 기본 유효일
     * @return 이 파이프라인
     */
    public ActionPipeline withDefaultDate(LocalDateTime date) {
        this.defaultDate = date;
        return this;
    }

    public ActionPipeline continueOnError() {
        return continueOnError(true);
    }

    public ActionPipeline continueOnError(boolean continueOnError) {
        this.continueOnError = continueOnError;
        return this;
    }

    // ===== 작업 =====

    public ActionPipeline stableMerger(MemberGroup primary, MemberGroup secondary, String newName) {
        return add(new PipelineOperations.GroupMerge(context, primary, secondary, newName));
    }

    /**
     * 그룹 분할 후 지정 멤버를 새 그룹으로 이동.
     *
     * @param original 원래 그룹
     * @param newName 새 그룹 이름
     * @param members 종류별 이동 멤버
     * @return 이 파이프라인
     */
    public ActionPipeline stableSplit(MemberGroup original, String newName,
                                      Map<MemberKind, ? extends Collection<? extends RosterEntity>> members) {
        return add(new PipelineOperations.GroupSplit(context, original, newName, members));
    }

    public ActionPipeline employMembers(Collection<? extends RosterEntity> entities, LocalDateTime date) {
        return add(new PipelineOperations.TransitionBatch(context, Transition.EMPLOY, entities, date));
    }

    public ActionPipeline releaseMembers(Collection<? extends RosterEntity> entities, LocalDateTime date) {
        return add(new PipelineOperations.TransitionBatch(context, Transition.RELEASE, entities, date));
    }

    public ActionPipeline retireMembers(Collection<? extends RosterEntity> entities, LocalDateTime date) {
        return add(new PipelineOperations.TransitionBatch(context, Transition.RETIRE, entities, date));
    }

    public ActionPipeline suspendMembers(Collection<? extends RosterEntity> entities, LocalDateTime date) {
        return add(new PipelineOperations.TransitionBatch(context, Transition.SUSPEND, entities, date));
    }

    public ActionPipeline reinstateMembers(Collection<? extends RosterEntity> entities, LocalDateTime date) {
        return add(new PipelineOperations.TransitionBatch(context, Transition.REINSTATE, entities, date));
    }

    /**
     * 조건으로 필터한 뒤 배치 실행. 결과는 {@link com.ryuqq.lifecycle.application.collection.StatusStatistics}.
     *
     * @param collection 대상 컬렉션
     * @param criteria 컬렉션 매니저 조건 맵
     * @param operation 전이 이름 ("employ", "suspend" 등)
     * @param date 유효일 (nullable)
     * @return 이 파이프라인
     */
    public ActionPipeline filterAndBatch(Collection<? extends RosterEntity> collection, Map<String, ?> criteria,
                                         String operation, LocalDateTime date) {
        return add(new PipelineOperations.FilterAndBatch(context, collection, criteria, operation, date));
    }

    public ActionPipeline stableOrchestration(Function<LifecycleContext, ?> callback) {
        return add(new PipelineOperations.GroupOrchestration(context, callback));
    }

    public ActionPipeline customAction(Supplier<?> action) {
        return customAction(action, null);
    }

    /**
     * 사용자 작업 추가.
     *
     * @param action 작업
     * @param rollback 보상 콜백 (작업 결과를 받음, nullable)
     * @return 이 파이프라인
     */
    public ActionPipeline customAction(Supplier<?> action, Consumer<Object> rollback) {
        return add(new PipelineOperations.Custom(action, rollback));
    }

    public ActionPipeline operation(PipelineOperation operation) {
        return add(operation);
    }

    // ===== 실행 =====

    /**
     * 작업을 등록 순서대로 하나의 트랜잭션에서 실행.
     *
     * @return 실행 결과
     * @throws RuntimeException abort 모드에서 작업이 실패한 경우 그 예외
     */
    public PipelineResult execute() {
        return context.transactionManager().runInTransaction(() -> {
            results.clear();
            errors.clear();
            compensations.clear();
            compensationFailures.clear();

            for (int index = 0; index < operations.size(); index++) {
                PipelineOperation operation = operations.get(index);
                try {
                    results.put(index, operation.execute(defaultDate));
                    log.debug("Pipeline operation #{} ({}) completed", index, operation.type());
                } catch (RuntimeException e) {
                    errors.put(index, e);
                    if (!continueOnError) {
                        log.warn("Pipeline operation #{} ({}) failed, compensating: {}", index, operation.type(), e.getMessage());
                        compensateBefore(index);
                        throw e;
                    }
                    log.warn("Pipeline operation #{} ({}) failed, continuing: {}", index, operation.type(), e.getMessage());
                }
            }

            log.info("Action pipeline completed: {} operation(s), {} error(s)", operations.size(), errors.size());
            return PipelineResult.of(results, errors);
        });
    }

    private void compensateBefore(int failedIndex) {
        if (!context.config().compensationEnabled()) {
            log.debug("Compensation disabled, skipping {} operation(s)", failedIndex);
            return;
        }
        for (int index = failedIndex - 1; index >= 0; index--) {
            if (!results.containsKey(index)) {
                continue;
            }
            try {
                operations.get(index).compensate(index, results.get(index), defaultDate)
                    .ifPresent(compensations::add);
            } catch (RuntimeException e) {
                CompensationException failure = new CompensationException(index, e);
                compensationFailures.add(failure);
                log.error("Pipeline compensation failed for operation #{}", index, failure);
            }
        }
    }

    private ActionPipeline add(PipelineOperation operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        operations.add(operation);
        return this;
    }

    public Map<Integer, Object> getResults() {
        return Collections.unmodifiableMap(results);
    }

    public Map<Integer, RuntimeException> getErrors() {
        return Collections.unmodifiableMap(errors);
    }

    public boolean wasSuccessful() {
        return errors.isEmpty();
    }

    /**
     * 마지막 abort에서 기록된 보상 설명 (역순).
     *
     * @return 보상 기록
     */
    public List<CompensationRecord> getCompensations() {
        return Collections.unmodifiableList(compensations);
    }

    public List<CompensationException> getCompensationFailures() {
        return Collections.unmodifiableList(compensationFailures);
    }
}
