package com.ryuqq.lifecycle.application.collection;

import com.ryuqq.lifecycle.application.cascade.EmploymentCascadeStrategy;
import com.ryuqq.lifecycle.application.context.LifecycleContext;
import com.ryuqq.lifecycle.application.transition.StatusTransitionPipeline;
import com.ryuqq.lifecycle.core.capability.Capabilities;
import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.exception.ConfigurationException;
import com.ryuqq.lifecycle.core.exception.InvalidStatusFilterException;
import com.ryuqq.lifecycle.core.model.EntityType;
import com.ryuqq.lifecycle.core.model.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * 엔티티 컬렉션 필터 및 배치 전이 매니저.
 *
 * <p>필터 빌더는 순서 있는 predicate 목록에 조건을 추가하고, {@link #get()}은
 * 등록 순서대로 AND 적용합니다. 원본 컬렉션은 복사해 두므로 변경되지 않으며
 * {@link #get()}은 몇 번이든 다시 계산할 수 있습니다.</p>
 *
 * <p><strong>사용 예:</strong></p>
 * <pre>
 * MemberCollectionManager.from(context, stable.currentWrestlers())
 *     .filterByEmploymentStatus("employed")
 *     .filterBySuspensionStatus("active")
 *     .batchSuspend(date, "Team suspension");
 * </pre>
 *
 * <p><strong>오류 정책:</strong> 지원하지 않는 상태 리터럴은 {@link #get()} 시점이 아니라
 * 필터 등록 시점에 {@link com.ryuqq.lifecycle.core.exception.InvalidStatusFilterException}을 던집니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class MemberCollectionManager {

    private static final Logger log = LoggerFactory.getLogger(MemberCollectionManager.class);

    private final LifecycleContext context;
    private final List<RosterEntity> source;
    private final List<Predicate<RosterEntity>> filters = new ArrayList<>();

    private MemberCollectionManager(LifecycleContext context, Collection<? extends RosterEntity> source) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        this.context = context;
        this.source = List.copyOf(source);
    }

    public static MemberCollectionManager from(LifecycleContext context, Collection<? extends RosterEntity> source) {
        return new MemberCollectionManager(context, source);
    }

    // ===== 필터 =====

    public MemberCollectionManager filterByEmploymentStatus(String status) {
        return filterBy(EmploymentFilter.fromLiteral(status));
    }

    public MemberCollectionManager filterBySuspensionStatus(String status) {
        return filterBy(SuspensionFilter.fromLiteral(status));
    }

    public MemberCollectionManager filterByInjuryStatus(String status) {
        return filterBy(InjuryFilter.fromLiteral(status));
    }

    public MemberCollectionManager filterByRetirementStatus(String status) {
        return filterBy(RetirementFilter.fromLiteral(status));
    }

    /**
     * 상태 필터 추가 ({@code any}는 조건을 추가하지 않음).
     *
     * @param filter 상태 필터
     * @return 이 매니저
     */
    public MemberCollectionManager filterBy(StatusFilter filter) {
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
        filter.predicate().ifPresent(filters::add);
        return this;
    }

    /**
     * 가용성 필터: 고용 중 AND 정지 아님 AND 부상 아님 AND 은퇴 아님.
     *
     * <p>capability가 없는 하위 검사는 통과로 취급합니다. false면 조건을 추가하지 않습니다.</p>
     *
     * @param availableOnly true면 가용 엔티티만 남김
     * @return 이 매니저
     */
    public MemberCollectionManager filterByAvailability(boolean availableOnly) {
        if (availableOnly) {
            filters.add(Capabilities::isAvailable);
        }
        return this;
    }

    public MemberCollectionManager filterByType(EntityType... types) {
        List<EntityType> allowed = List.of(types);
        filters.add(entity -> allowed.contains(entity.type()));
        return this;
    }

    /**
     * 유형 이름 필터.
     *
     * <p>엔티티 유형 이름/라벨, 구현 클래스의 전체 이름, 단순 이름(대소문자 무시)과 비교합니다.</p>
     *
     * @param types 유형 이름 (예: "Wrestler", "tag_team", "com.example.Stable")
     * @return 이 매니저
     */
    public MemberCollectionManager filterByType(String... types) {
        List<String> names = Arrays.asList(types);
        filters.add(entity -> names.stream().anyMatch(name -> matchesType(entity, name)));
        return this;
    }

    public MemberCollectionManager filterBy(Predicate<RosterEntity> predicate) {
        if (predicate == null) {
            throw new IllegalArgumentException("predicate cannot be null");
        }
        filters.add(predicate);
        return this;
    }

    /**
     * 조건 맵으로 필터 추가.
     *
     * <p>키: employmentStatus, suspensionStatus, injuryStatus, retirementStatus,
     * availability, type ("filterBy" 접두사 형태도 허용).</p>
     *
     * @param criteria 조건 맵 (삽입 순서대로 적용)
     * @return 이 매니저
     * @throws ConfigurationException 알 수 없는 키인 경우
     */
    public MemberCollectionManager filterByCriteria(Map<String, ?> criteria) {
        if (criteria == null) {
            throw new IllegalArgumentException("criteria cannot be null");
        }
        criteria.forEach(this::applyCriterion);
        return this;
    }

    // ===== 조회 =====

    public List<RosterEntity> get() {
        List<RosterEntity> result = new ArrayList<>();
        for (RosterEntity entity : source) {
            if (matchesAll(entity)) {
                result.add(entity);
            }
        }
        return result;
    }

    public int count() {
        return get().size();
    }

    public boolean exists() {
        return count() > 0;
    }

    public Optional<RosterEntity> first() {
        return source.stream().filter(this::matchesAll).findFirst();
    }

    // ===== 배치 =====

    /**
     * 필터된 엔티티를 유형별 cascade와 함께 고용.
     *
     * @param date 유효일 (nullable)
     * @param notes 메모 (nullable)
     * @return 처리한 엔티티 수
     */
    public int batchEmploy(LocalDateTime date, String notes) {
        return runBatch(Transition.EMPLOY, get(), date, notes);
    }

    public int batchRelease(LocalDateTime date, String notes) {
        return runBatch(Transition.RELEASE, get(), date, notes);
    }

    public int batchSuspend(LocalDateTime date, String notes) {
        return runBatch(Transition.SUSPEND, get(), date, notes);
    }

    public int batchRetire(LocalDateTime date, String notes) {
        return runBatch(Transition.RETIRE, get(), date, notes);
    }

    public int batchReinstate(LocalDateTime date, String notes) {
        return runBatch(Transition.REINSTATE, get(), date, notes);
    }

    /**
     * 부상 처리 (부상 capability가 없는 엔티티는 건너뜀).
     *
     * @param date 유효일 (nullable)
     * @param notes 메모 (nullable)
     * @return 처리한 엔티티 수
     */
    public int batchInjure(LocalDateTime date, String notes) {
        List<RosterEntity> injurable = get().stream()
            .filter(entity -> Capabilities.supports(entity, Transition.INJURE))
            .toList();
        return runBatch(Transition.INJURE, injurable, date, notes);
    }

    /**
     * 전이 이름으로 배치 실행 ("employ", "suspend" 등).
     *
     * @param operation 전이 이름
     * @param date 유효일 (nullable)
     * @param notes 메모 (nullable)
     * @return 처리한 엔티티 수
     * @throws ConfigurationException 알 수 없는 작업 이름인 경우
     */
    public int batch(String operation, LocalDateTime date, String notes) {
        Transition transition;
        try {
            transition = Transition.fromName(operation);
        } catch (ConfigurationException e) {
            throw ConfigurationException.unknownOperation("batch" + operation);
        }
        return switch (transition) {
            case EMPLOY -> batchEmploy(date, notes);
            case RELEASE -> batchRelease(date, notes);
            case SUSPEND -> batchSuspend(date, notes);
            case RETIRE -> batchRetire(date, notes);
            case REINSTATE -> batchReinstate(date, notes);
            case INJURE -> batchInjure(date, notes);
        };
    }

    // ===== 통계 =====

    /**
     * 필터된 엔티티를 상태 버킷으로 분류 (부수효과 없음).
     *
     * @return 버킷 → 엔티티 목록
     */
    public Map<StatusBucket, List<RosterEntity>> groupByStatus() {
        List<RosterEntity> entities = get();
        Map<StatusBucket, List<RosterEntity>> grouped = new EnumMap<>(StatusBucket.class);
        for (StatusBucket bucket : StatusBucket.values()) {
            grouped.put(bucket, entities.stream().filter(bucket::contains).toList());
        }
        return grouped;
    }

    public StatusStatistics getStatistics() {
        Map<StatusBucket, List<RosterEntity>> grouped = groupByStatus();
        return new StatusStatistics(
            count(),
            grouped.get(StatusBucket.EMPLOYED).size(),
            grouped.get(StatusBucket.UNEMPLOYED).size(),
            grouped.get(StatusBucket.SUSPENDED).size(),
            grouped.get(StatusBucket.INJURED).size(),
            grouped.get(StatusBucket.RETIRED).size(),
            grouped.get(StatusBucket.AVAILABLE).size()
        );
    }

    private int runBatch(Transition transition, List<RosterEntity> targets, LocalDateTime date, String notes) {
        context.transactionManager().runWithoutResult(() -> {
            for (RosterEntity entity : targets) {
                StatusTransitionPipeline pipeline = StatusTransitionPipeline.create(context, entity, transition, date)
                    .withNotes(notes);
                if (transition == Transition.EMPLOY) {
                    EmploymentCascadeStrategy.forEntity(entity).forEach(pipeline::withCascade);
                }
                pipeline.execute();
            }
        });
        log.debug("Batch {} processed {} entities", transition, targets.size());
        return targets.size();
    }

    private boolean matchesAll(RosterEntity entity) {
        for (Predicate<RosterEntity> filter : filters) {
            if (!filter.test(entity)) {
                return false;
            }
        }
        return true;
    }

    private void applyCriterion(String key, Object value) {
        if (key == null) {
            throw ConfigurationException.unknownCriterion(null);
        }
        String normalized = key.startsWith("filterBy") && key.length() > 8
            ? Character.toLowerCase(key.charAt(8)) + key.substring(9)
            : key;
        switch (normalized) {
            case "employmentStatus" -> filterByEmploymentStatus(String.valueOf(value));
            case "suspensionStatus" -> filterBySuspensionStatus(String.valueOf(value));
            case "injuryStatus" -> filterByInjuryStatus(String.valueOf(value));
            case "retirementStatus" -> filterByRetirementStatus(String.valueOf(value));
            case "availability" -> filterByAvailability(availability(value));
            case "type" -> filterByType(typeNames(value));
            default -> throw ConfigurationException.unknownCriterion(key);
        }
    }

    private static boolean availability(Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        String literal = String.valueOf(value);
        if ("true".equalsIgnoreCase(literal) || "false".equalsIgnoreCase(literal)) {
            return Boolean.parseBoolean(literal);
        }
        throw new InvalidStatusFilterException("availability", literal, List.of("true", "false"));
    }

    private static String[] typeNames(Object value) {
        if (value instanceof Collection<?> values) {
            return values.stream().map(String::valueOf).toArray(String[]::new);
        }
        return new String[] {String.valueOf(value)};
    }

    private static boolean matchesType(RosterEntity entity, String name) {
        Class<?> type = entity.getClass();
        if (type.getName().equals(name) || type.getSimpleName().equals(name)) {
            return true;
        }
        if (type.getSimpleName().toLowerCase(Locale.ROOT).equals(name.toLowerCase(Locale.ROOT))) {
            return true;
        }
        try {
            return EntityType.fromName(name) == entity.type();
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
