package com.ryuqq.lifecycle.application.transition;

import com.ryuqq.lifecycle.application.context.LifecycleContext;
import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.exception.CascadeDepthExceededException;
import com.ryuqq.lifecycle.core.model.EntityKey;
import com.ryuqq.lifecycle.core.model.Transition;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * 하나의 최상위 전이 호출에 한정된 cascade 체인 상태.
 *
 * <p>최상위 {@link StatusTransitionPipeline#execute()}가 생성하고, cascade가 만드는
 * 모든 중첩 파이프라인이 같은 인스턴스를 공유합니다. 호출이 끝나면 버려지므로
 * 방문 집합이 다음 호출로 이어지지 않습니다.</p>
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>활성 경로에 이미 있는 (엔티티, 전이) 쌍은 다시 실행하지 않음</li>
 *   <li>체인 깊이가 {@code maxCascadeDepth}를 넘으면 {@link CascadeDepthExceededException}</li>
 *   <li>scope별 방문 집합 (예: allMembers의 멤버 방문 기록)</li>
 * </ul>
 *
 * <p>스레드 간 공유하지 않습니다 (호출 스택에 한정).</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class CascadeContext {

    private final LifecycleContext context;
    private final int maxDepth;
    private final Deque<PathEntry> path = new ArrayDeque<>();
    private final Set<PathEntry> active = new HashSet<>();
    private final Map<String, Set<EntityKey>> visited = new HashMap<>();
    private int executedCount;

    private CascadeContext(LifecycleContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        this.context = context;
        this.maxDepth = context.config().maxCascadeDepth();
    }

    /**
     * 최상위 호출용 새 컨텍스트.
     *
     * @param context 엔진 컨텍스트
     * @return 빈 CascadeContext
     */
    public static CascadeContext root(LifecycleContext context) {
        return new CascadeContext(context);
    }

    /**
     * 이 체인에 참여하는 중첩 파이프라인 생성.
     *
     * @param entity 대상 엔티티
     * @param transition 전이
     * @param date 유효일
     * @return 이 컨텍스트를 공유하는 파이프라인
     */
    public StatusTransitionPipeline spawn(RosterEntity entity, Transition transition, LocalDateTime date) {
        return StatusTransitionPipeline.create(context, entity, transition, date).withinCascade(this);
    }

    /**
     * scope 안에서 키를 방문 처리.
     *
     * @param scope 방문 집합 이름
     * @param key 엔티티 키
     * @return 처음 방문이면 true, 이미 방문했으면 false
     */
    public boolean markVisited(String scope, EntityKey key) {
        return visited.computeIfAbsent(scope, s -> new HashSet<>()).add(key);
    }

    public Set<EntityKey> visited(String scope) {
        return Collections.unmodifiableSet(visited.getOrDefault(scope, Set.of()));
    }

    /**
     * 현재 체인 깊이 (최상위 파이프라인 실행 중이면 1).
     *
     * @return 깊이
     */
    public int depth() {
        return path.size();
    }

    /**
     * 이 체인에서 실제로 변경까지 진행된 파이프라인 수.
     *
     * @return 실행 수
     */
    public int executedCount() {
        return executedCount;
    }

    public LifecycleContext lifecycleContext() {
        return context;
    }

    boolean enter(EntityKey key, Transition transition) {
        PathEntry entry = new PathEntry(key, transition);
        if (active.contains(entry)) {
            return false;
        }
        int nextDepth = path.size() + 1;
        if (nextDepth > maxDepth) {
            throw new CascadeDepthExceededException(key, transition, nextDepth, maxDepth);
        }
        path.push(entry);
        active.add(entry);
        return true;
    }

    void exit() {
        PathEntry entry = path.pop();
        active.remove(entry);
    }

    void recordExecuted() {
        executedCount++;
    }

    private record PathEntry(EntityKey key, Transition transition) {
    }
}
