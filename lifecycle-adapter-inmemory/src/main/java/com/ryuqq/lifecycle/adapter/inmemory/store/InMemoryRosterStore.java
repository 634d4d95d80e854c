package com.ryuqq.lifecycle.adapter.inmemory.store;

import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.model.EntityKey;
import com.ryuqq.lifecycle.core.model.EntityType;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 로스터 상태 저장소 (테스트 및 레퍼런스용).
 *
 * <p>엔티티 이름, 상태 기간, 소속 관계를 메모리에 보관합니다. 상태 조회는 주입된
 * {@link Clock} 기준 "현재"로 판단하므로 고정 Clock으로 결정적인 테스트가 가능합니다.</p>
 *
 * <p><strong>자료 구조:</strong></p>
 * <ul>
 *   <li><strong>entities:</strong> EntityKey → 뷰 객체 (등록 순서)</li>
 *   <li><strong>names:</strong> EntityKey → 이름</li>
 *   <li><strong>periods:</strong> 상태 기간 목록 (추가 순서)</li>
 *   <li><strong>edges:</strong> 소속 관계 목록 (가입 순서)</li>
 * </ul>
 *
 * <p><strong>제약:</strong></p>
 * <ul>
 *   <li>모든 메서드는 인스턴스 단위로 synchronized</li>
 *   <li>트랜잭션은 {@link #snapshot()}/{@link #restore(Snapshot)}로 흉내냄</li>
 *   <li>프로세스 재시작 시 데이터 소실</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class InMemoryRosterStore {

    private final Clock clock;
    private Map<EntityKey, RosterEntity> entities = new LinkedHashMap<>();
    private Map<EntityKey, String> names = new LinkedHashMap<>();
    private List<StatusPeriod> periods = new ArrayList<>();
    private List<MembershipEdge> edges = new ArrayList<>();
    private Map<EntityType, Long> sequences = new EnumMap<>(EntityType.class);

    public InMemoryRosterStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    public Clock clock() {
        return clock;
    }

    // ===== 엔티티 =====

    /**
     * 새 엔티티 등록.
     *
     * @param type 엔티티 유형
     * @param name 이름
     * @param factory 키로 뷰 객체 생성
     * @param <T> 뷰 타입
     * @return 등록된 뷰
     */
    public synchronized <T extends RosterEntity> T register(EntityType type, String name, Function<EntityKey, T> factory) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        long id = sequences.merge(type, 1L, Long::sum);
        EntityKey key = EntityKey.of(type, id);
        T entity = factory.apply(key);
        entities.put(key, entity);
        names.put(key, name);
        return entity;
    }

    public synchronized RosterEntity entity(EntityKey key) {
        RosterEntity entity = entities.get(key);
        if (entity == null) {
            throw new IllegalArgumentException("Unknown entity: " + key);
        }
        return entity;
    }

    public synchronized boolean exists(EntityKey key) {
        return entities.containsKey(key);
    }

    public synchronized String name(EntityKey key) {
        return names.get(key);
    }

    public synchronized void rename(EntityKey key, String name) {
        if (!names.containsKey(key)) {
            throw new IllegalArgumentException("Unknown entity: " + key);
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        names.put(key, name);
    }

    // ===== 상태 기간 =====

    public synchronized void openPeriod(EntityKey key, StatusKind kind, LocalDateTime start, String notes) {
        periods.add(new StatusPeriod(key, kind, start, null, notes));
    }

    /**
     * 열린 기간 종료.
     *
     * @return 종료한 기간 수
     */
    public synchronized int closeOpenPeriods(EntityKey key, StatusKind kind, LocalDateTime end) {
        int closed = 0;
        for (int i = 0; i < periods.size(); i++) {
            StatusPeriod period = periods.get(i);
            if (period.key().equals(key) && period.kind() == kind && period.isOpen()) {
                periods.set(i, period.closedAt(end));
                closed++;
            }
        }
        return closed;
    }

    public synchronized boolean isActive(EntityKey key, StatusKind kind) {
        LocalDateTime now = now();
        return periods.stream()
            .anyMatch(p -> p.key().equals(key) && p.kind() == kind && p.isActiveAt(now));
    }

    public synchronized boolean hasFuture(EntityKey key, StatusKind kind) {
        LocalDateTime now = now();
        return periods.stream()
            .anyMatch(p -> p.key().equals(key) && p.kind() == kind && p.start().isAfter(now));
    }

    public synchronized boolean hasEnded(EntityKey key, StatusKind kind) {
        LocalDateTime now = now();
        return periods.stream()
            .anyMatch(p -> p.key().equals(key) && p.kind() == kind && p.end() != null && !p.end().isAfter(now));
    }

    public synchronized List<StatusPeriod> periods(EntityKey key) {
        return periods.stream().filter(p -> p.key().equals(key)).toList();
    }

    // ===== 소속 관계 =====

    public synchronized void join(EntityKey owner, EntityKey member, LocalDateTime date) {
        edges.add(new MembershipEdge(owner, member, date, null));
    }

    /**
     * 현재 소속 종료.
     *
     * @return 종료했으면 true, 현재 소속이 아니면 false
     */
    public synchronized boolean leave(EntityKey owner, EntityKey member, LocalDateTime date) {
        for (int i = 0; i < edges.size(); i++) {
            MembershipEdge edge = edges.get(i);
            if (edge.owner().equals(owner) && edge.member().equals(member) && edge.isCurrent()) {
                edges.set(i, edge.leftAt(date));
                return true;
            }
        }
        return false;
    }

    public synchronized boolean isCurrentMember(EntityKey owner, EntityKey member) {
        return edges.stream()
            .anyMatch(e -> e.owner().equals(owner) && e.member().equals(member) && e.isCurrent());
    }

    /**
     * owner의 현재 멤버 중 지정 유형 (가입 순서).
     */
    public synchronized List<RosterEntity> currentMembers(EntityKey owner, EntityType memberType) {
        return edges.stream()
            .filter(e -> e.isCurrent() && e.owner().equals(owner) && e.member().type() == memberType)
            .map(e -> entities.get(e.member()))
            .toList();
    }

    /**
     * member가 현재 속한 owner 중 지정 유형 (가입 순서).
     */
    public synchronized List<RosterEntity> currentOwners(EntityKey member, EntityType ownerType) {
        return edges.stream()
            .filter(e -> e.isCurrent() && e.member().equals(member) && e.owner().type() == ownerType)
            .map(e -> entities.get(e.owner()))
            .toList();
    }

    public synchronized List<MembershipEdge> edges() {
        return List.copyOf(edges);
    }

    // ===== 스냅샷 =====

    public synchronized Snapshot snapshot() {
        return new Snapshot(
            new LinkedHashMap<>(entities),
            new LinkedHashMap<>(names),
            new ArrayList<>(periods),
            new ArrayList<>(edges),
            new EnumMap<>(sequences)
        );
    }

    public synchronized void restore(Snapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        this.entities = new LinkedHashMap<>(snapshot.entities());
        this.names = new LinkedHashMap<>(snapshot.names());
        this.periods = new ArrayList<>(snapshot.periods());
        this.edges = new ArrayList<>(snapshot.edges());
        this.sequences = new EnumMap<>(EntityType.class);
        this.sequences.putAll(snapshot.sequences());
    }

    /**
     * 저장소 상태의 복사본. 레코드 요소는 불변이므로 얕은 복사로 충분합니다.
     */
    public record Snapshot(
        Map<EntityKey, RosterEntity> entities,
        Map<EntityKey, String> names,
        List<StatusPeriod> periods,
        List<MembershipEdge> edges,
        Map<EntityType, Long> sequences
    ) {
    }
}
