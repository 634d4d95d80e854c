package com.ryuqq.lifecycle.adapter.inmemory.store;

import com.ryuqq.lifecycle.adapter.inmemory.roster.Manager;
import com.ryuqq.lifecycle.adapter.inmemory.roster.Stable;
import com.ryuqq.lifecycle.adapter.inmemory.roster.TagTeam;
import com.ryuqq.lifecycle.adapter.inmemory.roster.Wrestler;
import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.model.EntityKey;
import com.ryuqq.lifecycle.core.model.EntityType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryRosterStore 유닛 테스트.
 *
 * <p>기간은 [start, end) 반열린 구간이며, 판정 기준 시각은 Clock의 현재 시각입니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
class InMemoryRosterStoreTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 1, 12, 0);

    private InMemoryRosterStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryRosterStore(Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC));
    }

    // ===== 1. 엔티티 등록 =====

    @Test
    void register_유형별_순번_부여() {
        // when
        Wrestler first = registerWrestler("Ric");
        Wrestler second = registerWrestler("Arn");
        EntityKey manager = store.register(EntityType.MANAGER, "JJ", key -> new Manager(store, key)).key();

        // then
        assertThat(first.key()).isEqualTo(EntityKey.of(EntityType.WRESTLER, 1));
        assertThat(second.key()).isEqualTo(EntityKey.of(EntityType.WRESTLER, 2));
        assertThat(manager.id()).isEqualTo(1);
        assertThat(store.name(second.key())).isEqualTo("Arn");
        assertThat(store.entity(first.key())).isSameAs(first);
    }

    @Test
    void register_빈_이름_거부() {
        assertThatThrownBy(() -> registerWrestler(" "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("name cannot be null or blank");
    }

    @Test
    void 알_수_없는_엔티티_조회_거부() {
        assertThatThrownBy(() -> store.entity(EntityKey.of(EntityType.STABLE, 99)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("STABLE:99");
    }

    @Test
    void rename_이름_변경() {
        // given
        Wrestler wrestler = registerWrestler("Ric");

        // when
        store.rename(wrestler.key(), "Nature Boy");

        // then
        assertThat(wrestler.name()).isEqualTo("Nature Boy");
    }

    // ===== 2. 상태 기간 =====

    @Test
    void 열린_과거_기간은_활성() {
        // given
        EntityKey key = registerWrestler("Ric").key();

        // when
        store.openPeriod(key, StatusKind.EMPLOYMENT, NOW.minusDays(1), null);

        // then
        assertThat(store.isActive(key, StatusKind.EMPLOYMENT)).isTrue();
        assertThat(store.isActive(key, StatusKind.SUSPENSION)).isFalse();
        assertThat(store.hasEnded(key, StatusKind.EMPLOYMENT)).isFalse();
    }

    @Test
    void 미래_기간은_비활성_예정() {
        // given
        EntityKey key = registerWrestler("Ric").key();

        // when
        store.openPeriod(key, StatusKind.EMPLOYMENT, NOW.plusDays(3), null);

        // then
        assertThat(store.isActive(key, StatusKind.EMPLOYMENT)).isFalse();
        assertThat(store.hasFuture(key, StatusKind.EMPLOYMENT)).isTrue();
    }

    @Test
    void 현재_시각에_닫힌_기간은_종료() {
        // given
        EntityKey key = registerWrestler("Ric").key();
        store.openPeriod(key, StatusKind.SUSPENSION, NOW.minusDays(1), "late");

        // when
        int closed = store.closeOpenPeriods(key, StatusKind.SUSPENSION, NOW);

        // then
        assertThat(closed).isEqualTo(1);
        assertThat(store.isActive(key, StatusKind.SUSPENSION)).isFalse();
        assertThat(store.hasEnded(key, StatusKind.SUSPENSION)).isTrue();
        assertThat(store.periods(key)).singleElement()
            .satisfies(period -> {
                assertThat(period.end()).isEqualTo(NOW);
                assertThat(period.notes()).isEqualTo("late");
            });
    }

    @Test
    void closeOpenPeriods_해당_종류의_열린_기간만() {
        // given
        EntityKey key = registerWrestler("Ric").key();
        store.openPeriod(key, StatusKind.EMPLOYMENT, NOW.minusDays(10), null);
        store.closeOpenPeriods(key, StatusKind.EMPLOYMENT, NOW.minusDays(5));
        store.openPeriod(key, StatusKind.EMPLOYMENT, NOW.minusDays(2), null);
        store.openPeriod(key, StatusKind.INJURY, NOW.minusDays(1), null);

        // when
        int closed = store.closeOpenPeriods(key, StatusKind.EMPLOYMENT, NOW);

        // then
        assertThat(closed).isEqualTo(1);
        assertThat(store.isActive(key, StatusKind.INJURY)).isTrue();
        assertThat(store.periods(key)).hasSize(3);
    }

    // ===== 3. 소속 관계 =====

    @Test
    void join_leave_현재_멤버와_이력() {
        // given
        EntityKey stable = store.register(EntityType.STABLE, "Horsemen", key -> new Stable(store, key)).key();
        Wrestler ric = registerWrestler("Ric");
        Wrestler arn = registerWrestler("Arn");
        store.join(stable, ric.key(), NOW.minusDays(30));
        store.join(stable, arn.key(), NOW.minusDays(20));

        // when
        boolean left = store.leave(stable, ric.key(), NOW);

        // then
        assertThat(left).isTrue();
        assertThat(store.currentMembers(stable, EntityType.WRESTLER)).containsExactly(arn);
        assertThat(store.isCurrentMember(stable, ric.key())).isFalse();
        assertThat(store.edges()).hasSize(2);
        assertThat(store.edges().get(0).left()).isEqualTo(NOW);
    }

    @Test
    void leave_멤버가_아니면_false() {
        // given
        EntityKey stable = EntityKey.of(EntityType.STABLE, 1);
        Wrestler ric = registerWrestler("Ric");

        // when & then
        assertThat(store.leave(stable, ric.key(), NOW)).isFalse();
    }

    @Test
    void currentOwners_소유자_유형으로_필터() {
        // given
        Wrestler ric = registerWrestler("Ric");
        EntityKey stable = store.register(EntityType.STABLE, "Horsemen", key -> new Stable(store, key)).key();
        EntityKey team = store.register(EntityType.TAG_TEAM, "Team", key -> new TagTeam(store, key)).key();
        store.join(stable, ric.key(), NOW);
        store.join(team, ric.key(), NOW);

        // when & then
        assertThat(store.currentOwners(ric.key(), EntityType.TAG_TEAM))
            .extracting(RosterEntity::key)
            .containsExactly(team);
    }

    // ===== 4. 스냅샷 =====

    @Test
    void restore_스냅샷_이후_변경_취소() {
        // given
        Wrestler ric = registerWrestler("Ric");
        InMemoryRosterStore.Snapshot snapshot = store.snapshot();
        store.openPeriod(ric.key(), StatusKind.EMPLOYMENT, NOW, null);
        store.rename(ric.key(), "Changed");
        Wrestler arn = registerWrestler("Arn");

        // when
        store.restore(snapshot);

        // then
        assertThat(ric.isEmployed()).isFalse();
        assertThat(ric.name()).isEqualTo("Ric");
        assertThat(store.exists(arn.key())).isFalse();
        assertThat(registerWrestler("Sting").key().id()).isEqualTo(2);
    }

    private Wrestler registerWrestler(String name) {
        return store.register(EntityType.WRESTLER, name, key -> new Wrestler(store, key));
    }
}
