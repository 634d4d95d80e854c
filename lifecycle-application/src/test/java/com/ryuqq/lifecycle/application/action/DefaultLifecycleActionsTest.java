package com.ryuqq.lifecycle.application.action;

import com.ryuqq.lifecycle.application.cascade.EmploymentCascadeStrategy;
import com.ryuqq.lifecycle.application.support.FakeManager;
import com.ryuqq.lifecycle.application.support.FakeStable;
import com.ryuqq.lifecycle.application.support.FakeTagTeam;
import com.ryuqq.lifecycle.application.support.FakeWrestler;
import com.ryuqq.lifecycle.application.support.TestRoster;
import com.ryuqq.lifecycle.core.capability.MemberKind;
import com.ryuqq.lifecycle.core.exception.TransitionNotAllowedException;
import com.ryuqq.lifecycle.core.exception.UnsupportedCapabilityException;
import com.ryuqq.lifecycle.core.model.Transition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DefaultLifecycleActions 테스트.
 *
 * <p>엔티티 유형별 기본 cascade 구성을 검증합니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
class DefaultLifecycleActionsTest {

    private TestRoster roster;
    private LifecycleActions actions;

    @BeforeEach
    void setUp() {
        roster = new TestRoster();
        actions = new DefaultLifecycleActions(roster.context());
    }

    // ===== 1. 단일 엔티티 =====

    @Test
    void employ_레슬러_매니저까지_고용() {
        // given
        FakeWrestler wrestler = roster.wrestler("Ric");
        FakeManager manager = roster.manager("JJ");
        roster.manage(manager, wrestler);

        // when
        actions.employ(wrestler, null, "signed");

        // then
        assertThat(roster.calls.entries()).containsExactly(
            "createEmployment " + wrestler.key(),
            "createEmployment " + manager.key()
        );
        assertThat(roster.calls.notes()).containsExactly("signed", null);
    }

    @Test
    void employ_태그팀_레슬러_매니저_고용() {
        // given
        FakeTagTeam team = roster.tagTeam("Express");
        FakeWrestler wrestler = roster.wrestler("Bobby");
        FakeManager manager = roster.manager("Jim");
        roster.join(team, wrestler);
        roster.manage(manager, team);

        // when
        actions.employ(team, null, null);

        // then
        assertThat(roster.calls.entries()).containsExactly(
            "createEmployment " + team.key(),
            "createEmployment " + manager.key(),
            "createEmployment " + wrestler.key()
        );
    }

    @Test
    void suspend_태그팀_레슬러와_매니저_정지() {
        // given
        FakeTagTeam team = employedTeam("Express");
        FakeWrestler first = roster.employedWrestler("Bobby");
        FakeWrestler second = roster.employedWrestler("Ricky");
        FakeManager manager = roster.employedManager("Jim");
        roster.join(team, first);
        roster.join(team, second);
        roster.manage(manager, team);

        // when
        actions.suspend(team, null, null);

        // then
        assertThat(roster.calls.entries()).containsExactly(
            "createSuspension " + team.key(),
            "createSuspension " + first.key(),
            "createSuspension " + second.key(),
            "createSuspension " + manager.key()
        );
    }

    @Test
    void suspend_부상_레슬러_있는_태그팀_변경_없이_거부() {
        // given
        FakeTagTeam team = employedTeam("Express");
        FakeWrestler injured = roster.employedWrestler("Bobby");
        injured.injured = true;
        roster.join(team, injured);

        // when & then
        assertThatThrownBy(() -> actions.suspend(team, null, null))
            .isInstanceOf(TransitionNotAllowedException.class);
        assertThat(roster.calls.entries()).isEmpty();
    }

    @Test
    void reinstate_레슬러_매니저도_복귀() {
        // given
        FakeWrestler wrestler = roster.employedWrestler("Ric");
        wrestler.suspended = true;
        FakeManager manager = roster.employedManager("JJ");
        manager.suspended = true;
        roster.manage(manager, wrestler);

        // when
        actions.reinstate(wrestler, null, null);

        // then
        assertThat(wrestler.isSuspended()).isFalse();
        assertThat(manager.isSuspended()).isFalse();
    }

    @Test
    void retire_스테이블_해산_멤버는_은퇴하지_않음() {
        // given
        FakeStable stable = roster.stable("Horsemen");
        stable.employed = true;
        FakeWrestler wrestler = roster.employedWrestler("Arn");
        FakeManager manager = roster.employedManager("JJ");
        roster.join(stable, wrestler);
        roster.join(stable, manager);

        // when
        actions.retire(stable, null, null);

        // then
        assertThat(stable.isRetired()).isTrue();
        assertThat(stable.currentMembers()).isEmpty();
        assertThat(wrestler.isRetired()).isFalse();
        assertThat(manager.isRetired()).isFalse();
        assertThat(wrestler.currentGroup()).isEmpty();
    }

    @Test
    void retire_매니저_그룹과_담당_관계_종료() {
        // given
        FakeStable stable = roster.stable("Horsemen");
        FakeManager manager = roster.employedManager("JJ");
        FakeWrestler wrestler = roster.employedWrestler("Arn");
        roster.join(stable, manager);
        roster.manage(manager, wrestler);

        // when
        actions.retire(manager, null, null);

        // then
        assertThat(roster.calls.entries()).containsExactly(
            "createRetirement " + manager.key(),
            "removeManager " + stable.key() + " " + manager.key(),
            "removeManager " + wrestler.key() + " " + manager.key()
        );
    }

    @Test
    void injure_그룹_엔티티_UnsupportedCapabilityException() {
        // given
        FakeTagTeam team = employedTeam("Express");

        // when & then
        assertThatThrownBy(() -> actions.injure(team, null, null))
            .isInstanceOf(UnsupportedCapabilityException.class);
        assertThat(roster.calls.entries()).isEmpty();
    }

    // ===== 2. 다중 엔티티 =====

    @Test
    void employMany_하나의_트랜잭션에서_순서대로() {
        // given
        FakeWrestler first = roster.wrestler("A");
        FakeWrestler second = roster.wrestler("B");
        FakeWrestler third = roster.wrestler("C");

        // when
        actions.employMany(List.of(third, first, second), null, null);

        // then
        assertThat(roster.calls.entries()).containsExactly(
            "createEmployment " + third.key(),
            "createEmployment " + first.key(),
            "createEmployment " + second.key()
        );
        assertThat(roster.transactionManager.outermostCount()).isEqualTo(1);
    }

    @Test
    void retireMany_실패시_예외_전파와_롤백() {
        // given
        FakeWrestler employed = roster.employedWrestler("A");
        FakeWrestler rookie = roster.wrestler("B");

        // when & then
        assertThatThrownBy(() -> actions.retireMany(List.of(employed, rookie), null, null))
            .isInstanceOf(TransitionNotAllowedException.class);
        assertThat(roster.transactionManager.rollbackCount()).isEqualTo(1);
    }

    // ===== 3. 직접 실행 =====

    @Test
    void direct_cascade_없이_전이만_수행() {
        // given
        FakeWrestler wrestler = roster.wrestler("Ric");
        FakeManager manager = roster.manager("JJ");
        roster.manage(manager, wrestler);

        // when
        actions.direct(Transition.EMPLOY, wrestler, null, null);

        // then
        assertThat(wrestler.isEmployed()).isTrue();
        assertThat(manager.isEmployed()).isFalse();
    }

    @Test
    void withCustomCascade_지정한_cascade만_적용() {
        // given
        FakeTagTeam team = roster.tagTeam("Express");
        FakeWrestler wrestler = roster.wrestler("Bobby");
        FakeManager manager = roster.manager("Jim");
        roster.join(team, wrestler);
        roster.manage(manager, team);

        // when
        actions.withCustomCascade(Transition.EMPLOY, team, List.of(EmploymentCascadeStrategy.wrestlers()), null, null);

        // then
        assertThat(wrestler.isEmployed()).isTrue();
        assertThat(manager.isEmployed()).isFalse();
    }

    // ===== 4. 그룹 멤버 =====

    @Test
    void suspendMembersByKind_레슬러_다음_태그팀_순서() {
        // given
        FakeStable stable = roster.stable("Horsemen");
        FakeWrestler solo = roster.employedWrestler("Ric");
        FakeTagTeam team = employedTeam("Brainbusters");
        FakeWrestler arn = roster.employedWrestler("Arn");
        FakeWrestler tully = roster.employedWrestler("Tully");
        FakeManager manager = roster.employedManager("JJ");
        roster.join(stable, solo);
        roster.join(stable, team);
        roster.join(stable, manager);
        roster.join(team, arn);
        roster.join(team, tully);

        // when
        actions.suspendMembersByKind(stable, EnumSet.of(MemberKind.TAG_TEAMS, MemberKind.WRESTLERS), null, null);

        // then
        assertThat(roster.calls.entries()).containsExactly(
            "createSuspension " + solo.key(),
            "createSuspension " + team.key(),
            "createSuspension " + arn.key(),
            "createSuspension " + tully.key()
        );
        assertThat(manager.isSuspended()).isFalse();
    }

    @Test
    void suspendAvailableMembers_고용되고_활성인_멤버만() {
        // given
        FakeStable stable = roster.stable("Horsemen");
        FakeWrestler active = roster.employedWrestler("Ric");
        FakeWrestler rookie = roster.wrestler("Rookie");
        FakeManager manager = roster.employedManager("JJ");
        roster.join(stable, active);
        roster.join(stable, rookie);
        roster.join(stable, manager);

        // when
        actions.suspendAvailableMembers(stable, null, null);

        // then
        assertThat(roster.calls.entries()).containsExactly(
            "createSuspension " + active.key(),
            "createSuspension " + manager.key()
        );
    }

    @Test
    void reinstateAllSuspendedMembers_정지된_멤버만_복귀() {
        // given
        FakeStable stable = roster.stable("Horsemen");
        FakeWrestler suspended = roster.employedWrestler("Ric");
        suspended.suspended = true;
        FakeWrestler active = roster.employedWrestler("Arn");
        roster.join(stable, suspended);
        roster.join(stable, active);

        // when
        actions.reinstateAllSuspendedMembers(stable, null, null);

        // then
        assertThat(roster.calls.entries()).containsExactly("createReinstatement " + suspended.key());
    }

    @Test
    void 멤버_없는_그룹은_아무것도_하지_않음() {
        // given
        FakeStable stable = roster.stable("Empty");

        // when
        actions.suspendAvailableMembers(stable, null, null);
        actions.reinstateMembersByKind(stable, EnumSet.allOf(MemberKind.class), null, null);

        // then
        assertThat(roster.calls.entries()).isEmpty();
    }

    private FakeTagTeam employedTeam(String name) {
        FakeTagTeam team = roster.tagTeam(name);
        team.employed = true;
        return team;
    }
}
