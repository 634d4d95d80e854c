package com.ryuqq.lifecycle.application.transition;

import com.ryuqq.lifecycle.application.support.FakeManager;
import com.ryuqq.lifecycle.application.support.FakeTitle;
import com.ryuqq.lifecycle.application.support.FakeWrestler;
import com.ryuqq.lifecycle.application.support.TestRoster;
import com.ryuqq.lifecycle.core.config.LifecycleConfig;
import com.ryuqq.lifecycle.core.exception.CascadeDepthExceededException;
import com.ryuqq.lifecycle.core.exception.ConfigurationException;
import com.ryuqq.lifecycle.core.exception.TransitionNotAllowedException;
import com.ryuqq.lifecycle.core.exception.UnsupportedCapabilityException;
import com.ryuqq.lifecycle.core.exception.ValidationException;
import com.ryuqq.lifecycle.core.model.Transition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * StatusTransitionPipeline 테스트.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
class StatusTransitionPipelineTest {

    private TestRoster roster;

    @BeforeEach
    void setUp() {
        roster = new TestRoster();
    }

    // ===== 1. 기본 실행 =====

    @Test
    void employ_미고용_엔티티_고용_기록() {
        // given
        FakeWrestler wrestler = roster.wrestler("Ric");

        // when
        StatusTransitionPipeline.employ(roster.context(), wrestler, null)
            .withNotes("debut")
            .execute();

        // then
        assertThat(wrestler.isEmployed()).isTrue();
        assertThat(roster.calls.entries()).containsExactly("createEmployment " + wrestler.key());
        assertThat(roster.calls.notes()).containsExactly("debut");
    }

    @Test
    void date_null이면_Clock_현재시각_사용() {
        // given
        FakeWrestler wrestler = roster.wrestler("Ric");

        // when
        StatusTransitionPipeline pipeline = StatusTransitionPipeline.employ(roster.context(), wrestler, null);

        // then
        assertThat(pipeline.date()).isEqualTo(TestRoster.NOW);
    }

    @Test
    void 명시한_date_그대로_사용() {
        // given
        LocalDateTime date = LocalDateTime.of(2023, 1, 1, 0, 0);

        // when
        StatusTransitionPipeline pipeline = StatusTransitionPipeline.employ(roster.context(), roster.wrestler("Ric"), date);

        // then
        assertThat(pipeline.date()).isEqualTo(date);
    }

    @Test
    void 전이_이름으로_생성() {
        // when
        StatusTransitionPipeline pipeline = StatusTransitionPipeline.create(roster.context(), roster.wrestler("Ric"), "Suspend", null);

        // then
        assertThat(pipeline.transition()).isEqualTo(Transition.SUSPEND);
    }

    @Test
    void 알_수_없는_전이_이름_ConfigurationException() {
        assertThatThrownBy(() -> StatusTransitionPipeline.create(roster.context(), roster.wrestler("Ric"), "promote", null))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("promote");
    }

    @Test
    void 하나의_트랜잭션에서_실행() {
        // given
        FakeWrestler wrestler = roster.wrestler("Ric");
        FakeManager manager = roster.manager("Jimmy");
        roster.manage(manager, wrestler);

        // when
        StatusTransitionPipeline.employ(roster.context(), wrestler, null)
            .withCascade((entity, date, transition, cascade) ->
                cascade.spawn(manager, Transition.EMPLOY, date).execute())
            .execute();

        // then
        assertThat(roster.transactionManager.outermostCount()).isEqualTo(1);
        assertThat(manager.isEmployed()).isTrue();
    }

    // ===== 2. 선행 상태 종료 =====

    @Test
    void 은퇴한_엔티티_고용시_은퇴_먼저_종료() {
        // given
        FakeWrestler wrestler = roster.wrestler("Ric");
        wrestler.retired = true;

        // when
        StatusTransitionPipeline.employ(roster.context(), wrestler, null).execute();

        // then
        assertThat(roster.calls.entries()).containsExactly(
            "endRetirement " + wrestler.key(),
            "createEmployment " + wrestler.key()
        );
        assertThat(wrestler.isRetired()).isFalse();
        assertThat(wrestler.isEmployed()).isTrue();
    }

    // ===== 3. 검증 =====

    @Test
    void capability_없는_엔티티_변경_전에_실패() {
        // given
        FakeTitle title = new FakeTitle(7);

        // when & then
        assertThatThrownBy(() -> StatusTransitionPipeline.injure(roster.context(), title, null).execute())
            .isInstanceOf(UnsupportedCapabilityException.class)
            .isInstanceOf(ValidationException.class);
        assertThat(roster.calls.entries()).isEmpty();
    }

    @Test
    void 허용되지_않은_전이_변경_없이_실패() {
        // given
        FakeWrestler wrestler = roster.employedWrestler("Ric");

        // when & then
        assertThatThrownBy(() -> StatusTransitionPipeline.employ(roster.context(), wrestler, null).execute())
            .isInstanceOf(TransitionNotAllowedException.class)
            .hasMessageContaining("already employed");
        assertThat(roster.calls.entries()).isEmpty();
    }

    @Test
    void 사용자_검증_등록_순서대로_실행_후_실패시_중단() {
        // given
        FakeWrestler wrestler = roster.wrestler("Ric");
        List<String> order = new ArrayList<>();

        // when & then
        assertThatThrownBy(() -> StatusTransitionPipeline.employ(roster.context(), wrestler, null)
            .withValidation((entity, transition) -> order.add("first"))
            .withValidation((entity, transition) -> {
                order.add("second");
                throw new ValidationException("blocked");
            })
            .withValidation((entity, transition) -> order.add("third"))
            .execute())
            .isInstanceOf(ValidationException.class)
            .hasMessage("blocked");
        assertThat(order).containsExactly("first", "second");
        assertThat(roster.calls.entries()).isEmpty();
    }

    @Test
    void 기본_검증이_사용자_검증보다_먼저() {
        // given
        FakeWrestler wrestler = roster.employedWrestler("Ric");
        List<String> order = new ArrayList<>();

        // when & then
        assertThatThrownBy(() -> StatusTransitionPipeline.employ(roster.context(), wrestler, null)
            .withValidation((entity, transition) -> order.add("custom"))
            .execute())
            .isInstanceOf(TransitionNotAllowedException.class);
        assertThat(order).isEmpty();
    }

    // ===== 4. cascade =====

    @Test
    void cascade_변경_이후_등록_순서대로_실행() {
        // given
        FakeWrestler wrestler = roster.wrestler("Ric");
        List<String> order = new ArrayList<>();

        // when
        StatusTransitionPipeline.employ(roster.context(), wrestler, null)
            .withCascade((entity, date, transition, cascade) -> order.add("a:" + ((FakeWrestler) entity).isEmployed()))
            .withCascade((entity, date, transition, cascade) -> order.add("b:" + transition))
            .execute();

        // then
        assertThat(order).containsExactly("a:true", "b:employ");
    }

    @Test
    void cascade_실패는_호출자에게_전파() {
        // given
        FakeWrestler wrestler = roster.wrestler("Ric");

        // when & then
        assertThatThrownBy(() -> StatusTransitionPipeline.employ(roster.context(), wrestler, null)
            .withCascade((entity, date, transition, cascade) -> {
                throw new IllegalStateException("cascade failed");
            })
            .execute())
            .isInstanceOf(IllegalStateException.class);
        assertThat(roster.transactionManager.rollbackCount()).isEqualTo(1);
    }

    @Test
    void 활성_경로의_동일_엔티티_전이는_건너뜀() {
        // given
        FakeWrestler wrestler = roster.wrestler("Ric");
        FakeManager manager = roster.manager("Jimmy");
        CascadeStrategy pingPong = (entity, date, transition, cascade) ->
            cascade.spawn(manager, Transition.EMPLOY, date)
                .withCascade((inner, innerDate, innerTransition, innerCascade) ->
                    innerCascade.spawn(wrestler, Transition.EMPLOY, innerDate).execute())
                .execute();

        // when
        StatusTransitionPipeline.employ(roster.context(), wrestler, null)
            .withCascade(pingPong)
            .execute();

        // then
        assertThat(roster.calls.count("createEmployment")).isEqualTo(2);
    }

    @Test
    void 최대_깊이_초과시_CascadeDepthExceededException() {
        // given
        roster.withConfig(new LifecycleConfig().withMaxCascadeDepth(2));
        FakeWrestler first = roster.wrestler("A");
        FakeWrestler second = roster.wrestler("B");
        FakeWrestler third = roster.wrestler("C");

        // when & then
        assertThatThrownBy(() -> StatusTransitionPipeline.employ(roster.context(), first, null)
            .withCascade((entity, date, transition, cascade) -> cascade.spawn(second, transition, date)
                .withCascade((e2, d2, t2, c2) -> c2.spawn(third, t2, d2).execute())
                .execute())
            .execute())
            .isInstanceOf(CascadeDepthExceededException.class)
            .isInstanceOf(ConfigurationException.class);
        assertThat(third.isEmployed()).isFalse();
    }

    // ===== 5. 인자 검증 =====

    @Test
    void null_entity_거부() {
        assertThatThrownBy(() -> StatusTransitionPipeline.employ(roster.context(), null, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("entity cannot be null");
    }

    @Test
    void null_cascade_거부() {
        StatusTransitionPipeline pipeline = StatusTransitionPipeline.employ(roster.context(), roster.wrestler("Ric"), null);

        assertThatThrownBy(() -> pipeline.withCascade(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cascade cannot be null");
    }
}
