package com.ryuqq.lifecycle.application.transition;

import com.ryuqq.lifecycle.application.support.TestRoster;
import com.ryuqq.lifecycle.core.exception.CascadeDepthExceededException;
import com.ryuqq.lifecycle.core.config.LifecycleConfig;
import com.ryuqq.lifecycle.core.model.EntityKey;
import com.ryuqq.lifecycle.core.model.EntityType;
import com.ryuqq.lifecycle.core.model.Transition;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CascadeContextTest {

    private final TestRoster roster = new TestRoster();

    @Test
    void markVisited_scope별로_한번만_true() {
        // given
        CascadeContext context = CascadeContext.root(roster.context());
        EntityKey key = EntityKey.of(EntityType.WRESTLER, 1);

        // when & then
        assertThat(context.markVisited("a", key)).isTrue();
        assertThat(context.markVisited("a", key)).isFalse();
        assertThat(context.markVisited("b", key)).isTrue();
        assertThat(context.visited("a")).containsExactly(key);
        assertThat(context.visited("unknown")).isEmpty();
    }

    @Test
    void enter_exit_깊이_추적() {
        // given
        CascadeContext context = CascadeContext.root(roster.context());
        EntityKey key = EntityKey.of(EntityType.WRESTLER, 1);

        // when
        boolean entered = context.enter(key, Transition.EMPLOY);
        boolean reentered = context.enter(key, Transition.EMPLOY);
        boolean otherTransition = context.enter(key, Transition.SUSPEND);

        // then
        assertThat(entered).isTrue();
        assertThat(reentered).isFalse();
        assertThat(otherTransition).isTrue();
        assertThat(context.depth()).isEqualTo(2);

        context.exit();
        context.exit();
        assertThat(context.depth()).isZero();
        assertThat(context.enter(key, Transition.EMPLOY)).isTrue();
    }

    @Test
    void 최대_깊이_초과_거부() {
        // given
        TestRoster shallow = new TestRoster().withConfig(new LifecycleConfig().withMaxCascadeDepth(1));
        CascadeContext context = CascadeContext.root(shallow.context());
        context.enter(EntityKey.of(EntityType.WRESTLER, 1), Transition.EMPLOY);

        // when & then
        assertThatThrownBy(() -> context.enter(EntityKey.of(EntityType.WRESTLER, 2), Transition.EMPLOY))
            .isInstanceOf(CascadeDepthExceededException.class);
    }
}
