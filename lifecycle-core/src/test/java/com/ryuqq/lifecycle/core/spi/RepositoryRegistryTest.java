package com.ryuqq.lifecycle.core.spi;

import com.ryuqq.lifecycle.core.capability.FakeIndividual;
import com.ryuqq.lifecycle.core.exception.ConfigurationException;
import com.ryuqq.lifecycle.core.model.EntityType;
import com.ryuqq.lifecycle.core.model.Transition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

/**
 * RepositoryRegistry 및 RosterRepository 기본 동작 테스트.
 */
@ExtendWith(MockitoExtension.class)
class RepositoryRegistryTest {

    @Mock
    private RosterRepository wrestlerRepository;

    @Mock
    private MembershipRepository membershipRepository;

    @Test
    void forType_등록된_저장소_반환() {
        // given
        when(wrestlerRepository.entityType()).thenReturn(EntityType.WRESTLER);
        RepositoryRegistry registry = RepositoryRegistry.builder()
            .register(wrestlerRepository)
            .membership(membershipRepository)
            .build();

        // when & then
        assertThat(registry.forType(EntityType.WRESTLER)).isSameAs(wrestlerRepository);
        assertThat(registry.membership()).isSameAs(membershipRepository);
        assertThat(registry.hasRepository(EntityType.STABLE)).isFalse();
    }

    @Test
    void forType_등록되지_않은_유형은_ConfigurationException() {
        RepositoryRegistry registry = RepositoryRegistry.builder().build();

        assertThatThrownBy(() -> registry.forType(EntityType.REFEREE))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("REFEREE");
        assertThatThrownBy(registry::membership)
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void apply_구현되지_않은_변경_메서드는_ConfigurationException() {
        // given: createInjury를 구현하지 않은 태그팀 저장소
        RosterRepository tagTeamRepository = () -> EntityType.TAG_TEAM;

        // when & then
        assertThatThrownBy(() -> tagTeamRepository.apply(
                Transition.INJURE, new FakeIndividual(1, "A"), LocalDateTime.now(), null))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("createInjury")
            .extracting(e -> ((ConfigurationException) e).getErrorCode())
            .isEqualTo(ConfigurationException.MISSING_MUTATION);
    }
}
