package com.ryuqq.lifecycle.core.spi;

import com.ryuqq.lifecycle.core.exception.ConfigurationException;
import com.ryuqq.lifecycle.core.model.EntityType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 엔티티 유형 → 저장소 레지스트리.
 *
 * <p>시작 시점에 명시적으로 구성하며, 런타임에 이름 규칙으로 저장소를 찾지 않습니다.</p>
 *
 * <pre>
 * RepositoryRegistry registry = RepositoryRegistry.builder()
 *     .register(wrestlerRepository)
 *     .register(tagTeamRepository)
 *     .membership(membershipRepository)
 *     .build();
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class RepositoryRegistry {

    private final Map<EntityType, RosterRepository> repositories;
    private final MembershipRepository membershipRepository;

    private RepositoryRegistry(Map<EntityType, RosterRepository> repositories,
                               MembershipRepository membershipRepository) {
        this.repositories = Collections.unmodifiableMap(new EnumMap<>(repositories));
        this.membershipRepository = membershipRepository;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 유형별 저장소 조회.
     *
     * @param type 엔티티 유형
     * @return 저장소
     * @throws ConfigurationException 등록되지 않은 유형인 경우
     */
    public RosterRepository forType(EntityType type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        RosterRepository repository = repositories.get(type);
        if (repository == null) {
            throw ConfigurationException.missingRepository(type);
        }
        return repository;
    }

    /**
     * 관계 저장소 조회.
     *
     * @return 관계 저장소
     * @throws ConfigurationException 등록되지 않은 경우
     */
    public MembershipRepository membership() {
        if (membershipRepository == null) {
            throw ConfigurationException.missingMembershipRepository();
        }
        return membershipRepository;
    }

    public boolean hasRepository(EntityType type) {
        return repositories.containsKey(type);
    }

    /**
     * RepositoryRegistry 빌더.
     */
    public static final class Builder {

        private final Map<EntityType, RosterRepository> repositories = new EnumMap<>(EntityType.class);
        private MembershipRepository membershipRepository;

        private Builder() {
        }

        public Builder register(RosterRepository repository) {
            if (repository == null) {
                throw new IllegalArgumentException("repository cannot be null");
            }
            repositories.put(repository.entityType(), repository);
            return this;
        }

        public Builder membership(MembershipRepository membershipRepository) {
            if (membershipRepository == null) {
                throw new IllegalArgumentException("membershipRepository cannot be null");
            }
            this.membershipRepository = membershipRepository;
            return this;
        }

        public RepositoryRegistry build() {
            return new RepositoryRegistry(repositories, membershipRepository);
        }
    }
}
