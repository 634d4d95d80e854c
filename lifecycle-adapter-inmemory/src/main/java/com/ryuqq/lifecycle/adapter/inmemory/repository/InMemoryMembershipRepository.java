package com.ryuqq.lifecycle.adapter.inmemory.repository;

import com.ryuqq.lifecycle.adapter.inmemory.roster.Stable;
import com.ryuqq.lifecycle.adapter.inmemory.store.InMemoryRosterStore;
import com.ryuqq.lifecycle.core.capability.MemberGroup;
import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.exception.MembershipConflictException;
import com.ryuqq.lifecycle.core.model.EntityType;
import com.ryuqq.lifecycle.core.spi.MembershipRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;

/**
 * 소속 관계 저장소.
 *
 * <p>owner는 스테이블(그룹 멤버), 태그팀(팀 레슬러), 또는 매니저를 둔 레슬러/태그팀입니다.
 * 이미 현재 멤버인 경우의 추가와 현재 멤버가 아닌 경우의 제거는
 * {@link MembershipConflictException}으로 거부합니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class InMemoryMembershipRepository implements MembershipRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMembershipRepository.class);

    private final InMemoryRosterStore store;

    public InMemoryMembershipRepository(InMemoryRosterStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    @Override
    public void addWrestler(RosterEntity owner, RosterEntity wrestler, LocalDateTime date) {
        join(owner, wrestler, EntityType.WRESTLER, date);
    }

    @Override
    public void removeWrestler(RosterEntity owner, RosterEntity wrestler, LocalDateTime date) {
        leave(owner, wrestler, EntityType.WRESTLER, date);
    }

    @Override
    public void addTagTeam(RosterEntity owner, RosterEntity tagTeam, LocalDateTime date) {
        join(owner, tagTeam, EntityType.TAG_TEAM, date);
    }

    @Override
    public void removeTagTeam(RosterEntity owner, RosterEntity tagTeam, LocalDateTime date) {
        leave(owner, tagTeam, EntityType.TAG_TEAM, date);
    }

    @Override
    public void addManager(RosterEntity owner, RosterEntity manager, LocalDateTime date) {
        join(owner, manager, EntityType.MANAGER, date);
    }

    @Override
    public void removeManager(RosterEntity owner, RosterEntity manager, LocalDateTime date) {
        leave(owner, manager, EntityType.MANAGER, date);
    }

    /**
     * 멤버 없는 새 스테이블 생성.
     *
     * @param name 이름
     * @param date 생성일 (기록하지 않음)
     * @return 새 스테이블
     */
    @Override
    public MemberGroup createGroup(String name, LocalDateTime date) {
        Stable stable = store.register(EntityType.STABLE, name, key -> new Stable(store, key));
        log.debug("Created group {} '{}'", stable.key(), name);
        return stable;
    }

    private void join(RosterEntity owner, RosterEntity member, EntityType expected, LocalDateTime date) {
        requireType(member, expected);
        if (store.isCurrentMember(owner.key(), member.key())) {
            throw MembershipConflictException.alreadyAMember(owner.key(), member.key());
        }
        store.join(owner.key(), member.key(), date);
    }

    private void leave(RosterEntity owner, RosterEntity member, EntityType expected, LocalDateTime date) {
        requireType(member, expected);
        if (!store.leave(owner.key(), member.key(), date)) {
            throw MembershipConflictException.notAMember(owner.key(), member.key());
        }
    }

    private static void requireType(RosterEntity member, EntityType expected) {
        if (member.type() != expected) {
            throw new IllegalArgumentException("Expected " + expected + " but was " + member.key());
        }
    }
}
