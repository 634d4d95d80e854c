package com.ryuqq.lifecycle.core.spi;

import com.ryuqq.lifecycle.core.capability.MemberGroup;
import com.ryuqq.lifecycle.core.capability.MemberKind;
import com.ryuqq.lifecycle.core.capability.RosterEntity;

import java.time.LocalDateTime;

/**
 * 관계(멤버십, 매니지먼트) 엣지 저장소 SPI.
 *
 * <p>owner는 멤버를 가지는 쪽입니다. 스테이블/태그팀의 멤버십과
 * 레슬러·태그팀·스테이블에 대한 매니저 배정을 모두 이 인터페이스로 다룹니다.</p>
 *
 * <p>add는 새 관계 기간을 열고, remove는 열린 관계 기간을 date로 닫습니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public interface MembershipRepository {

    void addWrestler(RosterEntity owner, RosterEntity wrestler, LocalDateTime date);

    void removeWrestler(RosterEntity owner, RosterEntity wrestler, LocalDateTime date);

    void addTagTeam(RosterEntity owner, RosterEntity tagTeam, LocalDateTime date);

    void removeTagTeam(RosterEntity owner, RosterEntity tagTeam, LocalDateTime date);

    void addManager(RosterEntity owner, RosterEntity manager, LocalDateTime date);

    void removeManager(RosterEntity owner, RosterEntity manager, LocalDateTime date);

    /**
     * 멤버 없는 새 그룹 생성 (분할 시 사용).
     *
     * @param name 그룹 이름
     * @param date 그룹 시작일
     * @return 생성된 그룹
     */
    MemberGroup createGroup(String name, LocalDateTime date);

    /**
     * 멤버 종류별 추가 디스패치.
     *
     * @param kind 멤버 종류
     * @param owner 그룹
     * @param member 멤버
     * @param date 시작일
     */
    default void add(MemberKind kind, RosterEntity owner, RosterEntity member, LocalDateTime date) {
        switch (kind) {
            case WRESTLERS -> addWrestler(owner, member, date);
            case TAG_TEAMS -> addTagTeam(owner, member, date);
            case MANAGERS -> addManager(owner, member, date);
        }
    }

    /**
     * 멤버 종류별 제거 디스패치.
     *
     * @param kind 멤버 종류
     * @param owner 그룹
     * @param member 멤버
     * @param date 종료일
     */
    default void remove(MemberKind kind, RosterEntity owner, RosterEntity member, LocalDateTime date) {
        switch (kind) {
            case WRESTLERS -> removeWrestler(owner, member, date);
            case TAG_TEAMS -> removeTagTeam(owner, member, date);
            case MANAGERS -> removeManager(owner, member, date);
        }
    }
}
