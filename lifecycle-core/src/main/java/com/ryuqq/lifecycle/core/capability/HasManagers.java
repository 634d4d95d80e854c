package com.ryuqq.lifecycle.core.capability;

import java.util.List;

/**
 * 매니저가 배정될 수 있는 엔티티.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public interface HasManagers extends RosterEntity {

    /**
     * 현재 배정된 매니저 목록.
     *
     * @return 매니저 목록 (없으면 빈 리스트)
     */
    List<RosterEntity> currentManagers();
}
