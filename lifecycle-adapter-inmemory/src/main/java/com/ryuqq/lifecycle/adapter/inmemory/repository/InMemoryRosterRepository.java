package com.ryuqq.lifecycle.adapter.inmemory.repository;

import com.ryuqq.lifecycle.adapter.inmemory.store.InMemoryRosterStore;
import com.ryuqq.lifecycle.adapter.inmemory.store.StatusKind;
import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.model.EntityType;
import com.ryuqq.lifecycle.core.spi.RosterRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 유형별 상태 변경 저장소.
 *
 * <p><strong>변경 규칙:</strong></p>
 * <ul>
 *   <li>employment: 고용 기간 시작</li>
 *   <li>release: 정지, 부상, 고용 기간 종료</li>
 *   <li>suspension / reinstatement: 정지 기간 시작 / 종료</li>
 *   <li>injury: 부상 기간 시작</li>
 *   <li>retirement: 정지, 부상, 고용 기간 종료 후 은퇴 기간 시작</li>
 *   <li>endRetirement: 은퇴 기간 종료</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class InMemoryRosterRepository implements RosterRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRosterRepository.class);

    private final InMemoryRosterStore store;
    private final EntityType entityType;

    public InMemoryRosterRepository(InMemoryRosterStore store, EntityType entityType) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (entityType == null) {
            throw new IllegalArgumentException("entityType cannot be null");
        }
        this.store = store;
        this.entityType = entityType;
    }

    @Override
    public EntityType entityType() {
        return entityType;
    }

    @Override
    public void createEmployment(RosterEntity entity, LocalDateTime date, String notes) {
        requireOwnType(entity);
        store.openPeriod(entity.key(), StatusKind.EMPLOYMENT, date, notes);
    }

    @Override
    public void createRelease(RosterEntity entity, LocalDateTime date, String notes) {
        requireOwnType(entity);
        store.closeOpenPeriods(entity.key(), StatusKind.SUSPENSION, date);
        store.closeOpenPeriods(entity.key(), StatusKind.INJURY, date);
        store.closeOpenPeriods(entity.key(), StatusKind.EMPLOYMENT, date);
    }

    @Override
    public void createSuspension(RosterEntity entity, LocalDateTime date, String notes) {
        requireOwnType(entity);
        store.openPeriod(entity.key(), StatusKind.SUSPENSION, date, notes);
    }

    @Override
    public void createReinstatement(RosterEntity entity, LocalDateTime date, String notes) {
        requireOwnType(entity);
        store.closeOpenPeriods(entity.key(), StatusKind.SUSPENSION, date);
    }

    @Override
    public void createInjury(RosterEntity entity, LocalDateTime date, String notes) {
        requireOwnType(entity);
        store.openPeriod(entity.key(), StatusKind.INJURY, date, notes);
    }

    @Override
    public void createRetirement(RosterEntity entity, LocalDateTime date, String notes) {
        requireOwnType(entity);
        store.closeOpenPeriods(entity.key(), StatusKind.SUSPENSION, date);
        store.closeOpenPeriods(entity.key(), StatusKind.INJURY, date);
        store.closeOpenPeriods(entity.key(), StatusKind.EMPLOYMENT, date);
        store.openPeriod(entity.key(), StatusKind.RETIREMENT, date, notes);
    }

    @Override
    public void endRetirement(RosterEntity entity, LocalDateTime date) {
        requireOwnType(entity);
        int closed = store.closeOpenPeriods(entity.key(), StatusKind.RETIREMENT, date);
        log.debug("Ended {} retirement period(s) of {}", closed, entity.key());
    }

    /**
     * 속성 변경 ("name"만 지원).
     *
     * @throws IllegalArgumentException 지원하지 않는 속성인 경우
     */
    @Override
    public void update(RosterEntity entity, Map<String, Object> data) {
        requireOwnType(entity);
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!"name".equals(entry.getKey())) {
                throw new IllegalArgumentException("Unsupported attribute for " + entityType + ": " + entry.getKey());
            }
            store.rename(entity.key(), String.valueOf(entry.getValue()));
        }
    }

    private void requireOwnType(RosterEntity entity) {
        if (entity == null) {
            throw new IllegalArgumentException("entity cannot be null");
        }
        if (entity.type() != entityType) {
            throw new IllegalArgumentException(
                "Repository for " + entityType + " cannot handle " + entity.key());
        }
    }
}
