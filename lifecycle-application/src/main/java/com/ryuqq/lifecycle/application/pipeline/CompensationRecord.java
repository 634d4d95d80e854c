package com.ryuqq.lifecycle.application.pipeline;

import com.ryuqq.lifecycle.core.model.EntityKey;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 실행하지 않고 기록만 하는 보상 작업 설명.
 *
 * <p>내장 작업(고용, 해고, 은퇴, 정지, 병합, 분할)이 실패 후 되돌려야 할 내용을 기록합니다.
 * 실제 복구는 호출자가 결정합니다.</p>
 *
 * @param operationIndex 보상 대상 작업 인덱스
 * @param type 역작업 이름 (예: "release", "unretire", "delete_group")
 * @param targets 대상 엔티티 키
 * @param date 원래 작업의 유효일 (nullable)
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public record CompensationRecord(int operationIndex, String type, List<EntityKey> targets, LocalDateTime date) {

    public static final String RELEASE = "release";
    public static final String EMPLOY = "employ";
    public static final String UNRETIRE = "unretire";
    public static final String REINSTATE = "reinstate";
    public static final String SUSPEND = "suspend";
    public static final String RESTORE_GROUP_MEMBERSHIPS = "restore_group_memberships";
    public static final String DELETE_GROUP = "delete_group";

    public CompensationRecord {
        if (operationIndex < 0) {
            throw new IllegalArgumentException("operationIndex cannot be negative (current: " + operationIndex + ")");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (targets == null) {
            throw new IllegalArgumentException("targets cannot be null");
        }
        targets = List.copyOf(targets);
    }
}
