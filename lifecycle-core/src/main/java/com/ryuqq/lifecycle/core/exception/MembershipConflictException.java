package com.ryuqq.lifecycle.core.exception;

import com.ryuqq.lifecycle.core.model.EntityKey;

/**
 * 그룹 구성 작업이 현재 멤버십과 충돌하는 경우.
 *
 * <p>예: 같은 그룹끼리 병합, 이미 소속된 그룹으로 이동, 소속되지 않은 멤버 제거.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class MembershipConflictException extends ValidationException {

    public static final String CODE = "LIFECYCLE-VALIDATION-005";

    public MembershipConflictException(String message) {
        super(CODE, message);
    }

    public static MembershipConflictException sameGroup(EntityKey group) {
        return new MembershipConflictException("Source and target group are the same: " + group);
    }

    public static MembershipConflictException notAMember(EntityKey group, EntityKey member) {
        return new MembershipConflictException(member + " is not a current member of " + group);
    }

    public static MembershipConflictException alreadyAMember(EntityKey group, EntityKey member) {
        return new MembershipConflictException(member + " is already a current member of " + group);
    }
}
