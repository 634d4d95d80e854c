package com.ryuqq.lifecycle.core.exception;

/**
 * 비즈니스 규칙 위반.
 *
 * <p>호출자에게 그대로 보고되는 예상 가능한 오류입니다.
 * 현재 트랜잭션은 중단(롤백)됩니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class ValidationException extends LifecycleException {

    public static final String GENERIC = "LIFECYCLE-VALIDATION-000";

    public ValidationException(String message) {
        super(GENERIC, message);
    }

    protected ValidationException(String errorCode, String message) {
        super(errorCode, message);
    }
}
