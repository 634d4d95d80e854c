package com.ryuqq.lifecycle.core.exception;

/**
 * 보상(compensating) 작업 자체의 실패.
 *
 * <p>원래 오류를 가리지 않도록 로그로만 남기고 결과에 보관하며,
 * 호출자에게 던지지 않습니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class CompensationException extends LifecycleException {

    public static final String CODE = "LIFECYCLE-COMPENSATION-001";

    private final int operationIndex;

    public CompensationException(int operationIndex, Throwable cause) {
        super(CODE, "Compensation failed for operation #" + operationIndex + ": " + cause.getMessage(), cause);
        this.operationIndex = operationIndex;
    }

    public int getOperationIndex() {
        return operationIndex;
    }
}
