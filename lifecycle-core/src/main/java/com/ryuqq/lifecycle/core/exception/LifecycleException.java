package com.ryuqq.lifecycle.core.exception;

/**
 * 생명주기 엔진 예외의 최상위 타입.
 *
 * <p>모든 예외는 unchecked이며, 로그/모니터링에서 분류할 수 있도록
 * 오류 코드(예: {@code LIFECYCLE-CONFIG-001})를 함께 가집니다.</p>
 *
 * <p><strong>분류:</strong></p>
 * <ul>
 *   <li>{@link ConfigurationException}: 프로그래밍 결함 (재시도 금지)</li>
 *   <li>{@link ValidationException}: 비즈니스 규칙 위반 (호출자에게 보고)</li>
 *   <li>{@link CompensationException}: 보상 작업 실패 (로그만 남기고 호출자에게 던지지 않음)</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public abstract class LifecycleException extends RuntimeException {

    private final String errorCode;

    protected LifecycleException(String errorCode, String message) {
        super(message);
        this.errorCode = requireCode(errorCode);
    }

    protected LifecycleException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = requireCode(errorCode);
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드 (예: "LIFECYCLE-VALIDATION-001")
     */
    public String getErrorCode() {
        return errorCode;
    }

    private static String requireCode(String errorCode) {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        return errorCode;
    }
}
