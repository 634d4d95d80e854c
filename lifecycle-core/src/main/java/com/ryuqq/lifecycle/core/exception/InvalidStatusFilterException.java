package com.ryuqq.lifecycle.core.exception;

import java.util.Collection;

/**
 * 지원하지 않는 상태 필터 리터럴.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class InvalidStatusFilterException extends ValidationException {

    public static final String CODE = "LIFECYCLE-VALIDATION-003";

    public InvalidStatusFilterException(String filterName, String status, Collection<String> allowed) {
        super(CODE, String.format("Invalid %s status: %s (allowed: %s)", filterName, status, allowed));
    }
}
