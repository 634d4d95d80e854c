package com.ryuqq.lifecycle.core.exception;

import java.time.LocalDateTime;

/**
 * 종료일이 시작일보다 앞선 기간.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class InvalidDateRangeException extends ValidationException {

    public static final String CODE = "LIFECYCLE-VALIDATION-004";

    public InvalidDateRangeException(LocalDateTime start, LocalDateTime end) {
        super(CODE, String.format("End date (%s) must be after or equal to start date (%s)", end, start));
    }
}
