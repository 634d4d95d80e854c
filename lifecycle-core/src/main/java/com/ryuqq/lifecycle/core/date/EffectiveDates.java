package com.ryuqq.lifecycle.core.date;

import com.ryuqq.lifecycle.core.exception.InvalidDateRangeException;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 작업 유효일 결정 및 기간 검증.
 *
 * <p>명시된 날짜가 없으면 항상 {@link Clock} 기준 "현재"를 사용하며,
 * 다른 필드에서 날짜를 추론하지 않습니다.</p>
 *
 * <p><strong>사용 예:</strong></p>
 * <pre>
 * EffectiveDates dates = new EffectiveDates(Clock.systemDefaultZone());
 * LocalDateTime date = dates.resolve(request.date());   // null이면 now
 * dates.ensureValidRange(start, end);
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class EffectiveDates {

    private final Clock clock;

    public EffectiveDates(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    /**
     * 현재 시각.
     *
     * @return clock 기준 now
     */
    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    /**
     * 유효일 결정.
     *
     * @param date 명시된 날짜 (nullable)
     * @return date, null이면 now
     */
    public LocalDateTime resolve(LocalDateTime date) {
        return date != null ? date : now();
    }

    /**
     * 기간 시작일 결정 (미래 날짜는 now로 당김).
     *
     * @param date 명시된 시작일 (nullable)
     * @return 시작일
     */
    public LocalDateTime resolveStart(LocalDateTime date) {
        LocalDateTime now = now();
        if (date == null || date.isAfter(now)) {
            return now;
        }
        return date;
    }

    /**
     * 기간 종료일 결정.
     *
     * @param date 명시된 종료일 (nullable)
     * @return date, null이면 now
     */
    public LocalDateTime resolveEnd(LocalDateTime date) {
        return resolve(date);
    }

    /**
     * 기간 유효성 확인 (start ≤ end).
     *
     * @param start 시작일
     * @param end 종료일
     * @return 유효하면 true
     */
    public boolean isValidRange(LocalDateTime start, LocalDateTime end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("start and end cannot be null");
        }
        return !start.isAfter(end);
    }

    /**
     * 기간 유효성 검증.
     *
     * @param start 시작일
     * @param end 종료일
     * @throws InvalidDateRangeException end가 start보다 앞선 경우
     */
    public void ensureValidRange(LocalDateTime start, LocalDateTime end) {
        if (!isValidRange(start, end)) {
            throw new InvalidDateRangeException(start, end);
        }
    }
}
