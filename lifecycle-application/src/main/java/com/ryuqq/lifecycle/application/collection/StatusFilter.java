package com.ryuqq.lifecycle.application.collection;

import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.exception.InvalidStatusFilterException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * 상태 필터 리터럴 공통 계약.
 *
 * <p>{@code any}는 조건을 추가하지 않으므로 predicate가 empty입니다.
 * 엔티티가 해당 capability를 선언하지 않으면 모든 리터럴 predicate가 false입니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public interface StatusFilter {

    /**
     * 필터 리터럴 (예: "employed").
     *
     * @return 리터럴
     */
    String literal();

    /**
     * 적용할 predicate.
     *
     * @return predicate ({@code any}면 empty)
     */
    Optional<Predicate<RosterEntity>> predicate();

    /**
     * 리터럴로 필터 상수 조회.
     *
     * @param type 필터 enum 타입
     * @param filterName 오류 메시지용 필터 이름 (예: "employment")
     * @param literal 상태 리터럴
     * @param <F> 필터 타입
     * @return 일치하는 필터
     * @throws InvalidStatusFilterException 지원하지 않는 리터럴인 경우
     */
    static <F extends Enum<F> & StatusFilter> F fromLiteral(Class<F> type, String filterName, String literal) {
        F[] constants = type.getEnumConstants();
        if (literal != null) {
            String normalized = literal.trim().toLowerCase(Locale.ROOT);
            for (F constant : constants) {
                if (constant.literal().equals(normalized)) {
                    return constant;
                }
            }
        }
        List<String> allowed = Arrays.stream(constants).map(StatusFilter::literal).toList();
        throw new InvalidStatusFilterException(filterName, literal, allowed);
    }
}
