package com.ryuqq.lifecycle.application.collection;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 필터링된 컬렉션의 상태 통계.
 *
 * @param total 필터 적용 후 전체 수
 * @param employed 고용 중
 * @param unemployed 미고용
 * @param suspended 정지 중
 * @param injured 부상 중
 * @param retired 은퇴
 * @param available 가용
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public record StatusStatistics(
    int total,
    int employed,
    int unemployed,
    int suspended,
    int injured,
    int retired,
    int available
) {

    public StatusStatistics {
        if (total < 0) {
            throw new IllegalArgumentException("total cannot be negative (current: " + total + ")");
        }
    }

    /**
     * 보고용 맵 (total, employed, unemployed, suspended, injured, retired, available 순서).
     *
     * @return 키 → 개수
     */
    public Map<String, Integer> toMap() {
        Map<String, Integer> map = new LinkedHashMap<>();
        map.put("total", total);
        map.put(StatusBucket.EMPLOYED.key(), employed);
        map.put(StatusBucket.UNEMPLOYED.key(), unemployed);
        map.put(StatusBucket.SUSPENDED.key(), suspended);
        map.put(StatusBucket.INJURED.key(), injured);
        map.put(StatusBucket.RETIRED.key(), retired);
        map.put(StatusBucket.AVAILABLE.key(), available);
        return map;
    }
}
