package com.ryuqq.lifecycle.application.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 복합 액션 파이프라인 실행 결과.
 *
 * @param results 작업 인덱스 → 결과 (결과가 없는 작업은 null 값)
 * @param errors 작업 인덱스 → 실패 원인
 * @param success 오류가 하나도 없으면 true
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public record PipelineResult(Map<Integer, Object> results, Map<Integer, RuntimeException> errors, boolean success) {

    public PipelineResult {
        if (results == null) {
            throw new IllegalArgumentException("results cannot be null");
        }
        if (errors == null) {
            throw new IllegalArgumentException("errors cannot be null");
        }
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    static PipelineResult of(Map<Integer, Object> results, Map<Integer, RuntimeException> errors) {
        return new PipelineResult(results, errors, errors.isEmpty());
    }
}
