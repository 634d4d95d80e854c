package com.ryuqq.lifecycle.application.pipeline;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 복합 액션 파이프라인의 작업 단위.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public interface PipelineOperation {

    /**
     * 작업 유형 이름 (로그용, 예: "batch_employ").
     */
    String type();

    /**
     * 작업 실행.
     *
     * @param defaultDate 파이프라인 기본 유효일 (nullable)
     * @return 작업 결과 (nullable)
     */
    Object execute(LocalDateTime defaultDate);

    /**
     * 실행에 성공한 이 작업의 보상.
     *
     * <p>기록만 하는 작업은 설명을 반환하고, 콜백 보상이 있는 작업은 여기서 직접 실행합니다.</p>
     *
     * @param index 작업 인덱스
     * @param result {@link #execute}의 반환값
     * @param defaultDate 파이프라인 기본 유효일 (nullable)
     * @return 기록할 보상 설명 (없으면 empty)
     */
    Optional<CompensationRecord> compensate(int index, Object result, LocalDateTime defaultDate);
}
