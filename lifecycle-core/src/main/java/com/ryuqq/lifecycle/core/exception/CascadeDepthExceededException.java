package com.ryuqq.lifecycle.core.exception;

import com.ryuqq.lifecycle.core.model.EntityKey;
import com.ryuqq.lifecycle.core.model.Transition;

/**
 * cascade 체인이 허용 깊이를 넘었을 때 발생.
 *
 * <p>관계 그래프에 순환이 있거나 cascade 조합이 잘못 구성된 경우로 보고
 * 설정 오류로 분류합니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class CascadeDepthExceededException extends ConfigurationException {

    private final int depth;
    private final int maxDepth;

    public CascadeDepthExceededException(EntityKey key, Transition transition, int depth, int maxDepth) {
        super(
            CASCADE_DEPTH_EXCEEDED,
            String.format("Cascade depth %d exceeds maximum %d at %s (%s)", depth, maxDepth, key, transition)
        );
        this.depth = depth;
        this.maxDepth = maxDepth;
    }

    public int getDepth() {
        return depth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
