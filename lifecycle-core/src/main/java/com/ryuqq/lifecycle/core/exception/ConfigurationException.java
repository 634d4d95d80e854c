package com.ryuqq.lifecycle.core.exception;

import com.ryuqq.lifecycle.core.model.EntityType;

/**
 * 설정/배선 오류.
 *
 * <p>알 수 없는 전이·작업·조건 이름, 등록되지 않은 저장소, 저장소가 지원하지 않는
 * 변경 메서드 등 코드 결함을 나타냅니다. 재시도 대상이 아니며
 * 발생 즉시 둘러싼 트랜잭션을 롤백시킵니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class ConfigurationException extends LifecycleException {

    public static final String UNKNOWN_TRANSITION = "LIFECYCLE-CONFIG-001";
    public static final String UNKNOWN_OPERATION = "LIFECYCLE-CONFIG-002";
    public static final String UNKNOWN_CRITERION = "LIFECYCLE-CONFIG-003";
    public static final String MISSING_REPOSITORY = "LIFECYCLE-CONFIG-004";
    public static final String MISSING_MUTATION = "LIFECYCLE-CONFIG-005";
    public static final String CASCADE_DEPTH_EXCEEDED = "LIFECYCLE-CONFIG-006";

    public ConfigurationException(String errorCode, String message) {
        super(errorCode, message);
    }

    public static ConfigurationException unknownTransition(String name) {
        return new ConfigurationException(UNKNOWN_TRANSITION, "Unknown transition: " + name);
    }

    public static ConfigurationException unknownOperation(String name) {
        return new ConfigurationException(UNKNOWN_OPERATION, "Unknown operation type: " + name);
    }

    public static ConfigurationException unknownCriterion(String key) {
        return new ConfigurationException(UNKNOWN_CRITERION, "Unknown filter criterion: " + key);
    }

    public static ConfigurationException missingRepository(EntityType type) {
        return new ConfigurationException(
            MISSING_REPOSITORY,
            "No repository registered for entity type: " + type
        );
    }

    public static ConfigurationException missingMembershipRepository() {
        return new ConfigurationException(MISSING_REPOSITORY, "No membership repository registered");
    }

    public static ConfigurationException missingMutation(EntityType type, String mutationName) {
        return new ConfigurationException(
            MISSING_MUTATION,
            String.format("Repository for %s does not support %s", type, mutationName)
        );
    }
}
