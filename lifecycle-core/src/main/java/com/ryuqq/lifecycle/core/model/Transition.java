package com.ryuqq.lifecycle.core.model;

import com.ryuqq.lifecycle.core.exception.ConfigurationException;

import java.util.Locale;

/**
 * 생명주기 상태 전이.
 *
 * <p>각 전이는 기본 검증 가드 이름, 저장소 변경 메서드 이름, 그리고
 * 전이 전에 닫아야 하는 선행 상태(예: employ 전에 retirement 종료)를 가집니다.</p>
 *
 * <pre>
 * EMPLOY    → ensureCanBeEmployed   → createEmployment   (retired이면 endRetirement 선행)
 * SUSPEND   → ensureCanBeSuspended  → createSuspension
 * RELEASE   → ensureCanBeReleased   → createRelease
 * RETIRE    → ensureCanBeRetired    → createRetirement
 * INJURE    → ensureCanBeInjured    → createInjury
 * REINSTATE → ensureCanBeReinstated → createReinstatement
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum Transition {

    EMPLOY("employ", "ensureCanBeEmployed", "createEmployment", "employed"),
    SUSPEND("suspend", "ensureCanBeSuspended", "createSuspension", "suspended"),
    RELEASE("release", "ensureCanBeReleased", "createRelease", "released"),
    RETIRE("retire", "ensureCanBeRetired", "createRetirement", "retired"),
    INJURE("injure", "ensureCanBeInjured", "createInjury", "injured"),
    REINSTATE("reinstate", "ensureCanBeReinstated", "createReinstatement", "reinstated");

    private final String transitionName;
    private final String validationName;
    private final String mutationName;
    private final String pastTense;

    Transition(String transitionName, String validationName, String mutationName, String pastTense) {
        this.transitionName = transitionName;
        this.validationName = validationName;
        this.mutationName = mutationName;
        this.pastTense = pastTense;
    }

    /**
     * 전이 이름 (소문자, 예: "employ").
     *
     * @return 전이 이름
     */
    public String transitionName() {
        return transitionName;
    }

    /**
     * 기본 검증 가드 이름.
     *
     * @return 가드 이름 (예: "ensureCanBeEmployed")
     */
    public String validationName() {
        return validationName;
    }

    /**
     * 저장소 변경 메서드 이름.
     *
     * @return 변경 메서드 이름 (예: "createEmployment")
     */
    public String mutationName() {
        return mutationName;
    }

    /**
     * 메시지 표시용 과거형.
     *
     * @return 과거형 (예: "employed")
     */
    public String pastTense() {
        return pastTense;
    }

    /**
     * 전이 이름으로 조회.
     *
     * @param name "employ", "RETIRE" 등 (대소문자 무시)
     * @return 일치하는 Transition
     * @throws ConfigurationException 알 수 없는 전이 이름인 경우
     */
    public static Transition fromName(String name) {
        if (name == null || name.isBlank()) {
            throw ConfigurationException.unknownTransition(String.valueOf(name));
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (Transition transition : values()) {
            if (transition.transitionName.equals(normalized)) {
                return transition;
            }
        }
        throw ConfigurationException.unknownTransition(name);
    }

    @Override
    public String toString() {
        return transitionName;
    }
}
