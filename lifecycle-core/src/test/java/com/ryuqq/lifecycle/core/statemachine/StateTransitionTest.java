package com.ryuqq.lifecycle.core.statemachine;

import com.ryuqq.lifecycle.core.capability.FakeIndividual;
import com.ryuqq.lifecycle.core.exception.TransitionNotAllowedException;
import com.ryuqq.lifecycle.core.model.Transition;
import org.junit.jupiter.api.Test;

import static com.ryuqq.lifecycle.core.statemachine.RosterState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StateTransition 테스트.
 *
 * <ul>
 *   <li>허용 전이 테이블</li>
 *   <li>RETIRED, RELEASED는 종료 상태가 아님 (employ로 재개)</li>
 *   <li>FUTURE_EMPLOYED는 어떤 전이도 받지 않음</li>
 * </ul>
 */
class StateTransitionTest {

    // ========== 허용 전이 ==========

    @Test
    void isAllowed_EmployFromUnemployedReleasedRetired_Succeeds() {
        assertTrue(StateTransition.isAllowed(UNEMPLOYED, Transition.EMPLOY));
        assertTrue(StateTransition.isAllowed(RELEASED, Transition.EMPLOY));
        assertTrue(StateTransition.isAllowed(RETIRED, Transition.EMPLOY));
    }

    @Test
    void isAllowed_ReleaseAndRetireFromEmployedSuspendedInjured_Succeeds() {
        for (RosterState from : new RosterState[] {EMPLOYED, SUSPENDED, INJURED}) {
            assertTrue(StateTransition.isAllowed(from, Transition.RELEASE), "release from " + from);
            assertTrue(StateTransition.isAllowed(from, Transition.RETIRE), "retire from " + from);
        }
    }

    @Test
    void next_SuspendThenReinstate_ReturnsToEmployed() {
        RosterState state = EMPLOYED;

        state = StateTransition.next(state, Transition.SUSPEND);
        state = StateTransition.next(state, Transition.REINSTATE);

        assertEquals(EMPLOYED, state);
    }

    @Test
    void next_RetiredCanBeReEmployed() {
        assertEquals(EMPLOYED, StateTransition.next(RETIRED, Transition.EMPLOY));
    }

    // ========== 불법 전이 ==========

    @Test
    void isAllowed_FutureEmployedAcceptsNothing() {
        for (Transition transition : Transition.values()) {
            assertFalse(StateTransition.isAllowed(FUTURE_EMPLOYED, transition), transition.name());
        }
    }

    @Test
    void isAllowed_RetireFromReleased_NotAllowed() {
        assertFalse(StateTransition.isAllowed(RELEASED, Transition.RETIRE));
    }

    @Test
    void next_InvalidTransition_ThrowsIllegalState() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.next(UNEMPLOYED, Transition.SUSPEND)
        );
        assertTrue(exception.getMessage().contains("UNEMPLOYED"));
    }

    @Test
    void validate_EmployedEntityEmployedAgain_ThrowsWithAlreadyReason() {
        FakeIndividual wrestler = FakeIndividual.employed(3, "Andre");

        TransitionNotAllowedException exception = assertThrows(
            TransitionNotAllowedException.class,
            () -> StateTransition.validate(wrestler, Transition.EMPLOY)
        );
        assertEquals("This wrestler 'Andre' is already employed and cannot be employed.", exception.getMessage());
        assertEquals(Transition.EMPLOY, exception.getTransition());
        assertEquals(wrestler.key(), exception.getEntityKey());
        assertEquals(TransitionNotAllowedException.CODE, exception.getErrorCode());
    }

    @Test
    void isAllowed_NullArguments_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> StateTransition.isAllowed(null, Transition.EMPLOY));
        assertThrows(IllegalArgumentException.class, () -> StateTransition.isAllowed(EMPLOYED, null));
    }
}
