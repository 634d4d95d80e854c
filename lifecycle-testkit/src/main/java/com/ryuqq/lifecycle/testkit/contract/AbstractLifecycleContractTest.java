package com.ryuqq.lifecycle.testkit.contract;

import com.ryuqq.lifecycle.adapter.inmemory.InMemoryRoster;
import com.ryuqq.lifecycle.adapter.inmemory.roster.Manager;
import com.ryuqq.lifecycle.adapter.inmemory.roster.Stable;
import com.ryuqq.lifecycle.adapter.inmemory.roster.TagTeam;
import com.ryuqq.lifecycle.adapter.inmemory.roster.Wrestler;
import com.ryuqq.lifecycle.adapter.inmemory.store.StatusKind;
import com.ryuqq.lifecycle.adapter.inmemory.store.StatusPeriod;
import com.ryuqq.lifecycle.application.action.DefaultLifecycleActions;
import com.ryuqq.lifecycle.application.action.LifecycleActions;
import com.ryuqq.lifecycle.application.context.LifecycleContext;
import com.ryuqq.lifecycle.core.capability.MemberGroup;
import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.config.LifecycleConfig;
import com.ryuqq.lifecycle.core.statemachine.RosterState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

/**
 * Abstract base class for lifecycle Contract Tests.
 *
 * <p>Wires the lifecycle engine against the in-memory adapter with a fixed clock, so every
 * scenario sees the same "now" and can inspect the stored status periods directly.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>InMemoryRoster: entity factories, status seeding and the SPI wiring</li>
 *   <li>LifecycleContext: registry, transaction manager, fixed clock, default config</li>
 *   <li>LifecycleActions: the default action facade under test</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractLifecycleContractTest {
 *     {@literal @}Test
 *     void testScenario() {
 *         Wrestler wrestler = employedWrestler("Ric");
 *
 *         actions.suspend(wrestler, null, null);
 *
 *         assertState(wrestler, RosterState.SUSPENDED);
 *     }
 * }
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public abstract class AbstractLifecycleContractTest {

    /** Fixed "now" of every contract scenario. */
    protected static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 1, 12, 0);

    /** A date safely in the past, used to seed existing status. */
    protected static final LocalDateTime LAST_YEAR = NOW.minusYears(1);

    protected InMemoryRoster roster;
    protected LifecycleContext context;
    protected LifecycleActions actions;

    /**
     * Sets up test fixtures before each test.
     *
     * <p>Creates a fresh roster so no status leaks between scenarios.</p>
     */
    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        roster = new InMemoryRoster(clock);
        context = new LifecycleContext(roster.registry(), roster.transactionManager(), clock, new LifecycleConfig());
        actions = new DefaultLifecycleActions(context);
    }

    /**
     * Verifies that the scenario left no transaction open on the current thread.
     */
    @AfterEach
    void tearDown() {
        if (roster != null) {
            assertFalse(roster.transactionManager().isActive(), "Transaction leaked past the scenario");
        }
    }

    // ===== fixtures =====

    protected Wrestler employedWrestler(String name) {
        Wrestler wrestler = roster.wrestler(name);
        roster.seedEmployment(wrestler, LAST_YEAR);
        return wrestler;
    }

    protected Manager employedManager(String name) {
        Manager manager = roster.manager(name);
        roster.seedEmployment(manager, LAST_YEAR);
        return manager;
    }

    protected TagTeam employedTagTeam(String name, RosterEntity... wrestlers) {
        TagTeam team = roster.tagTeam(name);
        roster.seedEmployment(team, LAST_YEAR);
        for (RosterEntity wrestler : wrestlers) {
            roster.seedMembership(team, wrestler, LAST_YEAR);
        }
        return team;
    }

    protected Stable employedStable(String name, RosterEntity... members) {
        Stable stable = roster.stable(name);
        roster.seedEmployment(stable, LAST_YEAR);
        for (RosterEntity member : members) {
            roster.seedMembership(stable, member, LAST_YEAR);
        }
        return stable;
    }

    // ===== assertions =====

    /**
     * Asserts that the entity is in the expected derived state.
     *
     * @param entity the roster entity
     * @param expectedState the expected state
     */
    protected void assertState(RosterEntity entity, RosterState expectedState) {
        RosterState actualState = RosterState.of(entity);
        assertEquals(expectedState, actualState,
                String.format("Expected state %s but was %s for %s", expectedState, actualState, entity.key()));
    }

    /**
     * Asserts how many periods of a kind were ever stored for the entity.
     *
     * @param entity the roster entity
     * @param kind the status kind
     * @param expected the expected number of periods
     */
    protected void assertPeriodCount(RosterEntity entity, StatusKind kind, int expected) {
        List<StatusPeriod> periods = roster.store().periods(entity.key()).stream()
                .filter(period -> period.kind() == kind)
                .toList();
        assertEquals(expected, periods.size(),
                String.format("Expected %d %s period(s) for %s but found %s", expected, kind, entity.key(), periods));
    }

    /**
     * Asserts the current members of a group (wrestlers, then tag teams, then managers).
     *
     * @param group the group
     * @param expected the expected members
     */
    protected void assertCurrentMembers(MemberGroup group, RosterEntity... expected) {
        assertEquals(Arrays.asList(expected), group.currentMembers(),
                String.format("Unexpected members of %s", group.key()));
    }
}
