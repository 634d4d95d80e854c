package com.ryuqq.lifecycle.application.support;

import com.ryuqq.lifecycle.application.context.LifecycleContext;
import com.ryuqq.lifecycle.core.config.LifecycleConfig;
import com.ryuqq.lifecycle.core.model.EntityType;
import com.ryuqq.lifecycle.core.spi.RepositoryRegistry;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicLong;

/**
 * fake 저장소와 고정 Clock으로 엔진 컨텍스트를 조립하는 테스트 픽스처.
 */
public class TestRoster {

    public static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 1, 12, 0);
    public static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    public final CallLog calls = new CallLog();
    public final FakeTransactionManager transactionManager = new FakeTransactionManager();
    public final FakeMembershipRepository membership = new FakeMembershipRepository(calls);
    private final AtomicLong ids = new AtomicLong();
    private LifecycleContext context;

    public TestRoster() {
        RepositoryRegistry.Builder builder = RepositoryRegistry.builder().membership(membership);
        for (EntityType type : EntityType.values()) {
            builder.register(new FakeRosterRepository(type, calls));
        }
        this.context = new LifecycleContext(builder.build(), transactionManager, CLOCK, new LifecycleConfig());
    }

    public LifecycleContext context() {
        return context;
    }

    public TestRoster withConfig(LifecycleConfig config) {
        this.context = context.withConfig(config);
        return this;
    }

    // ===== 엔티티 =====

    public FakeWrestler wrestler(String name) {
        return new FakeWrestler(ids.incrementAndGet(), name);
    }

    public FakeWrestler employedWrestler(String name) {
        FakeWrestler wrestler = wrestler(name);
        wrestler.employed = true;
        return wrestler;
    }

    public FakeManager manager(String name) {
        return new FakeManager(ids.incrementAndGet(), name);
    }

    public FakeManager employedManager(String name) {
        FakeManager manager = manager(name);
        manager.employed = true;
        return manager;
    }

    public FakeTagTeam tagTeam(String name) {
        return new FakeTagTeam(ids.incrementAndGet(), name);
    }

    public FakeStable stable(String name) {
        return new FakeStable(ids.incrementAndGet(), name);
    }

    // ===== 관계 =====

    public void manage(FakeManager manager, FakeWrestler wrestler) {
        wrestler.managers.add(manager);
        manager.managedWrestlers.add(wrestler);
    }

    public void manage(FakeManager manager, FakeTagTeam team) {
        team.managers.add(manager);
        manager.managedTagTeams.add(team);
    }

    public void join(FakeTagTeam team, FakeWrestler wrestler) {
        team.wrestlers.add(wrestler);
        wrestler.tagTeam = team;
    }

    public void join(FakeStable stable, FakeWrestler wrestler) {
        stable.wrestlers.add(wrestler);
        wrestler.group = stable;
    }

    public void join(FakeStable stable, FakeTagTeam team) {
        stable.tagTeams.add(team);
        team.group = stable;
    }

    public void join(FakeStable stable, FakeManager manager) {
        stable.managers.add(manager);
        manager.group = stable;
    }
}
