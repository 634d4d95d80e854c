package com.ryuqq.lifecycle.application.collection;

import com.ryuqq.lifecycle.core.capability.Suspendable;
import com.ryuqq.lifecycle.core.capability.RosterEntity;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * suspension 상태 필터: suspended | active | any.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum SuspensionFilter implements StatusFilter {

    SUSPENDED("suspended", entity -> entity instanceof Suspendable s && s.isSuspended()),
    ACTIVE("active", entity -> entity instanceof Suspendable s && !s.isSuspended()),
    ANY("any", null);

    private final String literal;
    private final Predicate<RosterEntity> predicate;

    SuspensionFilter(String literal, Predicate<RosterEntity> predicate) {
        this.literal = literal;
        this.predicate = predicate;
    }

    public static SuspensionFilter fromLiteral(String literal) {
        return StatusFilter.fromLiteral(SuspensionFilter.class, "suspension", literal);
    }

    @Override
    public String literal() {
        return literal;
    }

    @Override
    public Optional<Predicate<RosterEntity>> predicate() {
        return Optional.ofNullable(predicate);
    }
}
