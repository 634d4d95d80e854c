package com.ryuqq.lifecycle.application.collection;

import com.ryuqq.lifecycle.core.capability.Injurable;
import com.ryuqq.lifecycle.core.capability.RosterEntity;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * injury 상태 필터: injured | healthy | any.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum InjuryFilter implements StatusFilter {

    INJURED("injured", entity -> entity instanceof Injurable i && i.isInjured()),
    HEALTHY("healthy", entity -> entity instanceof Injurable i && !i.isInjured()),
    ANY("any", null);

    private final String literal;
    private final Predicate<RosterEntity> predicate;

    InjuryFilter(String literal, Predicate<RosterEntity> predicate) {
        this.literal = literal;
        this.predicate = predicate;
    }

    public static InjuryFilter fromLiteral(String literal) {
        return StatusFilter.fromLiteral(InjuryFilter.class, "injury", literal);
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
