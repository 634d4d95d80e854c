package com.ryuqq.lifecycle.application.collection;

import com.ryuqq.lifecycle.core.capability.Retirable;
import com.ryuqq.lifecycle.core.capability.RosterEntity;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * retirement 상태 필터: retired | active | any.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum RetirementFilter implements StatusFilter {

    RETIRED("retired", entity -> entity instanceof Retirable r && r.isRetired()),
    ACTIVE("active", entity -> entity instanceof Retirable r && !r.isRetired()),
    ANY("any", null);

    private final String literal;
    private final Predicate<RosterEntity> predicate;

    RetirementFilter(String literal, Predicate<RosterEntity> predicate) {
        this.literal = literal;
        this.predicate = predicate;
    }

    public static RetirementFilter fromLiteral(String literal) {
        return StatusFilter.fromLiteral(RetirementFilter.class, "retirement", literal);
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
