package com.ryuqq.lifecycle.application.collection;

import com.ryuqq.lifecycle.core.capability.Employable;
import com.ryuqq.lifecycle.core.capability.RosterEntity;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * employment 상태 필터: employed | unemployed | released | any.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum EmploymentFilter implements StatusFilter {

    EMPLOYED("employed", entity -> entity instanceof Employable e && e.isEmployed()),
    UNEMPLOYED("unemployed", entity -> entity instanceof Employable e && !e.isEmployed()),
    RELEASED("released", entity -> entity instanceof Employable e && e.isReleased()),
    ANY("any", null);

    private final String literal;
    private final Predicate<RosterEntity> predicate;

    EmploymentFilter(String literal, Predicate<RosterEntity> predicate) {
        this.literal = literal;
        this.predicate = predicate;
    }

    public static EmploymentFilter fromLiteral(String literal) {
        return StatusFilter.fromLiteral(EmploymentFilter.class, "employment", literal);
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
