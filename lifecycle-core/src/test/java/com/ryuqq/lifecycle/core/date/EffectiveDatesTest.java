package com.ryuqq.lifecycle.core.date;

import com.ryuqq.lifecycle.core.exception.InvalidDateRangeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * EffectiveDates 테스트 (고정 Clock 사용).
 */
class EffectiveDatesTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 1, 12, 0);

    private EffectiveDates dates;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
        dates = new EffectiveDates(clock);
    }

    @Test
    void resolve_null이면_now() {
        assertThat(dates.resolve(null)).isEqualTo(NOW);
    }

    @Test
    void resolve_명시된_날짜는_그대로() {
        LocalDateTime explicit = LocalDateTime.of(2020, 1, 1, 0, 0);

        assertThat(dates.resolve(explicit)).isEqualTo(explicit);
    }

    @Test
    void resolveStart_미래_날짜는_now로_당김() {
        assertThat(dates.resolveStart(NOW.plusDays(3))).isEqualTo(NOW);
        assertThat(dates.resolveStart(NOW.minusDays(3))).isEqualTo(NOW.minusDays(3));
    }

    @Test
    void isValidRange_같은_날짜는_유효() {
        assertThat(dates.isValidRange(NOW, NOW)).isTrue();
        assertThat(dates.isValidRange(NOW, NOW.minusSeconds(1))).isFalse();
    }

    @Test
    void ensureValidRange_역전된_기간은_InvalidDateRangeException() {
        assertThatThrownBy(() -> dates.ensureValidRange(NOW, NOW.minusDays(1)))
            .isInstanceOf(InvalidDateRangeException.class)
            .hasMessageContaining("must be after or equal to start date");
    }

    @Test
    void constructor_null_clock은_거부() {
        assertThatThrownBy(() -> new EffectiveDates(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("clock cannot be null");
    }
}
