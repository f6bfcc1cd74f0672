package com.kblabs.analytics.domain.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GranularityTest {

    private final TimeBucketing bucketing = new TimeBucketing();

    @Test
    @DisplayName("Each key maps to its truncation unit and label pattern")
    void unitsAndFormats() {
        assertThat(bucketing.truncUnit("hour")).isEqualTo("hour");
        assertThat(bucketing.truncUnit("day")).isEqualTo("day");
        assertThat(bucketing.truncUnit("week")).isEqualTo("week");
        assertThat(bucketing.truncUnit("month")).isEqualTo("month");

        assertThat(bucketing.displayFormat("hour")).isEqualTo("YYYY-MM-DD\"T\"HH24");
        assertThat(bucketing.displayFormat("day")).isEqualTo("YYYY-MM-DD");
        assertThat(bucketing.displayFormat("week")).isEqualTo("YYYY-\"W\"WW");
        assertThat(bucketing.displayFormat("month")).isEqualTo("YYYY-MM");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"year", "Day", "DAY", " day", "minute"})
    @DisplayName("Anything outside the four keys is rejected, never defaulted")
    void unknownKeysRejected(String key) {
        assertThatThrownBy(() -> Granularity.fromKey(key))
                .isInstanceOf(InvalidGranularityException.class)
                .hasMessageContaining("hour, day, week, month");
    }

    @Test
    @DisplayName("Bucket and label expressions work on ts")
    void expressions() {
        assertThat(bucketing.bucketExpression(Granularity.WEEK)).isEqualTo("date_trunc('week', ts)");
        assertThat(bucketing.labelExpression(Granularity.MONTH))
                .isEqualTo("to_char(date_trunc('month', ts), 'YYYY-MM')");
    }

    @Test
    @DisplayName("keys() lists every granularity")
    void keys() {
        assertThat(Granularity.keys()).containsExactly("hour", "day", "week", "month");
    }
}
