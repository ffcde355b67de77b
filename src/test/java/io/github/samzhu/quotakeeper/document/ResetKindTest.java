package io.github.samzhu.quotakeeper.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;

import org.junit.jupiter.api.Test;

import io.github.samzhu.quotakeeper.exception.InvalidResetTypeException;

class ResetKindTest {

    @Test
    void shouldParseKindsIgnoringCaseAndWhitespace() {
        assertThat(ResetKind.fromValue("daily")).isEqualTo(ResetKind.DAILY);
        assertThat(ResetKind.fromValue(" Weekly ")).isEqualTo(ResetKind.WEEKLY);
        assertThat(ResetKind.fromValue("MONTHLY")).isEqualTo(ResetKind.MONTHLY);
    }

    @Test
    void shouldRejectUnknownKinds() {
        assertThatThrownBy(() -> ResetKind.fromValue("yearly"))
            .isInstanceOf(InvalidResetTypeException.class)
            .hasMessageContaining("'yearly'");
        assertThatThrownBy(() -> ResetKind.fromValue(null)).isInstanceOf(InvalidResetTypeException.class);
        // all 只在手動觸發時有效，不是單一種類
        assertThatThrownBy(() -> ResetKind.fromValue("all")).isInstanceOf(InvalidResetTypeException.class);
    }

    @Test
    void shouldExpandAll() {
        assertThat(ResetKind.resolve("all")).containsExactly(ResetKind.DAILY, ResetKind.WEEKLY, ResetKind.MONTHLY);
        assertThat(ResetKind.resolve("weekly")).containsExactly(ResetKind.WEEKLY);
    }

    @Test
    void shouldMapToUserFields() {
        assertThat(ResetKind.DAILY.usageField()).isEqualTo("dailyUsage");
        assertThat(ResetKind.WEEKLY.lastResetField()).isEqualTo("lastWeeklyReset");
        assertThat(ResetKind.MONTHLY.value()).isEqualTo("monthly");
    }

    @Test
    void shouldProjectNextReset() {
        Instant wednesday = Instant.parse("2025-06-18T15:30:00Z");

        assertThat(ResetKind.DAILY.nextResetAfter(wednesday)).isEqualTo(Instant.parse("2025-06-19T00:00:00Z"));
        assertThat(ResetKind.WEEKLY.nextResetAfter(wednesday)).isEqualTo(Instant.parse("2025-06-23T00:00:00Z"));
        assertThat(ResetKind.MONTHLY.nextResetAfter(wednesday)).isEqualTo(Instant.parse("2025-07-01T00:00:00Z"));
    }
}
