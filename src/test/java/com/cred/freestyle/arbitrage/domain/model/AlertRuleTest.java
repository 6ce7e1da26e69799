package com.cred.freestyle.arbitrage.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.util.EnumSet;

import static com.cred.freestyle.arbitrage.testutil.TestDataBuilder.anAlertRule;
import static com.cred.freestyle.arbitrage.testutil.TestDataBuilder.aWindowedRule;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for AlertRule scheduling logic.
 * Berlin is UTC+1 for every instant used here (before the March DST switch).
 */
@DisplayName("AlertRule Domain Model Tests")
class AlertRuleTest {

    private static final LocalTime NINE = LocalTime.of(9, 0);
    private static final LocalTime TWENTY_TWO = LocalTime.of(22, 0);

    // ========================================
    // isDue() Tests
    // ========================================

    @Test
    @DisplayName("isDue - Never scanned rule without window is due")
    void isDue_NeverScanned_NoWindow_True() {
        AlertRule rule = anAlertRule().build();

        assertThat(rule.isDue(Instant.parse("2026-03-02T03:17:00Z"))).isTrue();
    }

    @Test
    @DisplayName("isDue - Interval not elapsed: not due")
    void isDue_IntervalNotElapsed_False() {
        Instant lastScan = Instant.parse("2026-03-02T10:00:00Z");
        AlertRule rule = anAlertRule().intervalMinutes(15).lastScannedAt(lastScan).build();

        assertThat(rule.isDue(lastScan.plusSeconds(14 * 60 + 59))).isFalse();
    }

    @Test
    @DisplayName("isDue - Interval elapsed exactly: due")
    void isDue_IntervalElapsedExactly_True() {
        Instant lastScan = Instant.parse("2026-03-02T10:00:00Z");
        AlertRule rule = anAlertRule().intervalMinutes(15).lastScannedAt(lastScan).build();

        assertThat(rule.isDue(lastScan.plusSeconds(15 * 60))).isTrue();
    }

    @Test
    @DisplayName("isDue - Inactive rule is never due")
    void isDue_Inactive_False() {
        AlertRule rule = anAlertRule().active(false).build();

        assertThat(rule.isDue(Instant.parse("2026-03-02T10:00:00Z"))).isFalse();
    }

    @Test
    @DisplayName("isDue - 23:00 Berlin is outside 09:00-22:00 regardless of elapsed interval")
    void isDue_BerlinLateEvening_False() {
        AlertRule rule = aWindowedRule(NINE, TWENTY_TWO)
                .timezone("Europe/Berlin")
                .intervalMinutes(15)
                .lastScannedAt(Instant.parse("2026-02-20T00:00:00Z"))
                .build();

        // 22:00Z = 23:00 Berlin
        assertThat(rule.isDue(Instant.parse("2026-03-02T22:00:00Z"))).isFalse();
    }

    @Test
    @DisplayName("isDue - Window bounds are inclusive in the rule's timezone")
    void isDue_WindowBoundsInclusive() {
        AlertRule rule = aWindowedRule(NINE, TWENTY_TWO).timezone("Europe/Berlin").build();

        assertThat(rule.isDue(Instant.parse("2026-03-02T08:00:00Z"))).isTrue();  // 09:00 local
        assertThat(rule.isDue(Instant.parse("2026-03-02T21:00:59Z"))).isTrue();  // 22:00 local
        assertThat(rule.isDue(Instant.parse("2026-03-02T07:59:00Z"))).isFalse(); // 08:59 local
        assertThat(rule.isDue(Instant.parse("2026-03-02T21:01:00Z"))).isFalse(); // 22:01 local
    }

    // ========================================
    // isInActiveWindow() Tests
    // ========================================

    @Test
    @DisplayName("isInActiveWindow - Overnight window spans midnight")
    void isInActiveWindow_Overnight() {
        AlertRule rule = aWindowedRule(LocalTime.of(22, 0), LocalTime.of(6, 0)).timezone("UTC").build();

        assertThat(rule.isInActiveWindow(Instant.parse("2026-03-02T23:30:00Z"))).isTrue();
        assertThat(rule.isInActiveWindow(Instant.parse("2026-03-03T05:00:00Z"))).isTrue();
        assertThat(rule.isInActiveWindow(Instant.parse("2026-03-03T12:00:00Z"))).isFalse();
    }

    @Test
    @DisplayName("isInActiveWindow - Weekday set evaluated in local time")
    void isInActiveWindow_Weekdays() {
        AlertRule rule = anAlertRule()
                .timezone("Asia/Tokyo")
                .activeDays(EnumSet.of(DayOfWeek.TUESDAY))
                .build();

        // Monday 20:00Z is Tuesday 05:00 in Tokyo
        assertThat(rule.isInActiveWindow(Instant.parse("2026-03-02T20:00:00Z"))).isTrue();
        // Monday 10:00Z is Monday 19:00 in Tokyo
        assertThat(rule.isInActiveWindow(Instant.parse("2026-03-02T10:00:00Z"))).isFalse();
    }

    @Test
    @DisplayName("isInActiveWindow - Only a start bound means active until midnight")
    void isInActiveWindow_OpenEnded() {
        AlertRule rule = anAlertRule().timezone("UTC").activeHoursStart(LocalTime.of(18, 0)).build();

        assertThat(rule.isInActiveWindow(Instant.parse("2026-03-02T23:59:00Z"))).isTrue();
        assertThat(rule.isInActiveWindow(Instant.parse("2026-03-02T17:59:00Z"))).isFalse();
    }

    @Test
    @DisplayName("truncateError - Long messages are cut to the column size")
    void truncateError_LongMessage() {
        String message = "x".repeat(AlertRule.MAX_ERROR_LENGTH + 50);

        assertThat(AlertRule.truncateError(message)).hasSize(AlertRule.MAX_ERROR_LENGTH);
        assertThat(AlertRule.truncateError("HTTP 500")).isEqualTo("HTTP 500");
        assertThat(AlertRule.truncateError(null)).isNull();
    }
}
