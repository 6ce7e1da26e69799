package com.cred.freestyle.arbitrage.service.size;

import com.cred.freestyle.arbitrage.domain.model.CanonicalSize;
import com.cred.freestyle.arbitrage.domain.model.Gender;
import com.cred.freestyle.arbitrage.domain.model.SizeStandard;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SizeConversions.
 */
@DisplayName("SizeConversions Unit Tests")
class SizeConversionsTest {

    @Test
    @DisplayName("defaultSize - Men's US 9 is EU 42, UK 8.5, 28 cm")
    void defaultSize_MenUs9() {
        // When
        CanonicalSize size = SizeConversions.defaultSize(Gender.MEN, 18);

        // Then
        assertThat(size.getUsSize()).isEqualByComparingTo("9");
        assertThat(size.getEuSize()).isEqualByComparingTo("42.0");
        assertThat(size.getUkSize()).isEqualByComparingTo("8.5");
        assertThat(size.getCmSize()).isEqualByComparingTo("28.0");
        assertThat(size.getJpSize()).isEqualByComparingTo("28.0");
        assertThat(size.getKrSize()).isEqualByComparingTo("280");
        assertThat(size.getValidationSource()).isEqualTo(SizeConversions.DEFAULT_SOURCE);
        assertThat(size.label()).isEqualTo("US 9 (MEN)");
    }

    @Test
    @DisplayName("defaultSize - Women's offset differs from men's")
    void defaultSize_Women() {
        CanonicalSize size = SizeConversions.defaultSize(Gender.WOMEN, 16);

        assertThat(size.getUsSize()).isEqualByComparingTo("8");
        assertThat(size.getEuSize()).isEqualByComparingTo("38.5");
        assertThat(size.getCmSize()).isEqualByComparingTo("25.7");
    }

    @Test
    @DisplayName("toUs - Every notation maps back to the same US size")
    void toUs_AllStandards() {
        CanonicalSize size = SizeConversions.defaultSize(Gender.MEN, 21);

        for (SizeStandard standard : SizeStandard.values()) {
            BigDecimal us = SizeConversions.toUs(standard, size.valueIn(standard), Gender.MEN);
            assertThat(SizeConversions.toOrdinal(us))
                    .as("ordinal from %s", standard)
                    .isEqualTo(21);
        }
    }

    @Test
    @DisplayName("toOrdinal - Rounds half up to the nearest half size")
    void toOrdinal_RoundsHalfUp() {
        assertThat(SizeConversions.toOrdinal(new BigDecimal("9.24"))).isEqualTo(18);
        assertThat(SizeConversions.toOrdinal(new BigDecimal("9.25"))).isEqualTo(19);
        assertThat(SizeConversions.usFromOrdinal(19)).isEqualByComparingTo("9.5");
    }
}
