package com.cred.freestyle.arbitrage.service.size;

import com.cred.freestyle.arbitrage.domain.model.Gender;
import com.cred.freestyle.arbitrage.domain.model.SizeStandard;
import com.cred.freestyle.arbitrage.service.size.SizeValueParser.ParsedSize;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SizeValueParser.
 */
@DisplayName("SizeValueParser Unit Tests")
class SizeValueParserTest {

    @ParameterizedTest(name = "\"{0}\" parses to {1}")
    @CsvSource({
            "9, 9.00",
            "9.5, 9.50",
            "'42,5', 42.50",
            "42 2/3, 42.67",
            "42⅔, 42.67",
            "9½, 9.50",
            "' 10 ', 10.00",
            "280, 280.00"
    })
    @DisplayName("parse - Numeric notations are normalized to scale 2")
    void parse_NumericNotations(String raw, String expected) {
        // When
        ParsedSize parsed = SizeValueParser.parse(raw);

        // Then
        assertThat(parsed.getValue()).isEqualByComparingTo(expected);
        assertThat(parsed.getValue().scale()).isEqualTo(2);
        assertThat(parsed.getPrefix()).isNull();
        assertThat(parsed.getGenderSuffix()).isNull();
    }

    @Test
    @DisplayName("parse - Standard prefix is recognized, EUR maps to EU")
    void parse_Prefix() {
        assertThat(SizeValueParser.parse("US 9").getPrefix()).isEqualTo(SizeStandard.US);
        assertThat(SizeValueParser.parse("eu42").getPrefix()).isEqualTo(SizeStandard.EU);
        assertThat(SizeValueParser.parse("EUR 42").getPrefix()).isEqualTo(SizeStandard.EU);
        assertThat(SizeValueParser.parse("UK 8.5").getValue()).isEqualByComparingTo(new BigDecimal("8.5"));
    }

    @Test
    @DisplayName("parse - Gender suffix is recognized")
    void parse_GenderSuffix() {
        assertThat(SizeValueParser.parse("9M").getGenderSuffix()).isEqualTo(Gender.MEN);
        assertThat(SizeValueParser.parse("7.5W").getGenderSuffix()).isEqualTo(Gender.WOMEN);
        assertThat(SizeValueParser.parse("5.5Y").getGenderSuffix()).isEqualTo(Gender.YOUTH);
        assertThat(SizeValueParser.parse("6 GS").getGenderSuffix()).isEqualTo(Gender.YOUTH);
        assertThat(SizeValueParser.parse("4K").getGenderSuffix()).isEqualTo(Gender.YOUTH);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "XL", "9-10", "42 3/2", "1000", "US", "9.555"})
    @DisplayName("parse - Unrecognizable values are rejected")
    void parse_Invalid_Throws(String raw) {
        assertThatThrownBy(() -> SizeValueParser.parse(raw))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("parse - Null value is rejected")
    void parse_Null_Throws() {
        assertThatThrownBy(() -> SizeValueParser.parse(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("required");
    }
}
