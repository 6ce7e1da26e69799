package com.cred.freestyle.arbitrage.service.size;

import com.cred.freestyle.arbitrage.domain.model.Gender;
import com.cred.freestyle.arbitrage.domain.model.SizeStandard;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses size strings as published by feeds: "9", "9.5", "42,5", "US 9", "EU42",
 * "9M", "5.5Y", "42 2/3", "42⅔", "9½".
 *
 * @author Arbitrage Team
 */
public final class SizeValueParser {

    private static final Pattern SIZE_PATTERN = Pattern.compile(
            "^(?<prefix>US|EUR|EU|UK|CM|JP|KR)?\\s*" +
            "(?<whole>\\d{1,3})(?:[.,](?<decimal>\\d{1,2}))?" +
            "(?:\\s*(?:(?<num>\\d)/(?<den>\\d)|(?<glyph>[½⅓⅔¼¾])))?" +
            "\\s*(?<suffix>GS|M|W|Y|K)?$");

    private SizeValueParser() {
    }

    /**
     * @throws IllegalArgumentException if the value is not a recognizable size
     */
    public static ParsedSize parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Size value is required");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        Matcher matcher = SIZE_PATTERN.matcher(normalized);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Unrecognized size value: " + raw);
        }

        BigDecimal value = new BigDecimal(matcher.group("whole"));
        if (matcher.group("decimal") != null) {
            value = new BigDecimal(matcher.group("whole") + "." + matcher.group("decimal"));
        }
        if (matcher.group("num") != null) {
            int numerator = Integer.parseInt(matcher.group("num"));
            int denominator = Integer.parseInt(matcher.group("den"));
            if (denominator == 0 || numerator >= denominator) {
                throw new IllegalArgumentException("Invalid size fraction: " + raw);
            }
            value = value.add(fraction(numerator, denominator));
        } else if (matcher.group("glyph") != null) {
            value = value.add(glyphValue(matcher.group("glyph").charAt(0)));
        }

        SizeStandard prefix = null;
        if (matcher.group("prefix") != null) {
            String code = matcher.group("prefix");
            prefix = "EUR".equals(code) ? SizeStandard.EU : SizeStandard.valueOf(code);
        }

        Gender suffixGender = null;
        if (matcher.group("suffix") != null) {
            suffixGender = Gender.fromCode(matcher.group("suffix").replace("K", "KIDS"));
        }

        return new ParsedSize(prefix, value.setScale(2, RoundingMode.HALF_UP), suffixGender);
    }

    private static BigDecimal fraction(int numerator, int denominator) {
        return BigDecimal.valueOf(numerator).divide(BigDecimal.valueOf(denominator), 2, RoundingMode.HALF_UP);
    }

    private static BigDecimal glyphValue(char glyph) {
        switch (glyph) {
            case '½':
                return fraction(1, 2);
            case '⅓':
                return fraction(1, 3);
            case '⅔':
                return fraction(2, 3);
            case '¼':
                return fraction(1, 4);
            case '¾':
                return fraction(3, 4);
            default:
                throw new IllegalArgumentException("Unsupported fraction glyph: " + glyph);
        }
    }

    /**
     * A parsed size string. Prefix and gender suffix are null when absent.
     */
    public static final class ParsedSize {

        private final SizeStandard prefix;
        private final BigDecimal value;
        private final Gender genderSuffix;

        public ParsedSize(SizeStandard prefix, BigDecimal value, Gender genderSuffix) {
            this.prefix = prefix;
            this.value = value;
            this.genderSuffix = genderSuffix;
        }

        public SizeStandard getPrefix() {
            return prefix;
        }

        public BigDecimal getValue() {
            return value;
        }

        public Gender getGenderSuffix() {
            return genderSuffix;
        }
    }
}
