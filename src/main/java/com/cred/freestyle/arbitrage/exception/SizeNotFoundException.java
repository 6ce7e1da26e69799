package com.cred.freestyle.arbitrage.exception;

/**
 * Exception thrown when a size notation cannot be mapped onto a seeded canonical size.
 * The index never guesses a nearest size.
 *
 * @author Arbitrage Team
 */
public class SizeNotFoundException extends SizeResolutionException {

    private final String standard;
    private final String rawValue;
    private final String gender;

    public SizeNotFoundException(String standard, String rawValue, String gender) {
        super(String.format("No canonical size for %s %s (%s)", standard, rawValue, gender));
        this.standard = standard;
        this.rawValue = rawValue;
        this.gender = gender;
    }

    public String getStandard() {
        return standard;
    }

    public String getRawValue() {
        return rawValue;
    }

    public String getGender() {
        return gender;
    }
}
