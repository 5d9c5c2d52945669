package com.flagship.deposit_ledger.validation;

import com.flagship.deposit_ledger.deposit.exception.NegativeAmountException;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Shape and range checks for console input.
 *
 * All methods are pure. Shape checks report through their return value so the
 * prompts can retry; the range check throws because it also guards the ledger.
 */
public final class InputValidation {

    /**
     * Largest number of digits accepted before the decimal point.
     */
    public static final int MAX_INTEGER_DIGITS = 15;

    /**
     * Largest number of significant digits accepted after the decimal point.
     */
    public static final int MAX_FRACTION_DIGITS = 10;

    private InputValidation() {
        // Utility class
    }

    /**
     * Rejects amounts below zero.
     *
     * @throws NegativeAmountException if {@code amount < 0}
     */
    public static void validateNonNegative(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount is required");
        }
        if (amount.signum() < 0) {
            throw new NegativeAmountException();
        }
    }

    /**
     * Checks that every character of the name is a letter.
     * The empty string has no offending character and passes.
     */
    public static boolean isAlphabeticName(String name) {
        if (name == null) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            if (!Character.isLetter(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Parses a decimal number. The whole string must be consumed: "12" and "12.5"
     * parse, "12a" and "" do not. A leading sign is accepted, so "-5" parses.
     *
     * Values with more than {@link #MAX_INTEGER_DIGITS} integer digits or more than
     * {@link #MAX_FRACTION_DIGITS} significant fraction digits are not numeric
     * ("1e999999999", "1e-999999999"). Accepted values are returned without trailing zeros.
     */
    public static Optional<BigDecimal> parseNumeric(String value) {
        if (value == null || value.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal parsed;
        try {
            parsed = new BigDecimal(value);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        BigDecimal normalized = parsed.signum() == 0 ? BigDecimal.ZERO : parsed.stripTrailingZeros();
        return isWithinBounds(normalized) ? Optional.of(normalized) : Optional.empty();
    }

    private static boolean isWithinBounds(BigDecimal normalized) {
        long integerDigits = (long) normalized.precision() - normalized.scale();
        return integerDigits <= MAX_INTEGER_DIGITS && normalized.scale() <= MAX_FRACTION_DIGITS;
    }

    public static boolean isNumeric(String value) {
        return parseNumeric(value).isPresent();
    }
}
