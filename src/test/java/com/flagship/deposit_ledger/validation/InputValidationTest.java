package com.flagship.deposit_ledger.validation;

import com.flagship.deposit_ledger.deposit.exception.NegativeAmountException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InputValidationTest {

    @Nested
    @DisplayName("Name validation")
    class NameTests {

        @Test
        @DisplayName("Accepts letters only")
        void testAcceptsLetters() {
            assertTrue(InputValidation.isAlphabeticName("Alice"));
            assertTrue(InputValidation.isAlphabeticName("b"));
            assertTrue(InputValidation.isAlphabeticName("OConnor"));
        }

        @Test
        @DisplayName("Rejects digits and symbols")
        void testRejectsDigitsAndSymbols() {
            assertFalse(InputValidation.isAlphabeticName("Alice1"));
            assertFalse(InputValidation.isAlphabeticName("O'Connor"));
            assertFalse(InputValidation.isAlphabeticName("Anne-Marie"));
            assertFalse(InputValidation.isAlphabeticName("_"));
        }

        @Test
        @DisplayName("Empty string has no offending character")
        void testEmptyNamePasses() {
            assertTrue(InputValidation.isAlphabeticName(""));
            assertFalse(InputValidation.isAlphabeticName(null));
        }
    }

    @Nested
    @DisplayName("Numeric parsing")
    class NumericTests {

        @Test
        @DisplayName("Parses integers and decimals")
        void testParsesNumbers() {
            assertEquals(Optional.of(new BigDecimal("12")), InputValidation.parseNumeric("12"));
            assertEquals(Optional.of(new BigDecimal("12.5")), InputValidation.parseNumeric("12.5"));
        }

        @Test
        @DisplayName("Rejects trailing characters and non-numbers")
        void testRejectsTrailingCharacters() {
            assertTrue(InputValidation.parseNumeric("12a").isEmpty());
            assertTrue(InputValidation.parseNumeric("abc").isEmpty());
            assertTrue(InputValidation.parseNumeric("").isEmpty());
            assertTrue(InputValidation.parseNumeric(null).isEmpty());
            assertFalse(InputValidation.isNumeric("1.2.3"));
        }

        @Test
        @DisplayName("Rejects values with extreme exponents or too many digits")
        void testRejectsOutOfBoundsValues() {
            assertTrue(InputValidation.parseNumeric("1e999999999").isEmpty());
            assertTrue(InputValidation.parseNumeric("1e-999999999").isEmpty());
            assertTrue(InputValidation.parseNumeric("1e100000000").isEmpty());
            assertTrue(InputValidation.parseNumeric("1234567890123456").isEmpty());
            assertTrue(InputValidation.parseNumeric("0.00000000001").isEmpty());
        }

        @Test
        @DisplayName("Accepts values at the digit limits")
        void testAcceptsValuesAtLimits() {
            assertTrue(InputValidation.parseNumeric("999999999999999").isPresent());
            assertTrue(InputValidation.parseNumeric("0.0000000001").isPresent());
            assertTrue(InputValidation.parseNumeric("12.50000000000000").isPresent());
            assertEquals(Optional.of(new BigDecimal("1e3")), InputValidation.parseNumeric("1e3"));
            assertTrue(InputValidation.parseNumeric("0e-999999999").isPresent());
        }

        @Test
        @DisplayName("Negative numbers parse and are rejected by the range check")
        void testNegativeParsesThenFailsRangeCheck() {
            Optional<BigDecimal> parsed = InputValidation.parseNumeric("-5");

            assertTrue(parsed.isPresent());
            assertThrows(NegativeAmountException.class, () -> InputValidation.validateNonNegative(parsed.get()));
        }
    }

    @Test
    @DisplayName("Zero and positive amounts pass the range check")
    void testValidateNonNegative() {
        assertDoesNotThrow(() -> InputValidation.validateNonNegative(BigDecimal.ZERO));
        assertDoesNotThrow(() -> InputValidation.validateNonNegative(new BigDecimal("0.01")));

        NegativeAmountException exception = assertThrows(NegativeAmountException.class,
                () -> InputValidation.validateNonNegative(new BigDecimal("-0.01")));
        assertEquals("Deposit amount cannot be negative", exception.getMessage());
    }
}
