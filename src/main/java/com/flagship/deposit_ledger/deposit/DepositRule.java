package com.flagship.deposit_ledger.deposit;

import com.flagship.deposit_ledger.deposit.exception.AmountTooLargeException;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Deposit calculation rule assigned to a depositor at registration.
 *
 * The set of rules is closed: a depositor is either on the NORMAL rule
 * (amount credited as-is) or on the FIXED rule (a flat bonus is added,
 * up to a ceiling). Rules are stateless and shared by every account
 * that uses them.
 */
public enum DepositRule {
    /**
     * Credits the amount unchanged.
     */
    NORMAL("1", "Normal"),

    /**
     * Credits the amount plus {@link #FIXED_BONUS}.
     * Amounts above {@link #FIXED_CEILING} are rejected.
     */
    FIXED("2", "Fixed");

    public static final BigDecimal FIXED_BONUS = new BigDecimal("100");
    public static final BigDecimal FIXED_CEILING = new BigDecimal("1000000");

    private final String menuChoice;
    private final String label;

    DepositRule(String menuChoice, String label) {
        this.menuChoice = menuChoice;
        this.label = label;
    }

    /**
     * Computes the amount to credit for a deposit.
     *
     * @param amount Non-negative deposit amount
     * @return Amount to credit
     * @throws AmountTooLargeException if this is the FIXED rule and the amount exceeds the ceiling
     */
    public BigDecimal apply(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount is required");
        }
        return switch (this) {
            case NORMAL -> amount;
            case FIXED -> {
                if (amount.compareTo(FIXED_CEILING) > 0) {
                    throw new AmountTooLargeException(FIXED_CEILING);
                }
                yield amount.add(FIXED_BONUS);
            }
        };
    }

    /**
     * Strategy prompt listing every rule, e.g. "(1: Normal, 2: Fixed)".
     */
    public static String menuOptions() {
        return Arrays.stream(values())
                .map(rule -> rule.menuChoice + ": " + rule.label)
                .collect(Collectors.joining(", ", "(", ")"));
    }

    /**
     * Resolves the rule selected at the strategy prompt ("1" or "2").
     */
    public static Optional<DepositRule> fromMenuChoice(String choice) {
        return Arrays.stream(values())
                .filter(rule -> rule.menuChoice.equals(choice))
                .findFirst();
    }
}
