package com.flagship.deposit_ledger.deposit;

import java.math.BigDecimal;

/**
 * Display formatting for monetary amounts.
 */
public final class Amounts {

    private Amounts() {
        // Utility class
    }

    /**
     * Formats an amount in plain notation without trailing zeros ("250", "12.5").
     */
    public static String format(BigDecimal amount) {
        if (amount == null) {
            return "0";
        }
        if (amount.signum() == 0) {
            return "0";
        }
        return amount.stripTrailingZeros().toPlainString();
    }
}
