package com.flagship.deposit_ledger.deposit.exception;

import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Thrown when a deposit exceeds the ceiling of the FIXED rule.
 */
public class AmountTooLargeException extends DepositException {

    private final BigDecimal ceiling;

    public AmountTooLargeException(BigDecimal ceiling) {
        super(String.format(
            "The maximum deposit amount for the fixed account is %s. Please deposit less.",
            new DecimalFormat("#,##0.##", DecimalFormatSymbols.getInstance(Locale.US)).format(ceiling)
        ));
        this.ceiling = ceiling;
    }

    public BigDecimal getCeiling() {
        return ceiling;
    }
}
