package com.flagship.deposit_ledger.deposit.exception;

/**
 * Base class for errors raised while crediting a deposit.
 * The message is shown to the user as-is.
 */
public abstract class DepositException extends RuntimeException {

    protected DepositException(String message) {
        super(message);
    }
}
