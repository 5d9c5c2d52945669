package com.flagship.deposit_ledger.deposit.exception;

public class NegativeAmountException extends DepositException {

    public NegativeAmountException() {
        super("Deposit amount cannot be negative");
    }
}
