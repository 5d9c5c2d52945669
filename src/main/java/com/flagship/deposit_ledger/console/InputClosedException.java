package com.flagship.deposit_ledger.console;

/**
 * Thrown when standard input ends while a value is still expected.
 */
public class InputClosedException extends RuntimeException {

    public InputClosedException() {
        super("Console input closed");
    }
}
