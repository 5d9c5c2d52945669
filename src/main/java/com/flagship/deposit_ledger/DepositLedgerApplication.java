package com.flagship.deposit_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Console bookkeeping application for depositors and their deposits.
 * The process exits once the console session ends.
 */
@SpringBootApplication
public class DepositLedgerApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(DepositLedgerApplication.class, args)));
    }
}
