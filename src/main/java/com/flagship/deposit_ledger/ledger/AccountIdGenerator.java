package com.flagship.deposit_ledger.ledger;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * Generates depositor IDs: the configured prefix followed by a six-digit number
 * drawn uniformly from [100000, 999999].
 *
 * IDs are not checked against existing accounts, so two depositors may
 * receive the same ID.
 */
@Component
public class AccountIdGenerator {

    static final int MIN_NUMBER = 100_000;
    static final int MAX_NUMBER = 999_999;

    private final String prefix;
    private final Random random;

    @Autowired
    public AccountIdGenerator(@Value("${ledger.depositor.id-prefix:PZ}") String prefix) {
        this(prefix, new Random());
    }

    AccountIdGenerator(String prefix, Random random) {
        this.prefix = prefix;
        this.random = random;
    }

    public String nextId() {
        int number = MIN_NUMBER + random.nextInt(MAX_NUMBER - MIN_NUMBER + 1);
        return prefix + number;
    }

    public String getPrefix() {
        return prefix;
    }
}
