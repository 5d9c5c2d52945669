package com.flagship.deposit_ledger.ledger;

import com.flagship.deposit_ledger.deposit.DepositRule;
import com.flagship.deposit_ledger.deposit.exception.AmountTooLargeException;
import com.flagship.deposit_ledger.deposit.exception.NegativeAmountException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Account balance rules.
 *
 * The displayed deposit re-applies the rule to a balance that already holds
 * rule-transformed credits; these tests pin that behaviour down.
 */
class AccountTest {

    @Test
    @DisplayName("New account starts with a zero balance")
    void testOpen() {
        Account account = Account.open("PZ123456", "Alice", DepositRule.NORMAL);

        assertEquals("PZ123456", account.getId());
        assertEquals("Alice", account.getName());
        assertEquals(0, account.getBalance().signum());
        assertEquals(DepositRule.NORMAL, account.getRule());
    }

    @Test
    @DisplayName("NORMAL deposit credits the raw amount")
    void testNormalDeposit() {
        Account account = Account.open("PZ123456", "Alice", DepositRule.NORMAL)
                .deposit(new BigDecimal("50"));

        assertEquals(new BigDecimal("50"), account.getBalance());
        assertEquals(new BigDecimal("50"), account.computeCurrentDeposit());
    }

    @Test
    @DisplayName("FIXED deposit of 50 stores 150 and displays 250")
    void testFixedDepositAppliesRuleTwice() {
        Account account = Account.open("PZ123456", "Bob", DepositRule.FIXED)
                .deposit(new BigDecimal("50"));

        assertEquals(new BigDecimal("150"), account.getBalance());
        assertEquals(new BigDecimal("250"), account.computeCurrentDeposit());
        assertEquals(account.computeCurrentDeposit(), account.computeCurrentDeposit());
    }

    @Test
    @DisplayName("FIXED account with no deposits still displays the bonus")
    void testFixedEmptyAccountDisplaysBonus() {
        Account account = Account.open("PZ123456", "Bob", DepositRule.FIXED);

        assertEquals(new BigDecimal("100"), account.computeCurrentDeposit());
    }

    @Test
    @DisplayName("Deposit returns a new instance and leaves the original unchanged")
    void testDepositIsImmutable() {
        Account original = Account.open("PZ123456", "Alice", DepositRule.NORMAL);
        Account updated = original.deposit(new BigDecimal("10"));

        assertNotSame(original, updated);
        assertEquals(0, original.getBalance().signum());
        assertEquals(new BigDecimal("10"), updated.getBalance());
    }

    @Test
    @DisplayName("Negative deposit is rejected")
    void testNegativeDeposit() {
        Account account = Account.open("PZ123456", "Alice", DepositRule.NORMAL);

        assertThrows(NegativeAmountException.class, () -> account.deposit(new BigDecimal("-1")));
    }

    @Test
    @DisplayName("FIXED deposit above the ceiling is rejected")
    void testFixedDepositAboveCeiling() {
        Account account = Account.open("PZ123456", "Bob", DepositRule.FIXED);

        assertThrows(AmountTooLargeException.class, () -> account.deposit(new BigDecimal("1000001")));
    }

    @Test
    @DisplayName("Opening without a rule is an illegal argument")
    void testOpenRequiresRule() {
        assertThrows(IllegalArgumentException.class, () -> Account.open("PZ123456", "Alice", null));
        assertThrows(IllegalArgumentException.class, () -> Account.open("", "Alice", DepositRule.NORMAL));
    }
}
