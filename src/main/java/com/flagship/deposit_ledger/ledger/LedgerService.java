package com.flagship.deposit_ledger.ledger;

import com.flagship.deposit_ledger.console.ConsoleIO;
import com.flagship.deposit_ledger.deposit.Amounts;
import com.flagship.deposit_ledger.deposit.DepositRule;
import com.flagship.deposit_ledger.deposit.exception.AmountTooLargeException;
import com.flagship.deposit_ledger.observability.DepositMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * In-memory ledger of depositor accounts.
 *
 * This service enforces the core invariants:
 * 1. Accounts are kept in registration order and never removed
 * 2. Lookup by ID is an exact match on the first account carrying that ID
 * 3. Balances only change through {@link Account#deposit}
 *
 * Access is single-threaded; the console loop is the only caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final AccountIdGenerator idGenerator;
    private final ConsoleIO console;
    private final DepositMetrics metrics;

    private final List<Account> accounts = new ArrayList<>();

    /**
     * Registers a depositor with a zero balance and announces the generated ID.
     *
     * @param name Depositor name, already validated as alphabetic
     * @param rule Deposit rule for the new account
     * @return The generated depositor ID
     */
    public String addDepositor(String name, DepositRule rule) {
        String depositorId = idGenerator.nextId();
        accounts.add(Account.open(depositorId, name, rule));
        metrics.recordDepositorCreated(rule);

        MDC.put("accountId", depositorId);
        try {
            log.info("Depositor registered: rule={}, accounts={}", rule, accounts.size());
        } finally {
            MDC.remove("accountId");
        }

        console.println("Depositor added successfully! User ID: " + depositorId);
        return depositorId;
    }

    /**
     * Deposits into the first account whose ID matches.
     *
     * A deposit refused by the FIXED rule ceiling is reported on the error stream
     * and leaves the balance unchanged; the account still counts as found.
     *
     * @param depositorId ID to look up
     * @param amount Deposit amount
     * @return true if an account with this ID exists, false otherwise
     * @throws com.flagship.deposit_ledger.deposit.exception.NegativeAmountException if amount is negative
     */
    public boolean depositToAccount(String depositorId, BigDecimal amount) {
        MDC.put("accountId", depositorId);
        try {
            for (int i = 0; i < accounts.size(); i++) {
                Account account = accounts.get(i);
                if (!account.hasId(depositorId)) {
                    continue;
                }
                try {
                    Account updated = account.deposit(amount);
                    accounts.set(i, updated);
                    metrics.recordDepositApplied(account.getRule());
                    log.info("Deposit applied: amount={}, rule={}, balance={}",
                            amount, account.getRule(), updated.getBalance());
                    console.println("Deposit of " + Amounts.format(amount) + " made to account ID: " + depositorId);
                } catch (AmountTooLargeException e) {
                    metrics.recordDepositRejected("amount_too_large");
                    log.warn("Deposit rejected: amount={}, reason={}", amount, e.getMessage());
                    console.error("Error: " + e.getMessage());
                }
                return true;
            }

            metrics.recordAccountNotFound();
            log.info("Deposit target not found");
            return false;
        } finally {
            MDC.remove("accountId");
        }
    }

    /**
     * Sums the current deposit of every account. Zero for an empty ledger.
     */
    public BigDecimal totalDeposits() {
        return accounts.stream()
                .map(Account::computeCurrentDeposit)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Lists depositors in registration order.
     */
    public List<DepositorView> listDepositors() {
        return accounts.stream()
                .map(DepositorView::fromAccount)
                .toList();
    }

    public int size() {
        return accounts.size();
    }
}
