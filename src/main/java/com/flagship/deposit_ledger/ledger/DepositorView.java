package com.flagship.deposit_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Read-only row of the depositor listing.
 */
@Value
public class DepositorView {
    String id;
    String name;
    BigDecimal depositAmount;

    public static DepositorView fromAccount(Account account) {
        return new DepositorView(account.getId(), account.getName(), account.computeCurrentDeposit());
    }
}
