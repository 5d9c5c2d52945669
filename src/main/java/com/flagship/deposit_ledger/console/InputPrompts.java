package com.flagship.deposit_ledger.console;

import com.flagship.deposit_ledger.deposit.DepositRule;
import com.flagship.deposit_ledger.validation.InputValidation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Prompts that keep asking until the input is valid.
 *
 * There is no retry limit and no way back to the menu from inside a prompt.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InputPrompts {

    private final ConsoleIO console;

    public String readDepositorName() {
        while (true) {
            console.prompt("Enter depositor name (letters only): ");
            String name = console.requireToken();
            if (InputValidation.isAlphabeticName(name)) {
                return name;
            }
            log.debug("Rejected depositor name input");
            console.error("Invalid name. Only letters are allowed. Please try again.");
        }
    }

    public DepositRule readDepositRule() {
        while (true) {
            console.prompt("Choose deposit strategy " + DepositRule.menuOptions() + ": ");
            Optional<DepositRule> rule = DepositRule.fromMenuChoice(console.requireToken());
            if (rule.isPresent()) {
                return rule.get();
            }
            console.error("Invalid strategy choice. Please try again.");
        }
    }

    public String readDepositorId() {
        console.prompt("Enter depositor ID to deposit to: ");
        return console.requireToken();
    }

    public BigDecimal readDepositAmount() {
        while (true) {
            console.prompt("Enter deposit amount: ");
            Optional<BigDecimal> amount = InputValidation.parseNumeric(console.requireToken());
            if (amount.isEmpty()) {
                console.error("Invalid amount. Please enter a numeric value.");
            } else if (amount.get().signum() < 0) {
                console.error("Amount cannot be negative. Please try again.");
            } else {
                return amount.get();
            }
        }
    }
}
