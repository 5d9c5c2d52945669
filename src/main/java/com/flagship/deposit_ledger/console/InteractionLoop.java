package com.flagship.deposit_ledger.console;

import com.flagship.deposit_ledger.deposit.Amounts;
import com.flagship.deposit_ledger.deposit.DepositRule;
import com.flagship.deposit_ledger.deposit.exception.DepositException;
import com.flagship.deposit_ledger.ledger.DepositorView;
import com.flagship.deposit_ledger.ledger.LedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Menu-driven console session over the ledger.
 *
 * The loop returns to the menu after every command except EXIT. Errors raised by
 * a command are reported and the session continues. End of input ends the
 * session the same way EXIT does, without the farewell line.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InteractionLoop {

    static final String COMMAND_MDC_KEY = "command";

    private final ConsoleIO console;
    private final InputPrompts prompts;
    private final LedgerService ledgerService;

    /**
     * Runs the session until EXIT is chosen or input ends.
     */
    public void run() {
        log.info("Console session started");
        while (true) {
            printMenu();
            Optional<String> choice = console.readToken();
            if (choice.isEmpty()) {
                log.warn("Console input closed, ending session");
                return;
            }

            Optional<MenuCommand> command = MenuCommand.fromChoice(choice.get());
            if (command.isEmpty()) {
                console.error("Invalid choice. Please try again.");
                continue;
            }

            try {
                dispatch(command.get());
            } catch (InputClosedException e) {
                log.warn("Console input closed during {}, ending session", command.get());
                return;
            }
            if (command.get() == MenuCommand.EXIT) {
                log.info("Console session ended by user");
                return;
            }
        }
    }

    private void dispatch(MenuCommand command) {
        MDC.put(COMMAND_MDC_KEY, command.name());
        try {
            switch (command) {
                case ADD_DEPOSITOR -> addDepositor();
                case LIST_DEPOSITORS -> listDepositors();
                case VIEW_TOTAL -> viewTotal();
                case DEPOSIT -> deposit();
                case EXIT -> console.println("Exiting program.");
            }
        } catch (DepositException e) {
            log.warn("Command failed: {}", e.getMessage());
            console.error("Error: " + e.getMessage());
        } catch (InputClosedException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Command failed unexpectedly", e);
            console.error("Error: " + e.getMessage());
        } finally {
            MDC.remove(COMMAND_MDC_KEY);
        }
    }

    private void printMenu() {
        console.println("");
        console.println("Select an option:");
        for (MenuCommand command : MenuCommand.values()) {
            console.println(command.getChoice() + ". " + command.getTitle());
        }
        console.prompt("Enter your choice: ");
    }

    private void addDepositor() {
        String name = prompts.readDepositorName();
        DepositRule rule = prompts.readDepositRule();
        ledgerService.addDepositor(name, rule);
    }

    private void listDepositors() {
        List<DepositorView> depositors = ledgerService.listDepositors();
        if (depositors.isEmpty()) {
            console.println("No depositors were added.");
            return;
        }

        console.println("");
        console.println("List of depositors:");
        for (DepositorView depositor : depositors) {
            console.println(String.format("Depositor ID: %s, Name: %s, Deposit Amount: %s",
                    depositor.getId(), depositor.getName(), Amounts.format(depositor.getDepositAmount())));
        }
    }

    private void viewTotal() {
        BigDecimal total = ledgerService.totalDeposits();
        if (total.signum() == 0) {
            console.println("No deposits have been made yet.");
        } else {
            console.println("Total deposits: " + Amounts.format(total));
        }
    }

    private void deposit() {
        String depositorId = prompts.readDepositorId();
        BigDecimal amount = prompts.readDepositAmount();
        if (!ledgerService.depositToAccount(depositorId, amount)) {
            console.error("No depositor found with the ID: " + depositorId);
        }
    }
}
