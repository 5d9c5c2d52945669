package com.flagship.deposit_ledger.console;

import java.util.Arrays;
import java.util.Optional;

/**
 * Main menu entries, in display order.
 */
public enum MenuCommand {
    ADD_DEPOSITOR("1", "Add Depositor"),
    LIST_DEPOSITORS("2", "List Depositors"),
    VIEW_TOTAL("3", "View Total Deposits"),
    DEPOSIT("4", "Deposit Amount"),
    EXIT("5", "Exit");

    private final String choice;
    private final String title;

    MenuCommand(String choice, String title) {
        this.choice = choice;
        this.title = title;
    }

    public String getChoice() {
        return choice;
    }

    public String getTitle() {
        return title;
    }

    public static Optional<MenuCommand> fromChoice(String input) {
        return Arrays.stream(values())
                .filter(command -> command.choice.equals(input))
                .findFirst();
    }
}
