package com.flagship.deposit_ledger.console;

import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Scanner;

/**
 * Console streams shared by the ledger and the interaction loop.
 *
 * Input is consumed as whitespace-delimited tokens. Normal output goes to
 * {@code out}, error reports to {@code err}.
 */
public class ConsoleIO {

    private final Scanner scanner;
    private final PrintStream out;
    private final PrintStream err;

    public ConsoleIO(InputStream in, PrintStream out, PrintStream err) {
        this.scanner = new Scanner(in, StandardCharsets.UTF_8);
        this.out = out;
        this.err = err;
    }

    /**
     * Prints a prompt without a line break.
     */
    public void prompt(String text) {
        out.print(text);
        out.flush();
    }

    public void println(String line) {
        out.println(line);
    }

    public void error(String line) {
        err.println(line);
    }

    /**
     * Reads the next token, or empty once the input is exhausted.
     */
    public Optional<String> readToken() {
        try {
            return Optional.of(scanner.next());
        } catch (NoSuchElementException e) {
            return Optional.empty();
        }
    }

    /**
     * Reads the next token.
     *
     * @throws InputClosedException if the input is exhausted
     */
    public String requireToken() {
        return readToken().orElseThrow(InputClosedException::new);
    }
}
