package com.flagship.deposit_ledger.console;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Starts the console session once the application context is ready.
 * Disabled with {@code ledger.console.enabled=false}.
 */
@Component
@ConditionalOnProperty(name = "ledger.console.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class ConsoleRunner implements CommandLineRunner {

    private final InteractionLoop interactionLoop;

    @Override
    public void run(String... args) {
        interactionLoop.run();
    }
}
