package com.flagship.deposit_ledger.config;

import com.flagship.deposit_ledger.console.ConsoleIO;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Binds the console to the process streams.
 */
@Configuration
public class ConsoleConfig {

    @Bean
    public ConsoleIO consoleIO() {
        return new ConsoleIO(System.in, System.out, System.err);
    }
}
