package com.flagship.deposit_ledger.observability;

import com.flagship.deposit_ledger.deposit.DepositRule;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - depositors.created: Counter of registered depositors, tagged by rule
 * - deposits.applied: Counter of credited deposits, tagged by rule
 * - deposits.rejected: Counter of deposits refused by a rule or range check, tagged by reason
 * - deposits.account_not_found: Counter of deposits addressed to an unknown ID
 */
@Component
public class DepositMetrics {

    private final MeterRegistry registry;

    private final Counter accountNotFound;

    public DepositMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.accountNotFound = Counter.builder("deposits.account_not_found")
                .description("Number of deposits addressed to an unknown depositor ID")
                .register(registry);
    }

    public void recordDepositorCreated(DepositRule rule) {
        registry.counter("depositors.created", "rule", rule.name()).increment();
    }

    public void recordDepositApplied(DepositRule rule) {
        registry.counter("deposits.applied", "rule", rule.name()).increment();
    }

    public void recordDepositRejected(String reason) {
        registry.counter("deposits.rejected", "reason", sanitizeTag(reason)).increment();
    }

    public void recordAccountNotFound() {
        accountNotFound.increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
