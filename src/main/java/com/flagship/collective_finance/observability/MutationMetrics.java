package com.flagship.collective_finance.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer meters for the financial mutations.
 *
 * <ul>
 *   <li>{@code mutations.total} tagged by operation and outcome</li>
 *   <li>{@code mutations.latency} tagged by operation</li>
 *   <li>{@code mutations.denied} tagged by action and deny reason</li>
 *   <li>{@code ledger.transactions.recorded} tagged by transaction type and currency</li>
 *   <li>{@code expenses.awaiting_payment} and {@code orders.open_pledges} gauges,
 *       refreshed by {@link MetricsScheduler}</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class MutationMetrics {

    private final MeterRegistry registry;

    private final AtomicLong expensesAwaitingPayment = new AtomicLong(0);
    private final AtomicLong openPledges = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("expenses.awaiting_payment", expensesAwaitingPayment, AtomicLong::get)
                .description("Approved expenses not yet paid by the host")
                .register(registry);
        Gauge.builder("orders.open_pledges", openPledges, AtomicLong::get)
                .description("Pending orders without a payment method")
                .register(registry);
    }

    public void recordOutcome(String operation, String outcome, long durationMs) {
        registry.counter("mutations.total",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
        registry.timer("mutations.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordDenied(String action, String reason) {
        registry.counter("mutations.denied",
                "action", sanitizeTag(action),
                "reason", sanitizeTag(reason)
        ).increment();
    }

    public void recordTransaction(String type, String currency) {
        registry.counter("ledger.transactions.recorded",
                "type", sanitizeTag(type),
                "currency", sanitizeTag(currency)
        ).increment();
    }

    public void recordVirtualCardsIssued(int count) {
        registry.counter("payment_methods.virtual_cards.issued").increment(count);
    }

    void updateBacklog(long approvedExpenses, long pendingPledges) {
        expensesAwaitingPayment.set(approvedExpenses);
        openPledges.set(pendingPledges);
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
