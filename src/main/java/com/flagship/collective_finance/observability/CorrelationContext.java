package com.flagship.collective_finance.observability;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys used across the mutation
 * layer, so every log line of one request can be grepped together.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String USER_ID_MDC_KEY = "userId";
    public static final String ORDER_ID_MDC_KEY = "orderId";
    public static final String EXPENSE_ID_MDC_KEY = "expenseId";
    public static final String TRANSACTION_ID_MDC_KEY = "transactionId";
    public static final String PAYMENT_METHOD_ID_MDC_KEY = "paymentMethodId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        correlationId.set(id != null && !id.isBlank() ? id : generateCorrelationId());
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form, readable in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
