package com.flagship.collective_finance.processor;

import com.flagship.collective_finance.common.CurrencyCode;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Client for the third-party card processor.
 *
 * All methods throw {@link ProcessorRejectedException} on a decline.
 */
public interface ExternalProcessorClient {

    /**
     * Exchanges a single-use card token for a reusable customer reference.
     */
    String registerCard(String token, Map<String, Object> data);

    String charge(String customerId, BigDecimal amount, CurrencyCode currency, String description);

    void refund(String chargeId, BigDecimal amount, CurrencyCode currency);
}
