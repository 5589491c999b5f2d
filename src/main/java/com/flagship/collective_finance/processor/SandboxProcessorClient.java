package com.flagship.collective_finance.processor;

import com.flagship.collective_finance.common.CurrencyCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.UUID;

/**
 * Deterministic processor client for local development and tests.
 *
 * <p>Tokens starting with {@code tok_declined} are rejected at registration.
 * Tokens starting with {@code tok_chargeDeclined} register fine, but the
 * customer they yield is rejected at charge time. Everything else succeeds.
 */
@Component
@ConditionalOnProperty(name = "finance.processor.mode", havingValue = "sandbox", matchIfMissing = true)
@Slf4j
public class SandboxProcessorClient implements ExternalProcessorClient {

    static final String DECLINED_MARKER = "declined";
    static final String CHARGE_DECLINED_TOKEN_PREFIX = "tok_chargeDeclined";

    @Override
    public String registerCard(String token, Map<String, Object> data) {
        if (token.startsWith("tok_" + DECLINED_MARKER)) {
            throw new ProcessorRejectedException("Card token was declined");
        }
        String reference = UUID.nameUUIDFromBytes(token.getBytes(StandardCharsets.UTF_8)).toString().substring(0, 12);
        return token.startsWith(CHARGE_DECLINED_TOKEN_PREFIX)
                ? "cus_sandbox_" + DECLINED_MARKER + "_" + reference
                : "cus_sandbox_" + reference;
    }

    @Override
    public String charge(String customerId, BigDecimal amount, CurrencyCode currency, String description) {
        if (customerId.contains(DECLINED_MARKER)) {
            throw new ProcessorRejectedException("Your card was declined");
        }
        String chargeId = "ch_sandbox_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
        log.debug("Sandbox charge {}: {} {} for {}", chargeId, amount, currency, customerId);
        return chargeId;
    }

    @Override
    public void refund(String chargeId, BigDecimal amount, CurrencyCode currency) {
        log.debug("Sandbox refund of {}: {} {}", chargeId, amount, currency);
    }
}
