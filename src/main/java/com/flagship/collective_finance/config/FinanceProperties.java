package com.flagship.collective_finance.config;

import com.flagship.collective_finance.common.CurrencyCode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.UUID;

/**
 * Deployment-specific settings for the financial mutation layer.
 *
 * <p>Bound from the {@code finance} prefix in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "finance")
public class FinanceProperties {

    /**
     * Host account that sponsors open-source collectives. Virtual cards
     * restricted to open-source collectives are limited to this host.
     */
    private UUID openSourceHostId;

    /**
     * Account whose administrators are platform administrators.
     */
    private UUID platformAccountId;

    /**
     * Currency of accounts created without one, such as new users.
     */
    private CurrencyCode defaultCurrency = CurrencyCode.USD;

    private VirtualCards virtualCards = new VirtualCards();

    private Processor processor = new Processor();

    @Data
    public static class VirtualCards {
        /** Largest batch a single createVirtualCards call may mint. */
        private int maxBatchSize = 100;
        /** Expiry applied to cards issued without an explicit expiry date. */
        private int defaultExpiryMonths = 24;
    }

    @Data
    public static class Processor {
        /** "sandbox" selects the built-in deterministic processor client. */
        private String mode = "sandbox";
    }
}
