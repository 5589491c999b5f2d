package com.flagship.collective_finance.common;

import java.util.Locale;

/**
 * ISO-4217 currencies accepted by accounts, orders and payment methods.
 *
 * Stored as the enum name so the database never holds an unknown code.
 */
public enum CurrencyCode {
    USD,
    EUR,
    GBP,
    CAD,
    AUD,
    INR,
    JPY,
    MXN;

    /**
     * Parses a currency code case-insensitively.
     *
     * @throws IllegalArgumentException if the code is blank or not supported
     */
    public static CurrencyCode parse(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Currency is required");
        }
        try {
            return CurrencyCode.valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported currency code: " + code);
        }
    }
}
