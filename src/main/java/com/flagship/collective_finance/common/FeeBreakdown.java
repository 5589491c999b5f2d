package com.flagship.collective_finance.common;

import com.flagship.collective_finance.error.ValidationException;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fees withheld from a movement of funds. Null inputs count as zero.
 *
 * <p>Components are kept in cents; a value with sub-cent precision is
 * rejected as {@code invalid-amount} rather than rounded.
 */
@Value
public class FeeBreakdown {
    BigDecimal processorFee;
    BigDecimal hostFee;
    BigDecimal platformFee;

    private static final FeeBreakdown NONE = new FeeBreakdown(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);

    public static FeeBreakdown none() {
        return NONE;
    }

    public static FeeBreakdown of(BigDecimal processorFee, BigDecimal hostFee, BigDecimal platformFee) {
        return new FeeBreakdown(money(processorFee), money(hostFee), money(platformFee));
    }

    public BigDecimal total() {
        return processorFee.add(hostFee).add(platformFee);
    }

    public boolean hasNegativeComponent() {
        return processorFee.signum() < 0 || hostFee.signum() < 0 || platformFee.signum() < 0;
    }

    public FeeBreakdown negate() {
        return new FeeBreakdown(processorFee.negate(), hostFee.negate(), platformFee.negate());
    }

    private static BigDecimal money(BigDecimal value) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value.stripTrailingZeros().scale() > 2) {
            throw ValidationException.invalidAmount("Fee " + value.toPlainString() + " has more than two decimal places");
        }
        return value.setScale(2, RoundingMode.UNNECESSARY);
    }
}
