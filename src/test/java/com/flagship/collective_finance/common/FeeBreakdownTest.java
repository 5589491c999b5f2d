package com.flagship.collective_finance.common;

import com.flagship.collective_finance.error.ErrorCode;
import com.flagship.collective_finance.error.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeeBreakdownTest {

    @Test
    @DisplayName("Components are normalized to cents and nulls count as zero")
    void of_CentValues_NormalizedToScaleTwo() {
        FeeBreakdown fees = FeeBreakdown.of(new BigDecimal("1.5"), null, new BigDecimal("0.250"));

        assertThat(fees.getProcessorFee()).isEqualTo(new BigDecimal("1.50"));
        assertThat(fees.getHostFee()).isEqualTo(new BigDecimal("0.00"));
        assertThat(fees.getPlatformFee()).isEqualTo(new BigDecimal("0.25"));
        assertThat(fees.total()).isEqualByComparingTo("1.75");
    }

    @Test
    @DisplayName("A fee with sub-cent precision is rejected instead of rounded")
    void of_SubCentFee_ThrowsInvalidAmount() {
        assertThatThrownBy(() -> FeeBreakdown.of(new BigDecimal("0.005"), null, null))
                .isInstanceOf(ValidationException.class)
                .extracting(e -> ((ValidationException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_AMOUNT);
    }
}
