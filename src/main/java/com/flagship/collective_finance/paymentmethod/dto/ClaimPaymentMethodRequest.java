package com.flagship.collective_finance.paymentmethod.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

/**
 * {@code email} and {@code name} are only read for anonymous callers.
 */
@Value
public class ClaimPaymentMethodRequest {

    @NotBlank(message = "Code is required")
    @JsonProperty("code")
    String code;

    @Email(message = "Email must be a valid address")
    @JsonProperty("email")
    String email;

    @JsonProperty("name")
    String name;
}
