package com.flagship.collective_finance.order.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class UpdateOrderInfoRequest {

    @Size(max = 255)
    @JsonProperty("public_message")
    String publicMessage;
}
