package com.flagship.collective_finance.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class CreateUserRequest {

    @NotBlank(message = "Email is required")
    @Email(message = "Email must be a valid address")
    @JsonProperty("email")
    String email;

    @Size(max = 255)
    @JsonProperty("name")
    String name;

    @Size(max = 255)
    @JsonProperty("organization_name")
    String organizationName;

    @JsonProperty("organization_website")
    String organizationWebsite;
}
