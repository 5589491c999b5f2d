package com.flagship.collective_finance.account;

import lombok.Builder;
import lombok.Value;

/**
 * A new user and, optionally, an organization they will administer.
 */
@Value
@Builder
public class CreateUserCommand {
    String email;
    String name;
    String organizationName;
    String organizationWebsite;

    public boolean withOrganization() {
        return organizationName != null && !organizationName.isBlank();
    }
}
