package com.flagship.collective_finance.paymentmethod;

import lombok.Value;

/**
 * Identity supplied by an anonymous caller claiming a virtual card.
 */
@Value
public class ClaimingUser {
    String email;
    String name;
}
