package com.flagship.collective_finance.paymentmethod;

public enum PaymentMethodType {
    CREDIT_CARD,
    MANUAL,
    VIRTUAL_CARD,
    OTHER
}
