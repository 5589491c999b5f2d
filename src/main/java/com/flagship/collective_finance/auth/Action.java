package com.flagship.collective_finance.auth;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum Action {
    CREATE_USER(ActionKind.PUBLIC),

    CREATE_ORDER(ActionKind.OWN_ACCOUNT),
    COMPLETE_PLEDGE(ActionKind.OWN_ACCOUNT),
    MARK_ORDER_PAID(ActionKind.HOST_ADMIN),
    UPDATE_ORDER_INFO(ActionKind.OWN_ACCOUNT),
    CANCEL_SUBSCRIPTION(ActionKind.OWN_ACCOUNT),
    UPDATE_SUBSCRIPTION(ActionKind.OWN_ACCOUNT),

    CREATE_EXPENSE(ActionKind.AUTHENTICATED),
    EDIT_EXPENSE(ActionKind.OWN_ACCOUNT),
    DELETE_EXPENSE(ActionKind.OWN_ACCOUNT),
    APPROVE_EXPENSE(ActionKind.ACCOUNT_OR_HOST_ADMIN),
    REJECT_EXPENSE(ActionKind.ACCOUNT_OR_HOST_ADMIN),
    PAY_EXPENSE(ActionKind.HOST_ADMIN),

    REFUND_TRANSACTION(ActionKind.EITHER_PARTY_ADMIN),
    ADD_FUNDS_TO_ORG(ActionKind.HOST_ADMIN),

    CREATE_PAYMENT_METHOD(ActionKind.OWN_ACCOUNT),
    CREATE_CREDIT_CARD(ActionKind.OWN_ACCOUNT),
    CREATE_VIRTUAL_CARDS(ActionKind.OWN_ACCOUNT),
    CLAIM_PAYMENT_METHOD(ActionKind.PUBLIC),
    UPDATE_PAYMENT_METHOD(ActionKind.OWN_ACCOUNT),
    REMOVE_PAYMENT_METHOD(ActionKind.OWN_ACCOUNT);

    private final ActionKind kind;
}
