package com.flagship.collective_finance.account;

/**
 * Role a member account holds on another account.
 */
public enum Role {
    ADMIN,
    HOST,
    BACKER,
    MEMBER
}
