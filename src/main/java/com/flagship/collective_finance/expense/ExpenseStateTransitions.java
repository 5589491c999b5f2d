package com.flagship.collective_finance.expense;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * The one table of legal expense transitions.
 *
 * PENDING  -> APPROVED, REJECTED
 * APPROVED -> PAID
 * REJECTED, PAID -> (terminal)
 */
public final class ExpenseStateTransitions {

    private static final Map<ExpenseStatus, Set<ExpenseStatus>> ALLOWED = new EnumMap<>(ExpenseStatus.class);

    static {
        ALLOWED.put(ExpenseStatus.PENDING, EnumSet.of(ExpenseStatus.APPROVED, ExpenseStatus.REJECTED));
        ALLOWED.put(ExpenseStatus.APPROVED, EnumSet.of(ExpenseStatus.PAID));
        ALLOWED.put(ExpenseStatus.REJECTED, EnumSet.noneOf(ExpenseStatus.class));
        ALLOWED.put(ExpenseStatus.PAID, EnumSet.noneOf(ExpenseStatus.class));
    }

    private ExpenseStateTransitions() {
    }

    public static boolean isAllowed(ExpenseStatus from, ExpenseStatus to) {
        return from != null && to != null && ALLOWED.get(from).contains(to);
    }
}
