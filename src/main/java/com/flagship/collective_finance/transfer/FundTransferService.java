package com.flagship.collective_finance.transfer;

import com.flagship.collective_finance.account.AccountEntity;
import com.flagship.collective_finance.account.AccountService;
import com.flagship.collective_finance.auth.Action;
import com.flagship.collective_finance.auth.AuthorizationGuard;
import com.flagship.collective_finance.auth.AuthorizationTarget;
import com.flagship.collective_finance.auth.Principal;
import com.flagship.collective_finance.error.InsufficientFundsException;
import com.flagship.collective_finance.error.ValidationException;
import com.flagship.collective_finance.ledger.LedgerService;
import com.flagship.collective_finance.ledger.TransactionRequest;
import com.flagship.collective_finance.ledger.TransactionType;
import com.flagship.collective_finance.observability.MutationMetrics;
import com.flagship.collective_finance.paymentmethod.NewPaymentMethod;
import com.flagship.collective_finance.paymentmethod.PaymentMethodEntity;
import com.flagship.collective_finance.paymentmethod.PaymentMethodRepository;
import com.flagship.collective_finance.paymentmethod.PaymentMethodType;
import com.flagship.collective_finance.paymentmethod.PaymentProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Moves money from a host's managed pool to an account it sponsors.
 *
 * <p>The transferred amount becomes spendable through a MANUAL allocation
 * owned by the receiving account and limited to the funding host. The
 * ledger gets two FUND_TRANSFER legs sharing one transaction group, so the
 * transfer nets to zero across the two accounts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FundTransferService {

    private final AccountService accountService;
    private final PaymentMethodRepository paymentMethodRepository;
    private final LedgerService ledgerService;
    private final AuthorizationGuard guard;
    private final MutationMetrics metrics;

    /**
     * @return the allocation holding the transferred funds
     * @throws InsufficientFundsException when the host balance does not cover the amount
     */
    @Transactional
    public PaymentMethodEntity addFundsToOrg(AddFundsCommand command, Principal principal) {
        long startTime = System.currentTimeMillis();
        guard.require(principal, Action.ADD_FUNDS_TO_ORG, AuthorizationTarget.account(command.getHostCollectiveId()));

        try {
            BigDecimal total = command.getTotalAmount();
            if (total == null || total.signum() <= 0) {
                throw ValidationException.invalidAmount("totalAmount must be greater than 0");
            }
            AccountEntity host = accountService.getRequired(command.getHostCollectiveId());
            if (!host.isHost()) {
                throw new ValidationException("Account " + host.getSlug() + " is not a host");
            }
            AccountEntity organization = accountService.getRequired(command.getCollectiveId());
            if (organization.getId().equals(host.getId())) {
                throw new ValidationException("A host cannot transfer funds to itself");
            }
            if (organization.getCurrency() != host.getCurrency()) {
                throw new ValidationException(String.format("Cannot transfer %s funds to %s, which uses %s",
                        host.getCurrency(), organization.getSlug(), organization.getCurrency()));
            }

            accountService.lockForDebit(host.getId());
            BigDecimal hostBalance = ledgerService.balanceOf(host.getId());
            if (hostBalance.compareTo(total) < 0) {
                throw new InsufficientFundsException(host.getId(), hostBalance, total);
            }

            PaymentMethodEntity allocation = allocationFor(organization, host, total, command.getDescription(), principal);

            String description = command.getDescription() != null
                    ? command.getDescription()
                    : "Funds from " + host.getName() + " to " + organization.getName();
            UUID group = UUID.randomUUID();
            ledgerService.recordAll(List.of(
                    transferLeg(organization.getId(), host.getId(), total, allocation, group, description, principal),
                    transferLeg(host.getId(), organization.getId(), total.negate(), allocation, group, description, principal)));

            metrics.recordOutcome("add_funds_to_org", "success", System.currentTimeMillis() - startTime);
            log.info("Funds added: host={}, organization={}, amount={} {}, paymentMethodId={}, transactionGroup={}",
                    host.getId(), organization.getId(), total, host.getCurrency(), allocation.getId(), group);
            return allocation;

        } catch (RuntimeException e) {
            metrics.recordOutcome("add_funds_to_org", "error", System.currentTimeMillis() - startTime);
            log.warn("Fund transfer failed: host={}, organization={}, error={}",
                    command.getHostCollectiveId(), command.getCollectiveId(), e.getMessage());
            throw e;
        }
    }

    private PaymentMethodEntity allocationFor(AccountEntity organization, AccountEntity host, BigDecimal total,
                                              String description, Principal principal) {
        return paymentMethodRepository.findActiveManualAllocations(organization.getId()).stream()
                .filter(pm -> pm.getLimitedToHostCollectiveIds() != null
                        && pm.getLimitedToHostCollectiveIds().contains(host.getId()))
                .findFirst()
                .map(existing -> {
                    existing.topUp(total);
                    return paymentMethodRepository.save(existing);
                })
                .orElseGet(() -> paymentMethodRepository.save(PaymentMethodEntity.from(NewPaymentMethod.builder()
                        .name(host.getName() + " allocation")
                        .description(description)
                        .type(PaymentMethodType.MANUAL)
                        .provider(PaymentProvider.INTERNAL)
                        .currency(host.getCurrency())
                        .accountId(organization.getId())
                        .initialBalance(total)
                        .limitedToHostCollectiveIds(List.of(host.getId()))
                        .createdByUserId(principal.getUserAccountId())
                        .build())));
    }

    private static TransactionRequest transferLeg(UUID accountId, UUID counterpartyId, BigDecimal amount,
                                                  PaymentMethodEntity allocation, UUID group, String description,
                                                  Principal principal) {
        return TransactionRequest.builder()
                .type(TransactionType.FUND_TRANSFER)
                .accountId(accountId)
                .counterpartyAccountId(counterpartyId)
                .amount(amount)
                .currency(allocation.getCurrency())
                .paymentMethodId(allocation.getId())
                .transactionGroup(group)
                .description(description)
                .createdByUserId(principal.getUserAccountId())
                .build();
    }
}
