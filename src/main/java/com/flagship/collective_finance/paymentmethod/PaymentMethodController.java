package com.flagship.collective_finance.paymentmethod;

import com.flagship.collective_finance.auth.Principal;
import com.flagship.collective_finance.common.CurrencyCode;
import com.flagship.collective_finance.paymentmethod.dto.ClaimPaymentMethodRequest;
import com.flagship.collective_finance.paymentmethod.dto.CreateCreditCardRequest;
import com.flagship.collective_finance.paymentmethod.dto.CreatePaymentMethodRequest;
import com.flagship.collective_finance.paymentmethod.dto.CreateVirtualCardsRequest;
import com.flagship.collective_finance.paymentmethod.dto.PaymentMethodResponse;
import com.flagship.collective_finance.paymentmethod.dto.UpdatePaymentMethodRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class PaymentMethodController {

    private final PaymentMethodService paymentMethodService;
    private final VirtualCardService virtualCardService;

    @PostMapping("/payment-methods")
    public ResponseEntity<PaymentMethodResponse> createPaymentMethod(
            @Valid @RequestBody CreatePaymentMethodRequest request, Principal principal) {
        PaymentMethodEntity paymentMethod = paymentMethodService.createPaymentMethod(CreatePaymentMethodCommand.builder()
                .accountId(request.getAccountId())
                .name(request.getName())
                .description(request.getDescription())
                .type(request.getType())
                .provider(request.getProvider())
                .currency(CurrencyCode.parse(request.getCurrency()))
                .token(request.getToken())
                .data(request.getData())
                .initialBalance(request.getInitialBalance())
                .monthlyLimitPerMember(request.getMonthlyLimitPerMember())
                .limitedToTags(request.getLimitedToTags())
                .limitedToCollectiveIds(request.getLimitedToCollectiveIds())
                .limitedToHostCollectiveIds(request.getLimitedToHostCollectiveIds())
                .expiryDate(request.getExpiryDate())
                .parentPaymentMethodId(request.getParentPaymentMethodId())
                .build(), principal);
        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentMethodResponse.from(paymentMethod));
    }

    @PostMapping("/credit-cards")
    public ResponseEntity<PaymentMethodResponse> createCreditCard(
            @Valid @RequestBody CreateCreditCardRequest request, Principal principal) {
        PaymentMethodEntity card = paymentMethodService.createCreditCard(CreateCreditCardCommand.builder()
                .accountId(request.getCollectiveId())
                .name(request.getName())
                .token(request.getToken())
                .data(request.getData())
                .monthlyLimitPerMember(request.getMonthlyLimitPerMember())
                .build(), principal);
        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentMethodResponse.from(card));
    }

    @PostMapping("/virtual-cards")
    public ResponseEntity<List<PaymentMethodResponse>> createVirtualCards(
            @Valid @RequestBody CreateVirtualCardsRequest request, Principal principal) {
        List<PaymentMethodEntity> cards = virtualCardService.createVirtualCards(CreateVirtualCardsCommand.builder()
                .accountId(request.getCollectiveId())
                .paymentMethodId(request.getPaymentMethodId())
                .emails(request.getEmails())
                .numberOfVirtualCards(request.getNumberOfVirtualCards())
                .currency(request.getCurrency() == null ? null : CurrencyCode.parse(request.getCurrency()))
                .amount(request.getAmount())
                .monthlyLimitPerMember(request.getMonthlyLimitPerMember())
                .limitedToTags(request.getLimitedToTags())
                .limitedToCollectiveIds(request.getLimitedToCollectiveIds())
                .limitedToHostCollectiveIds(request.getLimitedToHostCollectiveIds())
                .limitedToOpenSourceCollectives(Boolean.TRUE.equals(request.getLimitedToOpenSourceCollectives()))
                .description(request.getDescription())
                .customMessage(request.getCustomMessage())
                .expiryDate(request.getExpiryDate())
                .build(), principal);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(cards.stream().map(PaymentMethodResponse::from).collect(Collectors.toList()));
    }

    @PostMapping("/payment-methods/claim")
    public PaymentMethodResponse claimPaymentMethod(@Valid @RequestBody ClaimPaymentMethodRequest request,
                                                    Principal principal) {
        ClaimingUser user = request.getEmail() == null ? null : new ClaimingUser(request.getEmail(), request.getName());
        return PaymentMethodResponse.from(paymentMethodService.claimPaymentMethod(request.getCode(), user, principal));
    }

    @PatchMapping("/payment-methods/{id}")
    public PaymentMethodResponse updatePaymentMethod(@PathVariable("id") UUID id,
                                                     @Valid @RequestBody UpdatePaymentMethodRequest request,
                                                     Principal principal) {
        return PaymentMethodResponse.from(paymentMethodService.updatePaymentMethod(principal, id,
                request.getName(), request.getMonthlyLimitPerMember()));
    }

    @DeleteMapping("/payment-methods/{id}")
    public PaymentMethodResponse removePaymentMethod(@PathVariable("id") UUID id, Principal principal) {
        return PaymentMethodResponse.from(paymentMethodService.removePaymentMethod(principal, id));
    }
}
