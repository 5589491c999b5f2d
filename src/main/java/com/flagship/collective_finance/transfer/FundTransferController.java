package com.flagship.collective_finance.transfer;

import com.flagship.collective_finance.auth.Principal;
import com.flagship.collective_finance.paymentmethod.PaymentMethodEntity;
import com.flagship.collective_finance.paymentmethod.dto.PaymentMethodResponse;
import com.flagship.collective_finance.transfer.dto.AddFundsRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/fund-transfers")
@RequiredArgsConstructor
public class FundTransferController {

    private final FundTransferService fundTransferService;

    /**
     * Allocates host funds to an organization and returns the payment
     * method that holds them.
     */
    @PostMapping
    public ResponseEntity<PaymentMethodResponse> addFundsToOrg(@Valid @RequestBody AddFundsRequest request,
                                                               Principal principal) {
        PaymentMethodEntity allocation = fundTransferService.addFundsToOrg(AddFundsCommand.builder()
                .totalAmount(request.getTotalAmount())
                .collectiveId(request.getCollectiveId())
                .hostCollectiveId(request.getHostCollectiveId())
                .description(request.getDescription())
                .build(), principal);
        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentMethodResponse.from(allocation));
    }
}
