package com.flagship.collective_finance.ledger;

import com.flagship.collective_finance.auth.Principal;
import com.flagship.collective_finance.ledger.dto.TransactionResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
public class TransactionController {

    private final RefundService refundService;

    /**
     * Reverses a transaction. Returns the new REFUND transaction; the
     * original is left untouched.
     */
    @PostMapping("/{id}/refund")
    public ResponseEntity<TransactionResponse> refundTransaction(@PathVariable("id") UUID id, Principal principal) {
        LedgerTransactionEntity refund = refundService.refundTransaction(principal, id);
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(refund));
    }
}
