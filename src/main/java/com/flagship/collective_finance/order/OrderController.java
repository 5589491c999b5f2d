package com.flagship.collective_finance.order;

import com.flagship.collective_finance.auth.Principal;
import com.flagship.collective_finance.common.CurrencyCode;
import com.flagship.collective_finance.order.dto.CompletePledgeRequest;
import com.flagship.collective_finance.order.dto.CreateOrderRequest;
import com.flagship.collective_finance.order.dto.OrderResponse;
import com.flagship.collective_finance.order.dto.SubscriptionResponse;
import com.flagship.collective_finance.order.dto.UpdateOrderInfoRequest;
import com.flagship.collective_finance.order.dto.UpdateSubscriptionRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Contributions and the subscriptions behind recurring ones. Subscriptions
 * are addressed through the order that created them.
 */
@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;

    @PostMapping
    public ResponseEntity<OrderResponse> createOrder(@Valid @RequestBody CreateOrderRequest request,
                                                     Principal principal,
                                                     HttpServletRequest httpRequest) {
        OrderEntity order = orderService.createOrder(CreateOrderCommand.builder()
                .sourceAccountId(request.getFromAccountId())
                .destinationAccountId(request.getToAccountId())
                .amount(request.getAmount())
                .currency(request.getCurrency() == null ? null : CurrencyCode.parse(request.getCurrency()))
                .interval(request.getInterval())
                .paymentMethodId(request.getPaymentMethodId())
                .publicMessage(request.getPublicMessage())
                .description(request.getDescription())
                .build(), principal, httpRequest.getRemoteAddr());
        return ResponseEntity.status(HttpStatus.CREATED).body(OrderResponse.from(order));
    }

    @PostMapping("/{id}/complete-pledge")
    public OrderResponse completePledge(@PathVariable("id") UUID id,
                                        @Valid @RequestBody CompletePledgeRequest request,
                                        Principal principal) {
        return OrderResponse.from(orderService.completePledge(principal, id, request.getPaymentMethodId()));
    }

    @PostMapping("/{id}/mark-paid")
    public OrderResponse markOrderAsPaid(@PathVariable("id") UUID id, Principal principal) {
        return OrderResponse.from(orderService.markOrderAsPaid(principal, id));
    }

    @PatchMapping("/{id}/info")
    public OrderResponse updateOrderInfo(@PathVariable("id") UUID id,
                                         @Valid @RequestBody UpdateOrderInfoRequest request,
                                         Principal principal) {
        return OrderResponse.from(orderService.updateOrderInfo(principal, id, request.getPublicMessage()));
    }

    @PostMapping("/{id}/cancel-subscription")
    public SubscriptionResponse cancelSubscription(@PathVariable("id") UUID id, Principal principal) {
        return SubscriptionResponse.from(orderService.cancelSubscription(principal, id));
    }

    @PatchMapping("/{id}/subscription")
    public SubscriptionResponse updateSubscription(@PathVariable("id") UUID id,
                                                   @Valid @RequestBody UpdateSubscriptionRequest request,
                                                   Principal principal) {
        return SubscriptionResponse.from(orderService.updateSubscription(principal, UpdateSubscriptionCommand.builder()
                .orderId(id)
                .paymentMethodId(request.getPaymentMethodId())
                .amount(request.getAmount())
                .build()));
    }

    @GetMapping("/{id}/subscription")
    public SubscriptionResponse getSubscription(@PathVariable("id") UUID id) {
        return SubscriptionResponse.from(orderService.findSubscription(id));
    }
}
