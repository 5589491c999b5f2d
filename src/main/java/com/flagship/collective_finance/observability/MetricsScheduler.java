package com.flagship.collective_finance.observability;

import com.flagship.collective_finance.expense.ExpenseRepository;
import com.flagship.collective_finance.expense.ExpenseStatus;
import com.flagship.collective_finance.order.OrderRepository;
import com.flagship.collective_finance.order.OrderStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes the cached values behind the backlog gauges: undelivered
 * notifications, approved expenses waiting for a host to pay them, and
 * pledges nobody has paid yet.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final MutationMetrics mutationMetrics;
    private final ExpenseRepository expenseRepository;
    private final OrderRepository orderRepository;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refresh() {
        outboxMetrics.refreshMetrics();
        try {
            mutationMetrics.updateBacklog(
                    expenseRepository.countByStatus(ExpenseStatus.APPROVED),
                    orderRepository.countByStatusAndPaymentMethodIdIsNull(OrderStatus.PENDING));
        } catch (DataAccessException e) {
            log.warn("Failed to refresh mutation backlog gauges: {}", e.getMessage());
        }
    }
}
