package com.flagship.collective_finance.notification;

import com.flagship.collective_finance.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Hands notifications to the email sink through the outbox.
 *
 * <p>Notifications are queued in the caller's unit of work and only leave
 * the service after it commits, so a rolled-back mutation never invites or
 * welcomes anyone. Delivery problems are the outbox publisher's concern and
 * never surface here.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationDispatcher {

    public static final String AGGREGATE_TYPE = "Notification";

    private final OutboxService outboxService;

    @Transactional(propagation = Propagation.MANDATORY)
    public void dispatch(NotificationEvent notification) {
        outboxService.enqueue(AGGREGATE_TYPE, notification.getAggregateId(),
                notification.getEventType(), notification);
        log.debug("Queued {} for {}", notification.getEventType(), notification.getRecipientEmail());
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void dispatchAll(List<? extends NotificationEvent> notifications) {
        notifications.forEach(this::dispatch);
    }
}
