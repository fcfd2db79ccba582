package com.ryuqq.registry.core.event;

import com.ryuqq.registry.core.model.Ticket;

/**
 * Ticket 해제 이벤트.
 *
 * @param ticket 해제 직전의 Ticket 스냅샷
 * @param <V> 값 타입
 * @author Registry Team
 * @since 1.0.0
 */
public record TicketUnregistered<V>(Ticket<V> ticket) implements RegistryEvent<V> {

    public TicketUnregistered {
        if (ticket == null) {
            throw new IllegalArgumentException("ticket cannot be null");
        }
    }

    @Override
    public String name() {
        return EventKind.TICKET_UNREGISTERED.eventName();
    }

    @Override
    public EventKind kind() {
        return EventKind.TICKET_UNREGISTERED;
    }

    @Override
    public Ticket<V> ticketOrNull() {
        return ticket;
    }
}
