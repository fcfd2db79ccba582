package com.ryuqq.registry.core.event;

import com.ryuqq.registry.core.model.Ticket;

/**
 * Ticket 등록 이벤트.
 *
 * @param ticket 등록된 Ticket
 * @param <V> 값 타입
 * @author Registry Team
 * @since 1.0.0
 */
public record TicketRegistered<V>(Ticket<V> ticket) implements RegistryEvent<V> {

    public TicketRegistered {
        if (ticket == null) {
            throw new IllegalArgumentException("ticket cannot be null");
        }
    }

    @Override
    public String name() {
        return EventKind.TICKET_REGISTERED.eventName();
    }

    @Override
    public EventKind kind() {
        return EventKind.TICKET_REGISTERED;
    }

    @Override
    public Ticket<V> ticketOrNull() {
        return ticket;
    }
}
