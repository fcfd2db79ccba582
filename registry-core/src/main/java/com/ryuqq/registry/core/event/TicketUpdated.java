package com.ryuqq.registry.core.event;

import com.ryuqq.registry.core.model.Ticket;

/**
 * Ticket 수정 이벤트 (기존 id에 대한 upsert).
 *
 * @param ticket 수정된 Ticket
 * @param <V> 값 타입
 * @author Registry Team
 * @since 1.0.0
 */
public record TicketUpdated<V>(Ticket<V> ticket) implements RegistryEvent<V> {

    public TicketUpdated {
        if (ticket == null) {
            throw new IllegalArgumentException("ticket cannot be null");
        }
    }

    @Override
    public String name() {
        return EventKind.TICKET_UPDATED.eventName();
    }

    @Override
    public EventKind kind() {
        return EventKind.TICKET_UPDATED;
    }

    @Override
    public Ticket<V> ticketOrNull() {
        return ticket;
    }
}
