package com.ryuqq.registry.core.event;

import com.ryuqq.registry.core.model.Ticket;

/**
 * 레지스트리 이벤트.
 *
 * <p>구조 이벤트 다섯 가지와 사용자 정의 이벤트 하나로 닫힌 집합입니다:</p>
 * <ul>
 *   <li>{@link TicketRegistered}, {@link TicketUnregistered}, {@link TicketUpdated}: Ticket 스냅샷 포함</li>
 *   <li>{@link RegistryCleared}, {@link RegistryReindexed}: 레지스트리 전체 이벤트</li>
 *   <li>{@link CustomEvent}: 애플리케이션 정의 이름과 데이터</li>
 * </ul>
 *
 * <p><strong>instanceof 분기 예시:</strong></p>
 * <pre>
 * registry.on(EventKind.TICKET_REGISTERED, event -&gt; {
 *     if (event instanceof TicketRegistered&lt;String&gt; registered) {
 *         System.out.println(registered.ticket().id());
 *     }
 * });
 * </pre>
 *
 * @param <V> 레지스트리 값 타입
 * @author Registry Team
 * @since 1.0.0
 */
public sealed interface RegistryEvent<V>
    permits TicketRegistered, TicketUnregistered, TicketUpdated,
            RegistryCleared, RegistryReindexed, CustomEvent {

    /**
     * @return 리스너가 구독하는 이벤트 이름
     */
    String name();

    /**
     * @return 구조 이벤트 종류, 사용자 정의 이벤트면 null
     */
    EventKind kind();

    /**
     * 이벤트가 다루는 Ticket.
     *
     * @return Ticket 이벤트면 해당 스냅샷, 그 외에는 null
     */
    default Ticket<V> ticketOrNull() {
        return null;
    }
}
