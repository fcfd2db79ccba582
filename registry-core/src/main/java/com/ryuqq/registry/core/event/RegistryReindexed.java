package com.ryuqq.registry.core.event;

/**
 * 명시적 재색인 완료 이벤트.
 *
 * @param size 재색인 시점의 Ticket 수
 * @param <V> 값 타입
 * @author Registry Team
 * @since 1.0.0
 */
public record RegistryReindexed<V>(int size) implements RegistryEvent<V> {

    @Override
    public String name() {
        return EventKind.REGISTRY_REINDEXED.eventName();
    }

    @Override
    public EventKind kind() {
        return EventKind.REGISTRY_REINDEXED;
    }
}
