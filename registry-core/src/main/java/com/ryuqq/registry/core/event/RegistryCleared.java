package com.ryuqq.registry.core.event;

/**
 * 레지스트리 비움 이벤트.
 *
 * @param <V> 값 타입
 * @author Registry Team
 * @since 1.0.0
 */
public record RegistryCleared<V>() implements RegistryEvent<V> {

    @Override
    public String name() {
        return EventKind.REGISTRY_CLEARED.eventName();
    }

    @Override
    public EventKind kind() {
        return EventKind.REGISTRY_CLEARED;
    }
}
