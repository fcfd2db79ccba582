package com.ryuqq.registry.core.event;

/**
 * 애플리케이션 정의 이벤트.
 *
 * <p>{@code Registry.emit(name, data)}로 발행됩니다. 구조 이벤트 이름을 사용해도
 * CustomEvent로 전달되며, 해당 이름의 구독자가 그대로 수신합니다.</p>
 *
 * @param name 이벤트 이름 (non-null)
 * @param data 이벤트 데이터 (null 허용)
 * @param <V> 레지스트리 값 타입
 * @author Registry Team
 * @since 1.0.0
 */
public record CustomEvent<V>(String name, Object data) implements RegistryEvent<V> {

    public CustomEvent {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
    }

    @Override
    public EventKind kind() {
        return null;
    }
}
