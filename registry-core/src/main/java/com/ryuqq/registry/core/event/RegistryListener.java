package com.ryuqq.registry.core.event;

/**
 * 레지스트리 이벤트 리스너.
 *
 * <p>리스너는 이벤트를 발생시킨 연산의 호출 스레드에서 동기적으로 실행됩니다.
 * 리스너가 던진 예외는 호출자에게 전파되며, 같은 발행의 이후 리스너는 실행되지 않습니다.
 * 발행은 항상 연산의 색인/캐시 갱신이 끝난 뒤에 일어납니다.</p>
 *
 * @param <V> 레지스트리 값 타입
 * @author Registry Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RegistryListener<V> {

    /**
     * 이벤트 수신.
     *
     * @param event 발행된 이벤트
     */
    void onEvent(RegistryEvent<V> event);
}
