package com.ryuqq.registry.core.config;

import com.ryuqq.registry.core.spi.TicketIdGenerator;

/**
 * 레지스트리 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>eventsEnabled: 이벤트 채널 사용 여부 (기본 false, 리스너 저장소를 할당하지 않음)</li>
 *   <li>idGenerator: id 생략 등록 시 사용할 생성기 (기본 UUID)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RegistryConfig config = RegistryConfig.defaults()
 *     .withEventsEnabled(true)
 *     .withIdGenerator(TicketIdGenerator.sequential("item"));
 * </pre>
 *
 * @author Registry Team
 * @since 1.0.0
 * @param eventsEnabled 이벤트 채널 사용 여부
 * @param idGenerator TicketId 생성기 (non-null)
 */
public record RegistryConfig(boolean eventsEnabled, TicketIdGenerator idGenerator) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException idGenerator가 null인 경우
     */
    public RegistryConfig {
        if (idGenerator == null) {
            throw new IllegalArgumentException("idGenerator cannot be null");
        }
    }

    /**
     * 기본 설정.
     *
     * <p>기본값: eventsEnabled=false, idGenerator=UUID</p>
     *
     * @return 기본 RegistryConfig
     */
    public static RegistryConfig defaults() {
        return new RegistryConfig(false, TicketIdGenerator.uuid());
    }

    /**
     * eventsEnabled만 변경한 새 인스턴스 생성.
     *
     * @param eventsEnabled 이벤트 채널 사용 여부
     * @return 새 RegistryConfig 인스턴스
     */
    public RegistryConfig withEventsEnabled(boolean eventsEnabled) {
        return new RegistryConfig(eventsEnabled, this.idGenerator);
    }

    /**
     * idGenerator만 변경한 새 인스턴스 생성.
     *
     * @param idGenerator 새 생성기
     * @return 새 RegistryConfig 인스턴스
     */
    public RegistryConfig withIdGenerator(TicketIdGenerator idGenerator) {
        return new RegistryConfig(this.eventsEnabled, idGenerator);
    }
}
