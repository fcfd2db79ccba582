package com.ryuqq.registry.core.spi;

import com.ryuqq.registry.core.model.TicketId;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * TicketId 생성 SPI.
 *
 * <p>id 없이 등록되는 Ticket에 새 식별자를 부여합니다.
 * 생성된 id가 이미 존재하면 레지스트리는 이를 중복 등록으로 처리하므로,
 * 구현체는 레지스트리 수명 동안 고유한 값을 생성해야 합니다.</p>
 *
 * <p><strong>기본 구현:</strong></p>
 * <ul>
 *   <li>{@link #uuid()}: 랜덤 UUID 문자열 (기본값)</li>
 *   <li>{@link #sequential(String)}: {@code prefix-1}, {@code prefix-2}, ... (테스트/디버깅용)</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TicketIdGenerator {

    /**
     * 새 TicketId 생성.
     *
     * @return 새 TicketId (non-null)
     */
    TicketId next();

    /**
     * 랜덤 UUID 기반 생성기.
     *
     * @return TicketIdGenerator
     */
    static TicketIdGenerator uuid() {
        return () -> TicketId.of(UUID.randomUUID().toString());
    }

    /**
     * 순차 번호 기반 생성기.
     *
     * @param prefix id 접두사
     * @return TicketIdGenerator
     * @throws IllegalArgumentException prefix가 null 또는 빈 문자열인 경우
     */
    static TicketIdGenerator sequential(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix cannot be null or blank");
        }
        AtomicLong counter = new AtomicLong();
        return () -> TicketId.of(prefix + "-" + counter.incrementAndGet());
    }
}
