package com.ryuqq.registry.core.model;

/**
 * 레지스트리 내 Ticket의 고유 식별자.
 *
 * <p>TicketId는 하나의 레지스트리 인스턴스 안에서 Ticket을 유일하게 식별합니다.
 * 호출자가 직접 지정하거나 {@link com.ryuqq.registry.core.spi.TicketIdGenerator}가 생성합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class TicketId {

    private final String value;

    private TicketId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("TicketId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("TicketId length cannot exceed 255 characters");
        }
        this.value = value;
    }

    /**
     * TicketId 생성.
     *
     * @param value TicketId 값
     * @return TicketId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static TicketId of(String value) {
        return new TicketId(value);
    }

    /**
     * TicketId 값 조회.
     *
     * @return TicketId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TicketId ticketId = (TicketId) o;
        return value.equals(ticketId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "TicketId{" + value + '}';
    }
}
