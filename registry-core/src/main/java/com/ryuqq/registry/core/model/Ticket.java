package com.ryuqq.registry.core.model;

/**
 * 레지스트리에 등록된 항목 (Ticket).
 *
 * <p>Ticket은 식별자, 순서 위치(position), 연관 값(value), 그리고 값이 위치에서
 * 파생되었는지 여부(valueIsPosition)로 구성됩니다.</p>
 *
 * <p><strong>값 해석 규칙:</strong></p>
 * <ul>
 *   <li>valueIsPosition = true: 등록/수정 시 값이 생략됨. {@code value}는 null이며
 *       {@link #resolvedValue()}는 position({@link Integer})을 반환</li>
 *   <li>valueIsPosition = false: 명시적으로 지정된 값 (null 포함)</li>
 * </ul>
 *
 * <p><strong>동등성:</strong> {@code id} 기준. 재색인(reindex)으로 position이 바뀐
 * 스냅샷도 같은 Ticket으로 취급합니다.</p>
 *
 * <p><strong>불변성:</strong> 레지스트리는 재색인 시 {@link #withPosition(int)}로 새 스냅샷을
 * 만들어 교체하므로, 이미 반환된 Ticket은 변경되지 않습니다.</p>
 *
 * @param id Ticket 식별자
 * @param position 순서 위치 (0 이상)
 * @param value 연관 값 (valueIsPosition이면 null)
 * @param valueIsPosition 값이 position에서 파생되었는지 여부
 * @param <V> 값 타입
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record Ticket<V>(
    TicketId id,
    int position,
    V value,
    boolean valueIsPosition
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id가 null이거나 position이 음수인 경우,
     *         또는 valueIsPosition인데 value가 지정된 경우
     */
    public Ticket {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (position < 0) {
            throw new IllegalArgumentException("position cannot be negative, but was: " + position);
        }
        if (valueIsPosition && value != null) {
            throw new IllegalArgumentException("value must be null when valueIsPosition is true");
        }
    }

    /**
     * 위치에서 값이 파생되는 Ticket 생성.
     *
     * @param id Ticket 식별자
     * @param position 순서 위치
     * @param <V> 값 타입
     * @return valueIsPosition = true인 Ticket
     */
    public static <V> Ticket<V> positional(TicketId id, int position) {
        return new Ticket<>(id, position, null, true);
    }

    /**
     * 명시적 값을 가진 Ticket 생성.
     *
     * @param id Ticket 식별자
     * @param position 순서 위치
     * @param value 연관 값 (null 허용)
     * @param <V> 값 타입
     * @return valueIsPosition = false인 Ticket
     */
    public static <V> Ticket<V> valued(TicketId id, int position, V value) {
        return new Ticket<>(id, position, value, false);
    }

    /**
     * 카탈로그 키로 사용되는 실제 값.
     *
     * @return valueIsPosition이면 position, 아니면 value (null 가능)
     */
    public Object resolvedValue() {
        return valueIsPosition ? Integer.valueOf(position) : value;
    }

    /**
     * position만 변경한 새 스냅샷 생성.
     *
     * <p>valueIsPosition인 경우 해석 값도 함께 바뀝니다.</p>
     *
     * @param newPosition 새 위치
     * @return 새 Ticket 인스턴스 (같은 position이면 this)
     */
    public Ticket<V> withPosition(int newPosition) {
        if (newPosition == position) {
            return this;
        }
        return new Ticket<>(id, newPosition, value, valueIsPosition);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Ticket<?> ticket = (Ticket<?>) o;
        return id.equals(ticket.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }
}
