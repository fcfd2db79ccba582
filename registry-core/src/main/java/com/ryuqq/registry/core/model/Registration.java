package com.ryuqq.registry.core.model;

/**
 * Ticket 등록 요청 (부분 Ticket).
 *
 * <p>모든 필드는 선택 사항입니다:</p>
 * <ul>
 *   <li>id 생략: 레지스트리가 새 id를 생성</li>
 *   <li>position 생략: 현재 크기(size) 위치에 추가</li>
 *   <li>value 생략: position에서 파생 (valueIsPosition = true)</li>
 * </ul>
 *
 * <p>value는 "생략"과 "null 지정"을 구분합니다. {@code value(null)}은 명시적 값이므로
 * valueIsPosition = false가 됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Registration&lt;String&gt; r = Registration.&lt;String&gt;builder()
 *     .id("item-1")
 *     .value("apple")
 *     .build();
 * </pre>
 *
 * @param <V> 값 타입
 * @author Registry Team
 * @since 1.0.0
 */
public final class Registration<V> {

    private static final Registration<?> EMPTY = new Registration<>(null, null, false, null);

    private final TicketId id;
    private final Integer position;
    private final boolean hasValue;
    private final V value;

    private Registration(TicketId id, Integer position, boolean hasValue, V value) {
        if (position != null && position < 0) {
            throw new IllegalArgumentException("position cannot be negative, but was: " + position);
        }
        this.id = id;
        this.position = position;
        this.hasValue = hasValue;
        this.value = value;
    }

    /**
     * 모든 필드가 생략된 등록 요청.
     *
     * @param <V> 값 타입
     * @return 빈 Registration
     */
    @SuppressWarnings("unchecked")
    public static <V> Registration<V> empty() {
        return (Registration<V>) EMPTY;
    }

    /**
     * id만 지정된 등록 요청.
     *
     * @param id Ticket 식별자 문자열
     * @param <V> 값 타입
     * @return Registration
     */
    public static <V> Registration<V> withId(String id) {
        return new Registration<>(TicketId.of(id), null, false, null);
    }

    /**
     * id와 값이 지정된 등록 요청.
     *
     * @param id Ticket 식별자 문자열
     * @param value 값 (null 허용)
     * @param <V> 값 타입
     * @return Registration
     */
    public static <V> Registration<V> of(String id, V value) {
        return new Registration<>(TicketId.of(id), null, true, value);
    }

    public static <V> Builder<V> builder() {
        return new Builder<>();
    }

    /**
     * @return 지정된 id 또는 null (생략 시)
     */
    public TicketId getIdOrNull() {
        return id;
    }

    /**
     * @return 지정된 position 또는 null (생략 시)
     */
    public Integer getPositionOrNull() {
        return position;
    }

    /**
     * @return value가 명시적으로 지정되었으면 true
     */
    public boolean hasValue() {
        return hasValue;
    }

    /**
     * @return 지정된 value (hasValue가 false면 의미 없음)
     */
    public V getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "Registration{id=" + id + ", position=" + position
            + (hasValue ? ", value=" + value : ", value=<omitted>") + '}';
    }

    /**
     * Registration 빌더.
     *
     * @param <V> 값 타입
     */
    public static final class Builder<V> {

        private TicketId id;
        private Integer position;
        private boolean hasValue;
        private V value;

        private Builder() {
        }

        public Builder<V> id(String id) {
            this.id = TicketId.of(id);
            return this;
        }

        public Builder<V> id(TicketId id) {
            this.id = id;
            return this;
        }

        /**
         * 초기 position 지정.
         *
         * <p>지정된 position은 다음 재색인 전까지만 유지됩니다.</p>
         *
         * @param position 0 이상
         * @return this
         */
        public Builder<V> position(int position) {
            this.position = position;
            return this;
        }

        public Builder<V> value(V value) {
            this.hasValue = true;
            this.value = value;
            return this;
        }

        public Registration<V> build() {
            return new Registration<>(id, position, hasValue, value);
        }
    }
}
