package com.ryuqq.registry.core.model;

/**
 * upsert 요청의 값 변경 (tri-state patch).
 *
 * <p><strong>값 변경 종류:</strong></p>
 * <ul>
 *   <li>{@link Change#KEEP}: 값 필드 생략. value와 valueIsPosition 모두 유지</li>
 *   <li>{@link Change#RESET}: "값 없음" 명시. value가 position으로 되돌아가고 valueIsPosition = true</li>
 *   <li>{@link Change#SET}: 구체적인 값 지정 (null 허용). valueIsPosition = false</li>
 * </ul>
 *
 * <p>id와 position은 patch로 변경할 수 없습니다. position은 재색인으로만 바뀝니다.</p>
 *
 * @param <V> 값 타입
 * @author Registry Team
 * @since 1.0.0
 */
public final class TicketPatch<V> {

    /**
     * 값 변경 종류.
     */
    public enum Change {
        KEEP,
        RESET,
        SET
    }

    private static final TicketPatch<?> KEEP = new TicketPatch<>(Change.KEEP, null);
    private static final TicketPatch<?> RESET = new TicketPatch<>(Change.RESET, null);

    private final Change change;
    private final V value;

    private TicketPatch(Change change, V value) {
        this.change = change;
        this.value = value;
    }

    @SuppressWarnings("unchecked")
    public static <V> TicketPatch<V> keep() {
        return (TicketPatch<V>) KEEP;
    }

    @SuppressWarnings("unchecked")
    public static <V> TicketPatch<V> reset() {
        return (TicketPatch<V>) RESET;
    }

    public static <V> TicketPatch<V> set(V value) {
        return new TicketPatch<>(Change.SET, value);
    }

    public Change getChange() {
        return change;
    }

    /**
     * @return SET일 때 지정된 값, 그 외에는 null
     */
    public V getValue() {
        return value;
    }

    /**
     * 존재하지 않는 id에 대한 upsert를 등록 요청으로 변환.
     *
     * <p>KEEP과 RESET은 모두 "값 생략"으로 취급됩니다.</p>
     *
     * @param id 등록할 id
     * @return 동일한 의미의 Registration
     * @throws IllegalArgumentException id가 null인 경우
     */
    public Registration<V> toRegistration(TicketId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        Registration.Builder<V> builder = Registration.<V>builder().id(id);
        if (change == Change.SET) {
            builder.value(value);
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return change == Change.SET ? "TicketPatch{SET " + value + '}' : "TicketPatch{" + change + '}';
    }
}
