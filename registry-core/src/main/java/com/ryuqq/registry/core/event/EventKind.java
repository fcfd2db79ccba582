package com.ryuqq.registry.core.event;

/**
 * 레지스트리 구조 이벤트 종류.
 *
 * <p>각 종류는 리스너 등록 시 사용하는 고정 이름을 가집니다.
 * 애플리케이션 정의 이벤트는 임의의 이름으로 {@link CustomEvent}를 통해 발행합니다.</p>
 *
 * <table>
 *   <caption>이벤트 이름</caption>
 *   <tr><th>종류</th><th>이름</th><th>발행 시점</th></tr>
 *   <tr><td>TICKET_REGISTERED</td><td>register:ticket</td><td>register, upsert(신규)</td></tr>
 *   <tr><td>TICKET_UNREGISTERED</td><td>unregister:ticket</td><td>unregister, offboard</td></tr>
 *   <tr><td>TICKET_UPDATED</td><td>update:ticket</td><td>upsert(기존)</td></tr>
 *   <tr><td>REGISTRY_CLEARED</td><td>clear:registry</td><td>clear, dispose</td></tr>
 *   <tr><td>REGISTRY_REINDEXED</td><td>reindex:registry</td><td>reindex (명시적 호출)</td></tr>
 * </table>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public enum EventKind {

    TICKET_REGISTERED("register:ticket"),
    TICKET_UNREGISTERED("unregister:ticket"),
    TICKET_UPDATED("update:ticket"),
    REGISTRY_CLEARED("clear:registry"),
    REGISTRY_REINDEXED("reindex:registry");

    private final String eventName;

    EventKind(String eventName) {
        this.eventName = eventName;
    }

    /**
     * @return 리스너 등록에 사용하는 이벤트 이름
     */
    public String eventName() {
        return eventName;
    }

    /**
     * 이벤트 이름으로 구조 이벤트 종류 조회.
     *
     * @param name 이벤트 이름
     * @return 일치하는 EventKind 또는 null (사용자 정의 이벤트인 경우)
     */
    public static EventKind fromName(String name) {
        for (EventKind kind : values()) {
            if (kind.eventName.equals(name)) {
                return kind;
            }
        }
        return null;
    }
}
