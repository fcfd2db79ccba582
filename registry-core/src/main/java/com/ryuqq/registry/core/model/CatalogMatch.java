package com.ryuqq.registry.core.model;

import java.util.List;

/**
 * 값(value) 기반 역방향 조회 결과.
 *
 * <p>하나의 값에 연결된 Ticket 수에 따라 두 가지 형태를 가집니다:</p>
 * <ul>
 *   <li>{@link Single}: 정확히 하나의 Ticket</li>
 *   <li>{@link Many}: 둘 이상의 Ticket (등록 순서)</li>
 * </ul>
 *
 * <p>연결된 Ticket이 없으면 레지스트리는 null을 반환합니다.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public sealed interface CatalogMatch permits CatalogMatch.Single, CatalogMatch.Many {

    /**
     * @return 일치한 id 목록 (불변, 등록 순서)
     */
    List<TicketId> ids();

    /**
     * @param id 확인할 id
     * @return 결과에 포함되어 있으면 true
     */
    default boolean contains(TicketId id) {
        return ids().contains(id);
    }

    /**
     * 단일 Ticket 일치.
     *
     * @param id 일치한 Ticket id
     */
    record Single(TicketId id) implements CatalogMatch {

        public Single {
            if (id == null) {
                throw new IllegalArgumentException("id cannot be null");
            }
        }

        @Override
        public List<TicketId> ids() {
            return List.of(id);
        }
    }

    /**
     * 복수 Ticket 일치.
     *
     * @param ids 일치한 Ticket id 목록 (2개 이상)
     */
    record Many(List<TicketId> ids) implements CatalogMatch {

        public Many {
            if (ids == null || ids.size() < 2) {
                throw new IllegalArgumentException("Many requires at least two ids");
            }
            ids = List.copyOf(ids);
        }
    }
}
