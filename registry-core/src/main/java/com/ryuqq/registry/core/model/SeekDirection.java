package com.ryuqq.registry.core.model;

/**
 * seek 탐색 방향.
 *
 * @author Registry Team
 * @since 1.0.0
 */
public enum SeekDirection {

    /**
     * 앞에서 뒤로 (position 오름차순).
     */
    FIRST,

    /**
     * 뒤에서 앞으로 (position 내림차순).
     */
    LAST
}
