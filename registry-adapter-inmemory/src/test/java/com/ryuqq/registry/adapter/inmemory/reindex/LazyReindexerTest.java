package com.ryuqq.registry.adapter.inmemory.reindex;

import com.ryuqq.registry.adapter.inmemory.index.PositionDirectory;
import com.ryuqq.registry.adapter.inmemory.index.ValueCatalog;
import com.ryuqq.registry.adapter.inmemory.store.TicketArena;
import com.ryuqq.registry.core.model.CatalogMatch;
import com.ryuqq.registry.core.model.Ticket;
import com.ryuqq.registry.core.model.TicketId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * LazyReindexer 유닛 테스트.
 *
 * <p>저장소와 두 인덱스를 직접 구성해 dirty watermark 동작을 검증합니다.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
class LazyReindexerTest {

    private TicketArena<String> arena;
    private PositionDirectory directory;
    private ValueCatalog catalog;
    private LazyReindexer<String> reindexer;

    @BeforeEach
    void setUp() {
        arena = new TicketArena<>();
        directory = new PositionDirectory();
        catalog = new ValueCatalog();
        reindexer = new LazyReindexer<>(arena, directory, catalog);
    }

    @Test
    void 초기_상태는_clean() {
        assertThat(reindexer.isDirty()).isFalse();
        assertThat(reindexer.watermark()).isEqualTo(-1);
        assertThat(reindexer.settle()).isFalse();
    }

    @Test
    void markDirty_최소_위치를_유지() {
        // when
        reindexer.markDirty(5);
        reindexer.markDirty(2);
        reindexer.markDirty(7);

        // then
        assertThat(reindexer.isDirty()).isTrue();
        assertThat(reindexer.watermark()).isEqualTo(2);
    }

    @Test
    void settle_watermark부터_재번호하고_카탈로그_갱신() {
        // given: a0 b1 c2 d3 중 b 제거
        add("a", "b", "c", "d");
        remove("b");

        // when
        boolean ran = reindexer.settle();

        // then
        assertThat(ran).isTrue();
        assertThat(reindexer.isDirty()).isFalse();
        assertThat(arena.get(id("c")).position()).isEqualTo(1);
        assertThat(arena.get(id("d")).position()).isEqualTo(2);
        assertThat(directory.get(1)).isEqualTo(id("c"));
        assertThat(directory.get(2)).isEqualTo(id("d"));
        assertThat(directory.get(3)).isNull();
        assertThat(catalog.browse(1)).isEqualTo(new CatalogMatch.Single(id("c")));
        assertThat(catalog.browse(3)).isNull();
    }

    @Test
    void settle_watermark_이전_ticket은_같은_인스턴스로_유지() {
        // given
        add("a", "b", "c");
        Ticket<String> a = arena.get(id("a"));
        remove("b");

        // when
        reindexer.settle();

        // then
        assertThat(arena.get(id("a"))).isSameAs(a);
    }

    @Test
    void settle_명시값_ticket은_카탈로그_키가_바뀌지_않음() {
        // given
        add("a");
        Ticket<String> valued = Ticket.valued(id("v"), 1, "value");
        arena.append(valued);
        directory.put(1, valued.id());
        catalog.assign("value", valued.id());
        remove("a");

        // when
        reindexer.settle();

        // then
        assertThat(arena.get(id("v")).position()).isZero();
        assertThat(catalog.browse("value")).isEqualTo(new CatalogMatch.Single(id("v")));
        assertThat(directory.get(0)).isEqualTo(id("v"));
    }

    @Test
    void markIrregular_이후에는_0부터_재번호() {
        // given: a는 0번에 있지만 seeded 위치 때문에 전체 재색인이 필요
        Ticket<String> seeded = Ticket.positional(id("s"), 9);
        arena.append(seeded);
        directory.put(9, seeded.id());
        catalog.assign(seeded.resolvedValue(), seeded.id());
        reindexer.markIrregular();
        add("b");
        remove("b");

        // when
        reindexer.settle();

        // then
        assertThat(arena.get(id("s")).position()).isZero();
        assertThat(directory.get(0)).isEqualTo(id("s"));
        assertThat(directory.get(9)).isNull();
        assertThat(catalog.browse(9)).isNull();
        assertThat(reindexer.isFullPassRequired()).isFalse();
    }

    @Test
    void reindexAll_dirty가_아니어도_전체_실행() {
        // given
        add("a", "b");
        directory.clear();

        // when
        reindexer.reindexAll();

        // then
        assertThat(directory.get(0)).isEqualTo(id("a"));
        assertThat(directory.get(1)).isEqualTo(id("b"));
    }

    @Test
    void reset_dirty_상태만_초기화() {
        // given
        reindexer.markDirty(0);
        reindexer.markIrregular();

        // when
        reindexer.reset();

        // then
        assertThat(reindexer.isDirty()).isFalse();
        assertThat(reindexer.isFullPassRequired()).isFalse();
    }

    private void add(String... ids) {
        for (String value : ids) {
            Ticket<String> ticket = Ticket.positional(id(value), arena.size());
            arena.append(ticket);
            directory.put(ticket.position(), ticket.id());
            catalog.assign(ticket.resolvedValue(), ticket.id());
        }
    }

    private void remove(String value) {
        Ticket<String> removed = arena.remove(id(value));
        directory.remove(removed.position(), removed.id());
        catalog.unassign(removed.resolvedValue(), removed.id());
        reindexer.markDirty(removed.position());
    }

    private static TicketId id(String value) {
        return TicketId.of(value);
    }
}
