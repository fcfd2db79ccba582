package com.ryuqq.registry.adapter.inmemory.event;

import com.ryuqq.registry.core.event.CustomEvent;
import com.ryuqq.registry.core.event.RegistryEvent;
import com.ryuqq.registry.core.event.RegistryListener;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * EventChannel 유닛 테스트.
 *
 * <p>비활성 채널의 WARN 진단은 Mock Logger로 검증합니다.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class EventChannelTest {

    @Mock
    private Logger logger;

    @Test
    void 비활성_채널에서_on은_경고_후_무시() {
        // given
        EventChannel<String> channel = new EventChannel<>(false, logger);
        List<RegistryEvent<String>> received = new ArrayList<>();

        // when
        channel.on("custom:ping", received::add);
        channel.dispatch(new CustomEvent<>("custom:ping", 1));

        // then
        verify(logger).warn(contains("Events are disabled"), eq("custom:ping"));
        assertThat(received).isEmpty();
        assertThat(channel.listenerCount("custom:ping")).isZero();
    }

    @Test
    void 비활성_채널에서_off도_경고() {
        // given
        EventChannel<String> channel = new EventChannel<>(false, logger);

        // when
        channel.off("custom:ping", event -> { });

        // then
        verify(logger).warn(contains("listener removal"), eq("custom:ping"));
    }

    @Test
    void 활성_채널은_경고하지_않음() {
        // given
        EventChannel<String> channel = new EventChannel<>(true, logger);

        // when
        channel.on("custom:ping", event -> { });

        // then
        verifyNoInteractions(logger);
        assertThat(channel.listenerCount("custom:ping")).isEqualTo(1);
    }

    @Test
    void dispatch_구독_순서대로_전달() {
        // given
        EventChannel<String> channel = new EventChannel<>(true, logger);
        List<String> order = new ArrayList<>();
        channel.on("custom:ping", event -> order.add("first"));
        channel.on("custom:ping", event -> order.add("second"));

        // when
        channel.dispatch(new CustomEvent<>("custom:ping", null));

        // then
        assertThat(order).containsExactly("first", "second");
    }

    @Test
    void dispatch_중_구독해제해도_이번_전달은_완료() {
        // given
        EventChannel<String> channel = new EventChannel<>(true, logger);
        List<String> order = new ArrayList<>();
        RegistryListener<String> second = event -> order.add("second");
        channel.on("custom:ping", event -> {
            order.add("first");
            channel.off("custom:ping", second);
        });
        channel.on("custom:ping", second);

        // when
        channel.dispatch(new CustomEvent<>("custom:ping", null));
        channel.dispatch(new CustomEvent<>("custom:ping", null));

        // then
        assertThat(order).containsExactly("first", "second", "first");
    }

    @Test
    void 리스너_예외는_전파되고_나머지_리스너는_실행되지_않음() {
        // given
        EventChannel<String> channel = new EventChannel<>(true, logger);
        List<String> order = new ArrayList<>();
        channel.on("custom:ping", event -> {
            throw new IllegalStateException("listener failed");
        });
        channel.on("custom:ping", event -> order.add("second"));

        // when & then
        assertThatThrownBy(() -> channel.dispatch(new CustomEvent<>("custom:ping", null)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("listener failed");
        assertThat(order).isEmpty();
    }

    @Test
    void off_마지막_리스너_제거시_이름도_정리() {
        // given
        EventChannel<String> channel = new EventChannel<>(true, logger);
        RegistryListener<String> listener = event -> { };
        channel.on("custom:ping", listener);

        // when
        channel.off("custom:ping", listener);
        channel.off("custom:ping", listener);

        // then
        assertThat(channel.listenerCount("custom:ping")).isZero();
        verify(logger, never()).warn(anyString(), anyString());
    }

    @Test
    void clear_모든_리스너_제거() {
        // given
        EventChannel<String> channel = new EventChannel<>(true, logger);
        channel.on("a", event -> { });
        channel.on("b", event -> { });

        // when
        channel.clear();

        // then
        assertThat(channel.listenerCount("a")).isZero();
        assertThat(channel.listenerCount("b")).isZero();
    }

    @Test
    void null_인자는_거부() {
        EventChannel<String> channel = new EventChannel<>(true, logger);

        assertThatThrownBy(() -> channel.on(null, event -> { }))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("event cannot be null");
        assertThatThrownBy(() -> channel.on("a", null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("listener cannot be null");
    }
}
