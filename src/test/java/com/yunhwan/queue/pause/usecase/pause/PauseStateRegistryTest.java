package com.yunhwan.queue.pause.usecase.pause;

import com.yunhwan.queue.pause.domain.pause.QueuePauseState;
import com.yunhwan.queue.pause.usecase.pause.port.PauseStatePersistence;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PauseStateRegistryTest {

    private static final OffsetDateTime T1 = OffsetDateTime.of(2025, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);
    private static final OffsetDateTime T2 = T1.plusMinutes(5);

    @Mock
    private PauseStatePersistence persistence;

    @Captor
    private ArgumentCaptor<List<QueuePauseState>> snapshotCaptor;

    private PauseStateRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new PauseStateRegistry("b1", persistence, Runnable::run);
    }

    @Test
    @DisplayName("로드는 큐 이름 기준으로 덮어쓰고 영속화를 호출하지 않는다")
    void load_overwrites_by_queue_name_without_persisting() {
        registry.loadPauseStates(List.of(
                new QueuePauseState("orders", "/", true, T1, null, null),
                new QueuePauseState("orders", "/", false, T1, T2, null),
                new QueuePauseState("mail", "/", true, T2, null, null)
        ));

        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.getPauseState("orders")).get().extracting(QueuePauseState::paused).isEqualTo(false);
        assertThat(registry.getPausedStates()).extracting(QueuePauseState::queueName).containsExactly("mail");
        verify(persistence, never()).save(anyString(), any());
    }

    @Test
    @DisplayName("없는 큐는 empty")
    void unknown_queue_is_empty() {
        assertThat(registry.getPauseState("nope")).isEmpty();
    }

    @Test
    @DisplayName("markResumed 는 pausedAt 이력을 유지하고 consumerTag 를 지운다")
    void mark_resumed_keeps_paused_at() {
        registry.markPaused("orders", "/", "pause-orders-1", T1);
        QueuePauseState resumed = registry.markResumed("orders", "/", T2);

        assertThat(resumed.paused()).isFalse();
        assertThat(resumed.pausedAt()).isEqualTo(T1);
        assertThat(resumed.resumedAt()).isEqualTo(T2);
        assertThat(resumed.consumerTag()).isNull();
    }

    @Test
    @DisplayName("markResumedIfHeldBy 는 태그가 다르면 아무것도 바꾸지 않는다")
    void mark_resumed_if_held_by_compares_tag() {
        registry.markPaused("orders", "/", "pause-orders-new", T1);

        assertThat(registry.markResumedIfHeldBy("orders", "pause-orders-old", T2)).isEmpty();
        assertThat(registry.getPauseState("orders")).get().extracting(QueuePauseState::paused).isEqualTo(true);

        assertThat(registry.markResumedIfHeldBy("orders", "pause-orders-new", T2)).isPresent();
        assertThat(registry.getPauseState("orders")).get().extracting(QueuePauseState::paused).isEqualTo(false);
    }

    @Test
    @DisplayName("변경마다 전체 스냅샷이 전달된다")
    void every_mutation_persists_full_snapshot() {
        registry.markPaused("a", "/", "t-a", T1);
        registry.markPaused("b", "/", "t-b", T1);
        registry.markResumed("a", "/", T2);

        verify(persistence, times(3)).save(eq("b1"), snapshotCaptor.capture());

        List<QueuePauseState> last = snapshotCaptor.getAllValues().get(2);
        assertThat(last).hasSize(2);
        assertThat(last).filteredOn(QueuePauseState::paused).extracting(QueuePauseState::queueName).containsExactly("b");
        assertThat(registry.snapshot()).containsExactlyElementsOf(last);
    }

    @Test
    @DisplayName("executor 가 거부해도 메모리 상태는 반영된다")
    void rejected_persistence_keeps_memory_state() {
        PauseStateRegistry closing = new PauseStateRegistry("b1", persistence, r -> {
            throw new RejectedExecutionException("shutting down");
        });

        closing.markPaused("orders", "/", "t", T1);

        assertThat(closing.getPauseState("orders")).get().extracting(QueuePauseState::paused).isEqualTo(true);
        verify(persistence, never()).save(anyString(), any());
    }

    @Test
    @DisplayName("동시에 변경해도 스냅샷은 변경 순서대로 executor 에 넘어가고, 마지막 저장본이 최종 상태와 같다")
    void snapshots_are_submitted_in_mutation_order() throws Exception {
        List<Runnable> submitted = Collections.synchronizedList(new ArrayList<>());
        List<List<QueuePauseState>> saved = new ArrayList<>();
        PauseStateRegistry concurrent = new PauseStateRegistry("b1", (brokerId, states) -> saved.add(states), submitted::add);

        int rounds = 500;
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<?> a = pool.submit(() -> {
                start.await();
                for (int i = 0; i < rounds; i++) concurrent.markPaused("a", "/", "t-a-" + i, T1.plusSeconds(i));
                return null;
            });
            Future<?> b = pool.submit(() -> {
                start.await();
                for (int i = 0; i < rounds; i++) concurrent.markPaused("b", "/", "t-b-" + i, T1.plusSeconds(i));
                return null;
            });
            start.countDown();
            a.get(10, TimeUnit.SECONDS);
            b.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        // 단일 스레드 executor 처럼 제출 순서대로 실행
        new ArrayList<>(submitted).forEach(Runnable::run);

        assertThat(saved).hasSize(rounds * 2);
        assertThat(saved.get(saved.size() - 1)).containsExactlyInAnyOrderElementsOf(concurrent.snapshot());
        for (String queue : List.of("a", "b")) {
            OffsetDateTime previous = null;
            for (List<QueuePauseState> snapshot : saved) {
                OffsetDateTime pausedAt = snapshot.stream()
                        .filter(st -> st.queueName().equals(queue))
                        .map(QueuePauseState::pausedAt)
                        .findFirst()
                        .orElse(null);
                if (pausedAt == null) continue;
                if (previous != null) {
                    assertThat(pausedAt).isAfterOrEqualTo(previous);
                }
                previous = pausedAt;
            }
        }
    }
}
