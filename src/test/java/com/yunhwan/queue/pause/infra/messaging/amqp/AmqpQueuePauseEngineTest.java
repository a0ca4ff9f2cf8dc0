package com.yunhwan.queue.pause.infra.messaging.amqp;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import com.yunhwan.queue.pause.common.exception.BrokerConnectionException;
import com.yunhwan.queue.pause.common.exception.BrokerProtocolException;
import com.yunhwan.queue.pause.common.exception.PauseOperationTimeoutException;
import com.yunhwan.queue.pause.domain.pause.BrokerEndpoint;
import com.yunhwan.queue.pause.domain.pause.QueuePauseState;
import com.yunhwan.queue.pause.infra.logging.QueuePauseEventLogger;
import com.yunhwan.queue.pause.usecase.pause.PauseStateRegistry;
import com.yunhwan.queue.pause.usecase.pause.port.PauseStatePersistence;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * mock amqp-client(ConnectionFactory/Connection/Channel) 위에서 blocking consumer 엔진을 검증한다.
 * 영속화 executor는 동기 실행(Runnable::run)으로 둔다.
 * 공통 stub 중 일부는 테스트마다 쓰이지 않으므로 lenient.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AmqpQueuePauseEngineTest {

    private static final String BROKER_ID = "b1";
    private static final OffsetDateTime NOW = OffsetDateTime.of(2025, 3, 1, 9, 0, 0, 0, ZoneOffset.UTC);

    private final Clock clock = Clock.fixed(Instant.from(NOW), ZoneOffset.UTC);

    private ConnectionFactory connectionFactory;
    private Connection connection;
    private Channel controlChannel;
    private Channel probeChannel;
    private PauseStatePersistence persistence;
    private PauseStateRegistry stateRegistry;
    private QueuePauseProperties props;
    private AmqpQueuePauseEngine engine;

    // consumerTag -> control channel 에 등록된 consumer
    private final Map<String, Consumer> consumers = new ConcurrentHashMap<>();

    @Captor
    private ArgumentCaptor<List<QueuePauseState>> snapshotCaptor;

    @BeforeEach
    void setUp() throws Exception {
        connectionFactory = mock(ConnectionFactory.class);
        connection = mock(Connection.class);
        controlChannel = mock(Channel.class);
        probeChannel = mock(Channel.class);
        persistence = mock(PauseStatePersistence.class);

        when(connectionFactory.newConnection(anyString())).thenReturn(connection);
        when(connection.isOpen()).thenReturn(true);
        // 첫 channel은 control, 이후는 passive declare용 probe
        when(connection.createChannel()).thenReturn(controlChannel, probeChannel);
        when(controlChannel.isOpen()).thenReturn(true);
        when(probeChannel.isOpen()).thenReturn(true);

        doAnswer(inv -> {
            String tag = inv.getArgument(2);
            Consumer consumer = inv.getArgument(6);
            if (tag != null && consumer != null) {
                consumers.put(tag, consumer);
            }
            return tag;
        }).when(controlChannel).basicConsume(anyString(), anyBoolean(), anyString(), anyBoolean(), anyBoolean(), anyMap(), any(Consumer.class));
        // 브로커처럼 cancel 뒤 cancel-ok 를 consumer 에 전달
        doAnswer(inv -> {
            String tag = inv.getArgument(0);
            Consumer consumer = tag == null ? null : consumers.get(tag);
            if (consumer != null) {
                consumer.handleCancelOk(tag);
            }
            return null;
        }).when(controlChannel).basicCancel(anyString());

        props = new QueuePauseProperties();
        engine = newEngine();
    }

    private AmqpQueuePauseEngine newEngine() {
        BrokerEndpoint endpoint = new BrokerEndpoint(BROKER_ID, "rabbit.local", 5672, "/", "guest", "secret", false);
        stateRegistry = new PauseStateRegistry(BROKER_ID, persistence, Runnable::run);
        return new AmqpQueuePauseEngine(
                endpoint,
                new AmqpConnectionManager(endpoint, connectionFactory),
                stateRegistry,
                props,
                new QueuePauseEventLogger(clock),
                clock
        );
    }

    private Consumer captureConsumer(String queue) throws IOException {
        ArgumentCaptor<Consumer> captor = ArgumentCaptor.forClass(Consumer.class);
        verify(controlChannel).basicConsume(eq(queue), eq(false), anyString(), eq(false), eq(false), anyMap(), captor.capture());
        return captor.getValue();
    }

    private String captureConsumerTag(String queue) throws IOException {
        ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
        verify(controlChannel).basicConsume(eq(queue), eq(false), captor.capture(), eq(false), eq(false), anyMap(), any(Consumer.class));
        return captor.getValue();
    }

    @Test
    @DisplayName("pause 후 resume: prefetch=1 manual-ack consumer를 등록하고, 같은 태그로 cancel 한다")
    void pause_then_resume_scenario() throws Exception {
        QueuePauseState paused = engine.pauseQueue("jobs");

        verify(controlChannel).basicQos(1, false);
        String tag = captureConsumerTag("jobs");
        assertThat(tag).startsWith("pause-jobs-");
        assertThat(paused.queueName()).isEqualTo("jobs");
        assertThat(paused.paused()).isTrue();
        assertThat(paused.pausedAt()).isEqualTo(NOW);
        assertThat(engine.isQueueEnforced("jobs")).isTrue();

        QueuePauseState resumed = engine.resumeQueue("jobs");

        verify(controlChannel).basicCancel(tag);
        assertThat(resumed.paused()).isFalse();
        assertThat(resumed.resumedAt()).isEqualTo(NOW);
        assertThat(engine.isQueueEnforced("jobs")).isFalse();
    }

    @Test
    @DisplayName("consumer는 x-priority 인자와 함께 등록된다")
    void consumer_registered_with_priority_argument() throws Exception {
        engine.pauseQueue("jobs");

        verify(controlChannel).basicConsume(eq("jobs"), eq(false), anyString(), eq(false), eq(false),
                eq(Map.of(AmqpQueuePauseEngine.PRIORITY_ARGUMENT, 255)), any(Consumer.class));
    }

    @Test
    @DisplayName("같은 큐를 두 번 pause 해도 consumer는 한 번만 등록된다")
    void double_pause_registers_single_consumer() throws Exception {
        QueuePauseState first = engine.pauseQueue("jobs");
        QueuePauseState second = engine.pauseQueue("jobs");

        assertThat(first.paused()).isTrue();
        assertThat(second.paused()).isTrue();
        assertThat(second.consumerTag()).isEqualTo(first.consumerTag());
        verify(controlChannel, times(1)).basicConsume(anyString(), anyBoolean(), anyString(), anyBoolean(), anyBoolean(), anyMap(), any(Consumer.class));
    }

    @Test
    @DisplayName("한 번도 pause 되지 않은 큐의 resume은 cancel 없이 paused=false")
    void resume_never_paused_is_noop() throws Exception {
        QueuePauseState state = engine.resumeQueue("idle");

        assertThat(state.paused()).isFalse();
        assertThat(state.resumedAt()).isNull();
        verify(controlChannel, never()).basicCancel(anyString());
        verify(persistence, never()).save(anyString(), any());
    }

    @Test
    @DisplayName("pause → resume → 조회: resumedAt 이 찍히고 pausedAt 이력은 남는다")
    void round_trip_keeps_history() {
        engine.pauseQueue("jobs");
        engine.resumeQueue("jobs");

        QueuePauseState state = engine.getQueuePauseState("jobs");

        assertThat(state.paused()).isFalse();
        assertThat(state.pausedAt()).isEqualTo(NOW);
        assertThat(state.resumedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("영속화 콜백은 매번 전체 스냅샷을 받는다")
    void persistence_receives_full_snapshot() {
        engine.pauseQueue("a");
        engine.pauseQueue("b");

        verify(persistence, times(2)).save(eq(BROKER_ID), snapshotCaptor.capture());

        List<QueuePauseState> second = snapshotCaptor.getAllValues().get(1);
        assertThat(second).extracting(QueuePauseState::queueName).containsExactlyInAnyOrder("a", "b");
        assertThat(second).allMatch(QueuePauseState::paused);
    }

    @Test
    @DisplayName("저장된 스냅샷을 올리면 연결 없이도 paused=true 로 조회된다")
    void loaded_snapshot_is_served_without_broker() throws Exception {
        OffsetDateTime t = NOW.minusDays(1);
        engine.loadPauseStates(List.of(new QueuePauseState("orders", "/", true, t, null, null)));

        QueuePauseState state = engine.getQueuePauseState("orders");

        assertThat(state.paused()).isTrue();
        assertThat(state.pausedAt()).isEqualTo(t);
        assertThat(engine.isQueueEnforced("orders")).isFalse();
        verify(connectionFactory, never()).newConnection(anyString());
    }

    @Test
    @DisplayName("브로커 연결 실패 시 상태는 그대로이고 전송 계층 사유를 담은 BrokerConnectionException")
    void connection_failure_leaves_state_unchanged() throws Exception {
        when(connectionFactory.newConnection(anyString())).thenThrow(new ConnectException("Connection refused"));

        assertThatThrownBy(() -> engine.pauseQueue("jobs"))
                .isInstanceOf(BrokerConnectionException.class)
                .hasMessageContaining("Connection refused");

        assertThat(stateRegistry.size()).isZero();
        assertThat(engine.getQueuePauseState("jobs").paused()).isFalse();
        verify(persistence, never()).save(anyString(), any());
    }

    @Test
    @DisplayName("큐가 없으면(404) BrokerProtocolException, consumer 등록 없음")
    void missing_queue_maps_to_protocol_error() throws Exception {
        AMQP.Channel.Close close = mock(AMQP.Channel.Close.class);
        when(close.getReplyCode()).thenReturn(404);
        when(close.getReplyText()).thenReturn("NOT_FOUND - no queue 'ghost' in vhost '/'");
        IOException notFound = new IOException(new ShutdownSignalException(false, false, close, probeChannel));
        when(probeChannel.queueDeclarePassive("ghost"))
                .thenThrow(notFound);

        assertThatThrownBy(() -> engine.pauseQueue("ghost"))
                .isInstanceOf(BrokerProtocolException.class)
                .hasMessageContaining("NOT_FOUND")
                .satisfies(e -> assertThat(((BrokerProtocolException) e).getReplyCode()).isEqualTo(404));

        verify(controlChannel, never()).basicConsume(anyString(), anyBoolean(), anyString(), anyBoolean(), anyBoolean(), anyMap(), any(Consumer.class));
        assertThat(stateRegistry.getPauseState("ghost")).isEmpty();
        // control channel은 살아있다
        assertThat(engine.isConnected()).isTrue();
    }

    @Test
    @DisplayName("basic.consume 실패 시 상태는 바뀌지 않는다")
    void consume_failure_leaves_state_unchanged() throws Exception {
        doThrow(new IOException("write failed"))
                .when(controlChannel).basicConsume(eq("jobs"), anyBoolean(), anyString(), anyBoolean(), anyBoolean(), anyMap(), any(Consumer.class));

        assertThatThrownBy(() -> engine.pauseQueue("jobs"))
                .isInstanceOf(BrokerConnectionException.class)
                .hasMessageContaining("write failed");

        assertThat(stateRegistry.getPauseState("jobs")).isEmpty();
        assertThat(engine.connectionStatus().heldConsumers()).isZero();
    }

    @Test
    @DisplayName("basic.cancel 실패 시 pause 상태가 유지된다")
    void cancel_failure_keeps_paused() throws Exception {
        engine.pauseQueue("jobs");
        doThrow(new IOException("broken pipe")).when(controlChannel).basicCancel(anyString());

        assertThatThrownBy(() -> engine.resumeQueue("jobs"))
                .isInstanceOf(BrokerConnectionException.class);

        assertThat(engine.getQueuePauseState("jobs").paused()).isTrue();
        assertThat(engine.isQueueEnforced("jobs")).isTrue();
    }

    @Test
    @DisplayName("resume 시 붙잡고 있던 메시지를 건별 nack(requeue=true) 로 돌려준다")
    void resume_requeues_held_delivery() throws Exception {
        engine.pauseQueue("jobs");
        Consumer consumer = captureConsumer("jobs");
        String tag = captureConsumerTag("jobs");
        consumer.handleDelivery(tag, new Envelope(7L, false, "", "jobs"), new AMQP.BasicProperties(), new byte[0]);

        engine.resumeQueue("jobs");

        verify(controlChannel).basicNack(7L, false, true);
        verify(controlChannel, never()).basicAck(anyLong(), anyBoolean());
    }

    @Test
    @DisplayName("cancel 이 반환된 뒤 dispatcher 에서 처리된 delivery 도 resume 때 requeue 된다")
    void delivery_dispatched_after_cancel_returns_is_requeued() throws Exception {
        engine.pauseQueue("jobs");
        String tag = captureConsumerTag("jobs");
        Consumer consumer = consumers.get(tag);

        ExecutorService dispatcher = Executors.newSingleThreadExecutor();
        try {
            // basic.cancel 은 바로 반환되고, 그 전에 도착한 delivery 와 cancel-ok 는 dispatcher 에서 순서대로 실행된다
            doAnswer(inv -> {
                dispatcher.submit(() -> {
                    Thread.sleep(100);
                    consumer.handleDelivery(tag, new Envelope(7L, false, "", "jobs"), new AMQP.BasicProperties(), new byte[0]);
                    consumer.handleCancelOk(tag);
                    return null;
                });
                return null;
            }).when(controlChannel).basicCancel(tag);

            QueuePauseState resumed = engine.resumeQueue("jobs");

            assertThat(resumed.paused()).isFalse();
            verify(controlChannel).basicNack(7L, false, true);
        } finally {
            dispatcher.shutdownNow();
        }
    }

    @Test
    @DisplayName("shutdown 콜백 없이 control channel 이 닫히면 조회에서 resume 으로 정정되고, 다음 pause 는 consumer를 새로 건다")
    void closed_channel_without_callback_is_reconciled_and_rearmed() throws Exception {
        engine.pauseQueue("jobs");
        Channel replacement = mock(Channel.class);
        when(replacement.isOpen()).thenReturn(true);
        when(connection.createChannel()).thenReturn(replacement, probeChannel);

        when(controlChannel.isOpen()).thenReturn(false);

        QueuePauseState state = engine.getQueuePauseState("jobs");
        assertThat(state.paused()).isFalse();
        assertThat(state.resumedAt()).isEqualTo(NOW);
        assertThat(engine.isQueueEnforced("jobs")).isFalse();

        QueuePauseState repaused = engine.pauseQueue("jobs");

        assertThat(repaused.paused()).isTrue();
        assertThat(engine.isQueueEnforced("jobs")).isTrue();
        verify(controlChannel, times(1)).basicConsume(eq("jobs"), eq(false), anyString(), eq(false), eq(false), anyMap(), any(Consumer.class));
        verify(replacement, times(1)).basicConsume(eq("jobs"), eq(false), anyString(), eq(false), eq(false), anyMap(), any(Consumer.class));
    }

    @Test
    @DisplayName("브로커가 consumer를 cancel 하면(큐 삭제) 다음 조회에서 resume 으로 정정된다")
    void broker_cancel_is_reconciled_on_query() throws Exception {
        engine.pauseQueue("jobs");
        Consumer consumer = captureConsumer("jobs");
        String tag = captureConsumerTag("jobs");

        consumer.handleCancel(tag);

        QueuePauseState state = engine.getQueuePauseState("jobs");
        assertThat(state.paused()).isFalse();
        assertThat(state.resumedAt()).isEqualTo(NOW);
        assertThat(engine.getPausedQueues()).isEmpty();
        // pause 1회 + reconcile 1회
        verify(persistence, times(2)).save(eq(BROKER_ID), any());
    }

    @Test
    @DisplayName("disconnect 하면 이 세션에서 pause 한 큐는 resume 으로 기록된다")
    void disconnect_marks_held_queues_resumed() throws Exception {
        engine.pauseQueue("jobs");

        engine.disconnect();

        verify(connection).close();
        assertThat(engine.getQueuePauseState("jobs").paused()).isFalse();
        assertThat(engine.connectionStatus().heldConsumers()).isZero();
        verify(controlChannel, never()).basicCancel(anyString());
    }

    @Test
    @DisplayName("재기동 후 복원된 pause 항목은 다시 pause 하면 consumer를 새로 건다")
    void restored_pause_is_rearmed() throws Exception {
        engine.loadPauseStates(List.of(new QueuePauseState("orders", "/", true, NOW.minusHours(3), null, null)));

        QueuePauseState state = engine.pauseQueue("orders");

        assertThat(state.paused()).isTrue();
        assertThat(state.pausedAt()).isEqualTo(NOW);
        assertThat(engine.isQueueEnforced("orders")).isTrue();
        verify(controlChannel, times(1)).basicConsume(eq("orders"), eq(false), anyString(), eq(false), eq(false), anyMap(), any(Consumer.class));
    }

    @Test
    @DisplayName("재기동 후 복원된 pause 항목의 resume 은 cancel 없이 상태만 바꾼다")
    void restored_pause_resumes_without_cancel() throws Exception {
        engine.loadPauseStates(List.of(new QueuePauseState("orders", "/", true, NOW.minusHours(3), null, null)));

        QueuePauseState state = engine.resumeQueue("orders");

        assertThat(state.paused()).isFalse();
        assertThat(state.resumedAt()).isEqualTo(NOW);
        verify(controlChannel, never()).basicCancel(anyString());
    }

    @Test
    @DisplayName("영속화가 실패해도 pause 는 성공한다")
    void persistence_failure_is_absorbed() {
        doThrow(new IllegalStateException("db down")).when(persistence).save(anyString(), any());

        QueuePauseState state = engine.pauseQueue("jobs");

        assertThat(state.paused()).isTrue();
        assertThat(engine.getQueuePauseState("jobs").paused()).isTrue();
    }

    @Test
    @DisplayName("동시에 같은 큐를 pause 해도 consumer는 하나만 등록된다")
    void concurrent_pause_registers_single_consumer() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<QueuePauseState> f1 = pool.submit(() -> { start.await(); return engine.pauseQueue("jobs"); });
            Future<QueuePauseState> f2 = pool.submit(() -> { start.await(); return engine.pauseQueue("jobs"); });
            start.countDown();

            assertThat(f1.get(5, TimeUnit.SECONDS).paused()).isTrue();
            assertThat(f2.get(5, TimeUnit.SECONDS).paused()).isTrue();
        } finally {
            pool.shutdownNow();
        }
        verify(controlChannel, times(1)).basicConsume(anyString(), anyBoolean(), anyString(), anyBoolean(), anyBoolean(), anyMap(), any(Consumer.class));
    }

    @Test
    @DisplayName("다른 작업이 channel을 점유 중이면 operation timeout 후 PauseOperationTimeoutException")
    void lock_wait_times_out() throws Exception {
        props.setOperationTimeout(Duration.ofMillis(200));
        engine = newEngine();

        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(inv -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return inv.getArgument(2);
        }).when(controlChannel).basicConsume(eq("slow"), anyBoolean(), anyString(), anyBoolean(), anyBoolean(), anyMap(), any(Consumer.class));

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<QueuePauseState> slow = pool.submit(() -> engine.pauseQueue("slow"));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> engine.pauseQueue("other"))
                    .isInstanceOf(PauseOperationTimeoutException.class);

            release.countDown();
            assertThat(slow.get(5, TimeUnit.SECONDS).paused()).isTrue();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("빈 큐 이름은 IllegalArgumentException")
    void blank_queue_name_rejected() {
        assertThatThrownBy(() -> engine.pauseQueue(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
