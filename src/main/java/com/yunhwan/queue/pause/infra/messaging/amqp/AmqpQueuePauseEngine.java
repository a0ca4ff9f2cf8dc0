package com.yunhwan.queue.pause.infra.messaging.amqp;

import com.rabbitmq.client.Channel;
import com.yunhwan.queue.pause.common.exception.PauseOperationTimeoutException;
import com.yunhwan.queue.pause.domain.pause.BrokerEndpoint;
import com.yunhwan.queue.pause.domain.pause.QueuePauseState;
import com.yunhwan.queue.pause.infra.logging.QueuePauseEventLogger;
import com.yunhwan.queue.pause.usecase.pause.PauseStateRegistry;
import com.yunhwan.queue.pause.usecase.pause.QueuePauseEngine;
import com.yunhwan.queue.pause.usecase.pause.dto.BrokerConnectionStatus;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * AMQP 0-9-1 blocking consumer 방식의 pause 엔진 (브로커 1개 담당).
 * <p>
 * pause: 큐에 manual-ack, prefetch=1 consumer를 붙이고 받은 1건을 ack 하지 않는다.
 * resume: 해당 consumer를 cancel 하고 붙잡고 있던 메시지를 requeue 한다.
 * <p>
 * 하나의 channel을 공유하므로 모든 프로토콜 작업은 operation lock으로 직렬화한다.
 * 조회는 lock 없이 메모리 상태만 본다.
 */
@Slf4j
public class AmqpQueuePauseEngine implements QueuePauseEngine, HoldingConsumer.LossListener {

    static final int PREFETCH_COUNT = 1;
    static final String PRIORITY_ARGUMENT = "x-priority";

    // AMQP short string 상한
    private static final int MAX_CONSUMER_TAG_LENGTH = 255;

    private final BrokerEndpoint endpoint;
    private final AmqpConnectionManager connectionManager;
    private final PauseStateRegistry stateRegistry;
    private final QueuePauseEventLogger eventLogger;
    private final Clock clock;

    private final Duration operationTimeout;
    private final int consumerPriority;
    private final String consumerTagPrefix;

    private final ReentrantLock operationLock = new ReentrantLock();

    // consumerTag -> 현재 control channel에서 점유 중인 consumer
    private final Map<String, HoldingConsumer> heldConsumers = new ConcurrentHashMap<>();
    // consumerTag -> 이번 세션에서 브로커가 끊은 사유 (다음 조회 때 reconcile)
    private final Map<String, String> lostConsumers = new ConcurrentHashMap<>();

    public AmqpQueuePauseEngine(
            BrokerEndpoint endpoint,
            AmqpConnectionManager connectionManager,
            PauseStateRegistry stateRegistry,
            QueuePauseProperties props,
            QueuePauseEventLogger eventLogger,
            Clock clock
    ) {
        this.endpoint = endpoint;
        this.connectionManager = connectionManager;
        this.stateRegistry = stateRegistry;
        this.eventLogger = eventLogger;
        this.clock = clock;
        this.operationTimeout = props.getOperationTimeout();
        this.consumerPriority = props.getConsumerPriority();
        this.consumerTagPrefix = props.getConsumerTagPrefix();
    }

    @Override
    public String brokerId() {
        return endpoint.brokerId();
    }

    @Override
    public void connect() {
        withOperationLock("connect", () -> {
            connectionManager.connect();
            sweepStaleConsumers();
            return null;
        });
    }

    /**
     * 연결을 끊으면 브로커가 consumer를 모두 버린다 → 이 세션에서 pause 한 큐는 즉시 resume으로 기록.
     */
    @Override
    public void disconnect() {
        withOperationLock("disconnect", () -> {
            heldConsumers.forEach((tag, consumer) -> lostConsumers.put(tag, "disconnected"));
            heldConsumers.clear();
            connectionManager.disconnect();
            reconcileAll();
            return null;
        });
    }

    @Override
    public boolean isConnected() {
        return connectionManager.isConnected();
    }

    @Override
    public QueuePauseState pauseQueue(String queueName) {
        requireQueueName(queueName);
        return withOperationLock("pause", () -> {
            Channel channel = connectionManager.ensureConnected();
            sweepStaleConsumers();
            reconcile(queueName);

            QueuePauseState current = stateRegistry.getPauseState(queueName).orElse(null);
            if (current != null && current.paused() && isHeld(current)) {
                // 동시 요청/더블클릭: consumer를 두 번 걸지 않는다
                log.info("[QueuePause] already paused -> noop. brokerId={}, queue={}, consumerTag={}",
                        brokerId(), queueName, current.consumerTag());
                return current;
            }
            boolean rearm = current != null && current.paused();
            if (rearm) {
                log.warn("[QueuePause] paused state not enforced on this connection -> re-arming. brokerId={}, queue={}, pausedAt={}",
                        brokerId(), queueName, current.pausedAt());
            }

            verifyQueueExists(queueName);

            String consumerTag = newConsumerTag(queueName);
            HoldingConsumer consumer = new HoldingConsumer(channel, queueName, this);
            // 등록 직후 브로커 cancel이 와도 놓치지 않도록 먼저 넣어둔다
            heldConsumers.put(consumerTag, consumer);
            try {
                channel.basicQos(PREFETCH_COUNT, false);
                channel.basicConsume(queueName, false, consumerTag, false, false, consumerArguments(), consumer);
            } catch (IOException | RuntimeException e) {
                heldConsumers.remove(consumerTag);
                log.error("[QueuePause] pause failed. brokerId={}, queue={}, err={}",
                        brokerId(), queueName, AmqpExceptionTranslator.reason(e));
                throw AmqpExceptionTranslator.operationFailed(brokerId(), "basic.consume", e);
            }

            QueuePauseState paused = stateRegistry.markPaused(queueName, endpoint.effectiveVhost(), consumerTag, now());
            log.info("[QueuePause] paused. brokerId={}, queue={}, consumerTag={}, pausedAt={}",
                    brokerId(), queueName, consumerTag, paused.pausedAt());
            eventLogger.paused(brokerId(), paused, rearm);
            return paused;
        });
    }

    @Override
    public QueuePauseState resumeQueue(String queueName) {
        requireQueueName(queueName);
        return withOperationLock("resume", () -> {
            Channel channel = connectionManager.ensureConnected();
            sweepStaleConsumers();
            reconcile(queueName);

            QueuePauseState current = stateRegistry.getPauseState(queueName).orElse(null);
            if (current == null || !current.paused()) {
                log.info("[QueuePause] not paused -> noop. brokerId={}, queue={}", brokerId(), queueName);
                return current != null ? current : QueuePauseState.neverPaused(queueName, endpoint.effectiveVhost());
            }

            HoldingConsumer consumer = current.hasConsumerTag() ? heldConsumers.get(current.consumerTag()) : null;
            int requeued = 0;
            if (consumer != null) {
                try {
                    channel.basicCancel(current.consumerTag());
                } catch (IOException | RuntimeException e) {
                    log.error("[QueuePause] resume failed. brokerId={}, queue={}, consumerTag={}, err={}",
                            brokerId(), queueName, current.consumerTag(), AmqpExceptionTranslator.reason(e));
                    throw AmqpExceptionTranslator.operationFailed(brokerId(), "basic.cancel", e);
                }
                heldConsumers.remove(current.consumerTag());
                if (!consumer.awaitCancelOk(operationTimeout)) {
                    log.warn("[QueuePause] cancel-ok not observed in time, releasing held deliveries anyway. brokerId={}, queue={}, consumerTag={}",
                            brokerId(), queueName, current.consumerTag());
                }
                requeued = consumer.releaseHeldDeliveries();
            } else {
                // 스냅샷에서 복원된 pause 이거나 이미 브로커가 끊은 consumer → 취소할 대상이 없다
                log.warn("[QueuePause] no held consumer, marking resumed only. brokerId={}, queue={}",
                        brokerId(), queueName);
            }

            QueuePauseState resumed = stateRegistry.markResumed(queueName, endpoint.effectiveVhost(), now());
            log.info("[QueuePause] resumed. brokerId={}, queue={}, requeued={}, resumedAt={}",
                    brokerId(), queueName, requeued, resumed.resumedAt());
            eventLogger.resumed(brokerId(), resumed, requeued, consumer != null);
            return resumed;
        });
    }

    @Override
    public QueuePauseState getQueuePauseState(String queueName) {
        requireQueueName(queueName);
        sweepStaleConsumers();
        reconcile(queueName);
        return stateRegistry.getPauseState(queueName)
                .orElseGet(() -> QueuePauseState.neverPaused(queueName, endpoint.effectiveVhost()));
    }

    @Override
    public boolean isQueueEnforced(String queueName) {
        QueuePauseState state = stateRegistry.getPauseState(queueName).orElse(null);
        return state != null && state.paused() && isHeld(state);
    }

    @Override
    public List<QueuePauseState> getPausedQueues() {
        sweepStaleConsumers();
        reconcileAll();
        return stateRegistry.getPausedStates();
    }

    @Override
    public BrokerConnectionStatus connectionStatus() {
        return new BrokerConnectionStatus(brokerId(), connectionManager.isConnected(), heldConsumers.size());
    }

    @Override
    public void loadPauseStates(List<QueuePauseState> states) {
        stateRegistry.loadPauseStates(states);
    }

    /**
     * {@link HoldingConsumer} 콜백 (amqp-client dispatch thread).
     * 우리가 cancel/disconnect 한 consumer는 이미 heldConsumers에서 빠져 있으므로 무시된다.
     */
    @Override
    public void consumerLost(String consumerTag, String reason) {
        HoldingConsumer removed = heldConsumers.remove(consumerTag);
        if (removed == null) {
            return;
        }
        lostConsumers.put(consumerTag, reason == null ? "unknown" : reason);
        log.warn("[QueuePause] blocking consumer dropped by broker. brokerId={}, queue={}, consumerTag={}, reason={}",
                brokerId(), removed.queueName(), consumerTag, reason);
    }

    private boolean isHeld(QueuePauseState state) {
        if (!state.hasConsumerTag()) {
            return false;
        }
        HoldingConsumer consumer = heldConsumers.get(state.consumerTag());
        return consumer != null
                && consumer.getChannel() == connectionManager.currentChannel()
                && connectionManager.isConnected();
    }

    /**
     * control channel이 바뀌었거나 닫혔는데 shutdown 콜백이 아직 안 온 consumer를 정리한다.
     * 브로커 호출 없이 로컬 channel 상태만 본다.
     */
    private void sweepStaleConsumers() {
        Channel current = connectionManager.currentChannel();
        heldConsumers.forEach((tag, consumer) -> {
            if (consumer.getChannel() != current || current == null || !current.isOpen()) {
                consumerLost(tag, "channel closed");
            }
        });
    }

    private void reconcile(String queueName) {
        QueuePauseState current = stateRegistry.getPauseState(queueName).orElse(null);
        if (current == null || !current.paused() || !current.hasConsumerTag()) {
            return;
        }
        String reason = lostConsumers.remove(current.consumerTag());
        if (reason == null) {
            return;
        }
        stateRegistry.markResumedIfHeldBy(queueName, current.consumerTag(), now())
                .ifPresent(resumed -> {
                    log.warn("[QueuePause] reconciled to resumed. brokerId={}, queue={}, consumerTag={}, reason={}",
                            brokerId(), queueName, current.consumerTag(), reason);
                    eventLogger.reconciled(brokerId(), resumed, reason);
                });
    }

    private void reconcileAll() {
        if (lostConsumers.isEmpty()) {
            return;
        }
        for (QueuePauseState s : stateRegistry.getPausedStates()) {
            reconcile(s.queueName());
        }
    }

    /**
     * passive declare는 임시 channel에서 한다 (404 가 나면 그 channel이 닫히기 때문).
     */
    private void verifyQueueExists(String queueName) {
        Channel probe = null;
        try {
            probe = connectionManager.openProbeChannel();
            probe.queueDeclarePassive(queueName);
        } catch (IOException | RuntimeException e) {
            log.warn("[QueuePause] queue check failed. brokerId={}, queue={}, err={}",
                    brokerId(), queueName, AmqpExceptionTranslator.reason(e));
            throw AmqpExceptionTranslator.operationFailed(brokerId(), "queue.declare(passive)", e);
        } finally {
            connectionManager.closeQuietly(probe);
        }
    }

    private Map<String, Object> consumerArguments() {
        if (consumerPriority <= 0) {
            return Map.of();
        }
        return Map.of(PRIORITY_ARGUMENT, consumerPriority);
    }

    private String newConsumerTag(String queueName) {
        String suffix = UUID.randomUUID().toString();
        String tag = consumerTagPrefix + "-" + queueName + "-" + suffix;
        if (tag.length() > MAX_CONSUMER_TAG_LENGTH) {
            return consumerTagPrefix + "-" + suffix;
        }
        return tag;
    }

    private <T> T withOperationLock(String operation, Supplier<T> action) {
        boolean acquired;
        try {
            acquired = operationLock.tryLock(operationTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PauseOperationTimeoutException(
                    operation + " interrupted while waiting for broker channel. brokerId=" + brokerId(), e);
        }
        if (!acquired) {
            throw new PauseOperationTimeoutException(
                    operation + " timed out waiting for broker channel. brokerId=" + brokerId()
                            + ", timeout=" + operationTimeout);
        }
        try {
            return action.get();
        } finally {
            operationLock.unlock();
        }
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    private static void requireQueueName(String queueName) {
        if (queueName == null || queueName.isBlank()) {
            throw new IllegalArgumentException("queueName must not be blank");
        }
    }
}
