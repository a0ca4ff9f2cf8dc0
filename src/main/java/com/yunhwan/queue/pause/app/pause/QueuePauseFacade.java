package com.yunhwan.queue.pause.app.pause;

import com.yunhwan.queue.pause.app.api.pause.dto.BrokerConnectionResponse;
import com.yunhwan.queue.pause.app.api.pause.dto.QueuePauseResponse;
import com.yunhwan.queue.pause.common.exception.PauseOperationTimeoutException;
import com.yunhwan.queue.pause.domain.pause.QueuePauseState;
import com.yunhwan.queue.pause.infra.metrics.MetricsConfig;
import com.yunhwan.queue.pause.usecase.pause.QueuePauseEngine;
import com.yunhwan.queue.pause.usecase.pause.QueuePauseEngineRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;

@Service
@RequiredArgsConstructor
public class QueuePauseFacade {

    static final String METHOD_PAUSE = "AMQP blocking consumer";
    static final String METHOD_RESUME = "AMQP consumer cancellation";

    private final QueuePauseEngineRegistry engineRegistry;
    private final MeterRegistry meterRegistry;

    public QueuePauseResponse pause(String brokerId, String queueName) {
        QueuePauseEngine engine = engineRegistry.engine(brokerId);
        QueuePauseState before = engine.getQueuePauseState(queueName);
        boolean wasEnforced = engine.isQueueEnforced(queueName);

        QueuePauseState after = measured(MetricsConfig.ACTION_PAUSE, () -> engine.pauseQueue(queueName),
                s -> before.paused() && wasEnforced && Objects.equals(before.consumerTag(), s.consumerTag()));
        return QueuePauseResponse.of(after, engine.isQueueEnforced(queueName), METHOD_PAUSE);
    }

    public QueuePauseResponse resume(String brokerId, String queueName) {
        QueuePauseEngine engine = engineRegistry.engine(brokerId);
        boolean wasPaused = engine.getQueuePauseState(queueName).paused();

        QueuePauseState after = measured(MetricsConfig.ACTION_RESUME, () -> engine.resumeQueue(queueName),
                s -> !wasPaused);
        return QueuePauseResponse.of(after, engine.isQueueEnforced(queueName), METHOD_RESUME);
    }

    public QueuePauseResponse status(String brokerId, String queueName) {
        QueuePauseEngine engine = engineRegistry.engine(brokerId);
        QueuePauseState state = engine.getQueuePauseState(queueName);
        return QueuePauseResponse.of(state, engine.isQueueEnforced(queueName), null);
    }

    public List<QueuePauseResponse> pausedQueues(String brokerId) {
        QueuePauseEngine engine = engineRegistry.engine(brokerId);
        return engine.getPausedQueues().stream()
                .map(s -> QueuePauseResponse.of(s, engine.isQueueEnforced(s.queueName()), null))
                .toList();
    }

    public BrokerConnectionResponse connection(String brokerId) {
        return BrokerConnectionResponse.from(engineRegistry.engine(brokerId).connectionStatus());
    }

    public BrokerConnectionResponse connect(String brokerId) {
        QueuePauseEngine engine = engineRegistry.engine(brokerId);
        boolean wasConnected = engine.isConnected();
        measured(MetricsConfig.ACTION_CONNECT, () -> {
            engine.connect();
            return Boolean.TRUE;
        }, ignored -> wasConnected);
        return BrokerConnectionResponse.from(engine.connectionStatus());
    }

    public BrokerConnectionResponse disconnect(String brokerId) {
        QueuePauseEngine engine = engineRegistry.engine(brokerId);
        boolean wasConnected = engine.isConnected();
        measured(MetricsConfig.ACTION_DISCONNECT, () -> {
            engine.disconnect();
            return Boolean.TRUE;
        }, ignored -> !wasConnected);
        return BrokerConnectionResponse.from(engine.connectionStatus());
    }

    private <T> T measured(String action, Supplier<T> command, Predicate<T> noop) {
        try {
            T result = command.get();
            commandCounter(action, noop.test(result) ? MetricsConfig.RESULT_NOOP : MetricsConfig.RESULT_SUCCESS).increment();
            return result;
        } catch (PauseOperationTimeoutException e) {
            commandCounter(action, MetricsConfig.RESULT_TIMEOUT).increment();
            throw e;
        } catch (RuntimeException e) {
            commandCounter(action, MetricsConfig.RESULT_ERROR).increment();
            throw e;
        }
    }

    private Counter commandCounter(String action, String result) {
        // action+result만 사용 (큐 이름/브로커 ID 금지)
        return Counter.builder(MetricsConfig.METRIC_COMMAND)
                .tag(MetricsConfig.TAG_ACTION, action)
                .tag(MetricsConfig.TAG_RESULT, result)
                .register(meterRegistry);
    }
}
