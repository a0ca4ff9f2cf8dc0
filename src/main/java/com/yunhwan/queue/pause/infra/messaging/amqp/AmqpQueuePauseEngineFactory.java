package com.yunhwan.queue.pause.infra.messaging.amqp;

import com.yunhwan.queue.pause.domain.pause.BrokerEndpoint;
import com.yunhwan.queue.pause.infra.logging.QueuePauseEventLogger;
import com.yunhwan.queue.pause.infra.metrics.MetricsConfig;
import com.yunhwan.queue.pause.usecase.pause.PauseStateRegistry;
import com.yunhwan.queue.pause.usecase.pause.QueuePauseEngine;
import com.yunhwan.queue.pause.usecase.pause.port.QueuePauseEngineFactory;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
@RequiredArgsConstructor
public class AmqpQueuePauseEngineFactory implements QueuePauseEngineFactory {

    private final AmqpConnectionFactoryBuilder connectionFactoryBuilder;
    private final QueuePauseProperties props;
    private final QueuePauseEventLogger eventLogger;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Override
    public QueuePauseEngine create(BrokerEndpoint endpoint, PauseStateRegistry stateRegistry) {
        AmqpConnectionManager connectionManager =
                new AmqpConnectionManager(endpoint, connectionFactoryBuilder.build(endpoint));
        AmqpQueuePauseEngine engine =
                new AmqpQueuePauseEngine(endpoint, connectionManager, stateRegistry, props, eventLogger, clock);

        // broker 단위 태그만 (큐 이름 금지)
        Gauge.builder(MetricsConfig.METRIC_HELD_CONSUMERS, engine, e -> e.connectionStatus().heldConsumers())
                .tag(MetricsConfig.TAG_BROKER, endpoint.brokerId())
                .register(meterRegistry);
        return engine;
    }
}
