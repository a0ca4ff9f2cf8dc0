package com.yunhwan.queue.pause.usecase.pause;

import com.yunhwan.queue.pause.common.exception.BrokerNotFoundException;
import com.yunhwan.queue.pause.domain.pause.BrokerEndpoint;
import com.yunhwan.queue.pause.domain.pause.QueuePauseState;
import com.yunhwan.queue.pause.usecase.pause.port.BrokerEndpointResolver;
import com.yunhwan.queue.pause.usecase.pause.port.PauseStatePersistence;
import com.yunhwan.queue.pause.usecase.pause.port.PauseStateSnapshotSource;
import com.yunhwan.queue.pause.usecase.pause.port.QueuePauseEngineFactory;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * brokerId 별 엔진을 지연 생성해서 보관한다.
 * 생성 시 저장된 스냅샷을 먼저 올린 뒤에야 호출자에게 돌려준다.
 */
@Slf4j
@Service
public class QueuePauseEngineRegistry {

    private final BrokerEndpointResolver endpointResolver;
    private final QueuePauseEngineFactory engineFactory;
    private final PauseStatePersistence persistence;
    private final PauseStateSnapshotSource snapshotSource;
    private final Executor persistenceExecutor;

    private final Map<String, QueuePauseEngine> engines = new ConcurrentHashMap<>();

    public QueuePauseEngineRegistry(
            BrokerEndpointResolver endpointResolver,
            QueuePauseEngineFactory engineFactory,
            PauseStatePersistence persistence,
            PauseStateSnapshotSource snapshotSource,
            @Qualifier("pauseStatePersistenceExecutor") Executor persistenceExecutor
    ) {
        this.endpointResolver = endpointResolver;
        this.engineFactory = engineFactory;
        this.persistence = persistence;
        this.snapshotSource = snapshotSource;
        this.persistenceExecutor = persistenceExecutor;
    }

    public QueuePauseEngine engine(String brokerId) {
        QueuePauseEngine existing = engines.get(brokerId);
        if (existing != null) {
            return existing;
        }
        // 없는 brokerId는 맵에 넣지 않는다
        BrokerEndpoint endpoint = endpointResolver.resolve(brokerId)
                .orElseThrow(() -> new BrokerNotFoundException(brokerId));
        return engines.computeIfAbsent(brokerId, id -> createEngine(endpoint));
    }

    public Set<String> brokerIds() {
        return endpointResolver.brokerIds();
    }

    @PreDestroy
    public void shutdown() {
        engines.forEach((brokerId, engine) -> {
            try {
                engine.disconnect();
            } catch (RuntimeException e) {
                log.warn("[QueuePauseEngineRegistry] disconnect on shutdown failed. brokerId={}, err={}",
                        brokerId, e.toString());
            }
        });
        engines.clear();
    }

    private QueuePauseEngine createEngine(BrokerEndpoint endpoint) {
        PauseStateRegistry stateRegistry =
                new PauseStateRegistry(endpoint.brokerId(), persistence, persistenceExecutor);
        QueuePauseEngine engine = engineFactory.create(endpoint, stateRegistry);

        List<QueuePauseState> persisted = snapshotSource.load(endpoint.brokerId());
        engine.loadPauseStates(persisted);
        log.info("[QueuePauseEngineRegistry] engine created. endpoint={}, persistedStates={}",
                endpoint, persisted.size());
        return engine;
    }
}
