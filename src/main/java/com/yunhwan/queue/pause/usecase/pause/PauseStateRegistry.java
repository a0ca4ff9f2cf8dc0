package com.yunhwan.queue.pause.usecase.pause;

import com.yunhwan.queue.pause.domain.pause.QueuePauseState;
import com.yunhwan.queue.pause.usecase.pause.port.PauseStatePersistence;
import lombok.extern.slf4j.Slf4j;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 브로커 하나의 in-memory pause 상태 저장소.
 * <p>
 * 세션 동안의 source of truth는 이 맵이고, DB는 write-through 대상일 뿐이다.
 * 변경이 일어날 때마다 전체 스냅샷을 {@link PauseStatePersistence}로 비동기 전달한다.
 * 영속화 실패는 로그만 남기며 메모리 상태를 되돌리지 않는다.
 */
@Slf4j
public class PauseStateRegistry {

    private final String brokerId;
    private final PauseStatePersistence persistence;
    private final Executor persistenceExecutor;

    private final Map<String, QueuePauseState> states = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public PauseStateRegistry(String brokerId, PauseStatePersistence persistence, Executor persistenceExecutor) {
        this.brokerId = Objects.requireNonNull(brokerId, "brokerId");
        this.persistence = Objects.requireNonNull(persistence, "persistence");
        this.persistenceExecutor = Objects.requireNonNull(persistenceExecutor, "persistenceExecutor");
    }

    /**
     * 같은 큐 이름은 나중에 들어온 값이 덮어쓴다. 연결 전에 호출해도 안전하다.
     * 로드는 영속화 콜백을 트리거하지 않는다.
     */
    public void loadPauseStates(List<QueuePauseState> loaded) {
        if (loaded == null || loaded.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            for (QueuePauseState s : loaded) {
                if (s == null) continue;
                states.put(s.queueName(), s);
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[PauseStateRegistry] loaded. brokerId={}, loaded={}, total={}", brokerId, loaded.size(), size());
    }

    /**
     * 없으면 "한 번도 pause 되지 않음" (= paused=false 로 해석).
     */
    public Optional<QueuePauseState> getPauseState(String queueName) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(states.get(queueName));
        } finally {
            lock.readLock().unlock();
        }
    }

    public QueuePauseState markPaused(String queueName, String vhost, String consumerTag, OffsetDateTime now) {
        lock.writeLock().lock();
        try {
            QueuePauseState current = states.getOrDefault(queueName, QueuePauseState.neverPaused(queueName, vhost));
            QueuePauseState updated = current.pause(consumerTag, now);
            states.put(queueName, updated);
            persistAsync();
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public QueuePauseState markResumed(String queueName, String vhost, OffsetDateTime now) {
        lock.writeLock().lock();
        try {
            QueuePauseState current = states.getOrDefault(queueName, QueuePauseState.neverPaused(queueName, vhost));
            QueuePauseState updated = current.resume(now);
            states.put(queueName, updated);
            persistAsync();
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 현재 항목이 여전히 해당 consumerTag로 pause 중일 때만 resume 처리한다.
     * 그 사이 다른 요청이 다시 pause 했다면 건드리지 않는다.
     */
    public Optional<QueuePauseState> markResumedIfHeldBy(String queueName, String consumerTag, OffsetDateTime now) {
        lock.writeLock().lock();
        try {
            QueuePauseState current = states.get(queueName);
            if (current == null || !current.paused() || !Objects.equals(current.consumerTag(), consumerTag)) {
                return Optional.empty();
            }
            QueuePauseState updated = current.resume(now);
            states.put(queueName, updated);
            persistAsync();
            return Optional.of(updated);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<QueuePauseState> getPausedStates() {
        lock.readLock().lock();
        try {
            return states.values().stream()
                    .filter(QueuePauseState::paused)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<QueuePauseState> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(states.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return states.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * write lock 을 쥔 상태에서만 호출 (제출 순서 = 변경 순서).
     */
    private void persistAsync() {
        List<QueuePauseState> immutable = List.copyOf(states.values());
        try {
            persistenceExecutor.execute(() -> persist(immutable));
        } catch (RejectedExecutionException e) {
            // executor 종료 중(셧다운)이면 영속화만 포기
            log.warn("[PauseStateRegistry] persist rejected. brokerId={}, states={}, err={}",
                    brokerId, immutable.size(), e.toString());
        }
    }

    private void persist(List<QueuePauseState> snapshot) {
        try {
            persistence.save(brokerId, snapshot);
            log.debug("[PauseStateRegistry] persisted. brokerId={}, paused={}, total={}",
                    brokerId, snapshot.stream().filter(QueuePauseState::paused).count(), snapshot.size());
        } catch (Exception e) {
            // 제어 동작(pause/resume)은 이미 브로커에 반영됨 → 영속화 실패는 흡수
            log.warn("[PauseStateRegistry] persist failed. brokerId={}, states={}, err={}",
                    brokerId, snapshot.size(), e.toString());
        }
    }
}
