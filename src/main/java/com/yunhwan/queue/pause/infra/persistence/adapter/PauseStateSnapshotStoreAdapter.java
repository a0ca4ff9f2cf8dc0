package com.yunhwan.queue.pause.infra.persistence.adapter;

import com.yunhwan.queue.pause.domain.pause.QueuePauseState;
import com.yunhwan.queue.pause.infra.persistence.jpa.BrokerPauseSnapshotJpaRepository;
import com.yunhwan.queue.pause.infra.persistence.serializer.JacksonPauseStateSnapshotSerializer;
import com.yunhwan.queue.pause.usecase.pause.port.PauseStatePersistence;
import com.yunhwan.queue.pause.usecase.pause.port.PauseStateSnapshotSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

@Slf4j
@Repository
@RequiredArgsConstructor
@Transactional
public class PauseStateSnapshotStoreAdapter implements PauseStatePersistence, PauseStateSnapshotSource {

    private final BrokerPauseSnapshotJpaRepository repo;
    private final JacksonPauseStateSnapshotSerializer serializer;
    private final Clock clock;

    @Override
    public void save(String brokerId, List<QueuePauseState> states) {
        repo.upsertSnapshot(brokerId, serializer.serialize(states), OffsetDateTime.now(clock));
    }

    @Override
    @Transactional(readOnly = true)
    public List<QueuePauseState> load(String brokerId) {
        return repo.findPauseStatesJson(brokerId)
                .map(serializer::deserialize)
                .orElseGet(List::of);
    }
}
