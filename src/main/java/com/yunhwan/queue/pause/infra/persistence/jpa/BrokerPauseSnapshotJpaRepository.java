package com.yunhwan.queue.pause.infra.persistence.jpa;

import com.yunhwan.queue.pause.domain.pause.BrokerPauseSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Optional;

public interface BrokerPauseSnapshotJpaRepository extends JpaRepository<BrokerPauseSnapshot, String> {

    /**
     * 브로커 스냅샷 전체를 덮어쓴다 (없으면 생성).
     */
    @Transactional
    @Modifying
    @Query(value = """
    insert into broker_queue_pause_state (broker_id, pause_states, updated_at)
    values (:brokerId, cast(:pauseStates as jsonb), :now)
    on conflict (broker_id) do update
       set pause_states = excluded.pause_states,
           updated_at = excluded.updated_at
    """, nativeQuery = true)
    int upsertSnapshot(@Param("brokerId") String brokerId,
                       @Param("pauseStates") String pauseStatesJson,
                       @Param("now") OffsetDateTime now);

    @Query(value = """
    select cast(pause_states as text)
      from broker_queue_pause_state
     where broker_id = :brokerId
    """, nativeQuery = true)
    Optional<String> findPauseStatesJson(@Param("brokerId") String brokerId);
}
