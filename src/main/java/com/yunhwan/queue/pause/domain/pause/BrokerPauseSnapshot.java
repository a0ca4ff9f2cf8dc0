package com.yunhwan.queue.pause.domain.pause;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;

/**
 * 브로커별 pause 상태 스냅샷 (큐 이름 → 상태 JSON).
 */
@Getter
@Entity
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "broker_queue_pause_state")
public class BrokerPauseSnapshot {

    @Id
    @Column(name = "broker_id", nullable = false, length = 100)
    private String brokerId;

    /**
     * PostgreSQL jsonb 컬럼. 스냅샷 전체를 통째로 덮어쓴다.
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "pause_states", nullable = false, columnDefinition = "jsonb")
    private String pauseStates;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;
}
