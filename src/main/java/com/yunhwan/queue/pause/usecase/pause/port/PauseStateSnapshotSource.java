package com.yunhwan.queue.pause.usecase.pause.port;

import com.yunhwan.queue.pause.domain.pause.QueuePauseState;

import java.util.List;

public interface PauseStateSnapshotSource {

    /**
     * 저장된 스냅샷이 없으면 빈 리스트.
     */
    List<QueuePauseState> load(String brokerId);
}
