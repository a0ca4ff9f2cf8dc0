package com.yunhwan.queue.pause.usecase.pause.port;

import com.yunhwan.queue.pause.domain.pause.QueuePauseState;

import java.util.List;

/**
 * pause 상태 변경 후 호출되는 영속화 포트.
 * - 항상 브로커의 전체 스냅샷을 넘긴다 (delta 아님) → 멱등, 순서 뒤바뀜에도 안전
 * - 실패는 호출 측에서 로그만 남기고 흡수한다
 */
public interface PauseStatePersistence {

    void save(String brokerId, List<QueuePauseState> states);
}
