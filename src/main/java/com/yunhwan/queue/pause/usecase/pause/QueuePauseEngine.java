package com.yunhwan.queue.pause.usecase.pause;

import com.yunhwan.queue.pause.domain.pause.QueuePauseState;
import com.yunhwan.queue.pause.usecase.pause.dto.BrokerConnectionStatus;

import java.util.List;

/**
 * 브로커 하나에 대한 큐 pause/resume 제어.
 * <p>
 * RabbitMQ에는 큐 단위 pause가 없다. pause는 prefetch=1 manual-ack consumer가
 * 메시지 하나를 ack 없이 붙잡는 방식이라, flow control 되지 않는 다른 consumer가
 * 있으면 큐는 계속 소비된다. 운영자에게 이 한계를 그대로 안내해야 한다.
 */
public interface QueuePauseEngine {

    String brokerId();

    void connect();

    void disconnect();

    boolean isConnected();

    /**
     * 이미 pause 상태(그리고 이 세션에서 consumer를 점유 중)이면 현재 상태를 그대로 돌려준다.
     */
    QueuePauseState pauseQueue(String queueName);

    /**
     * pause 상태가 아니면 cancel 없이 현재 상태를 돌려준다.
     */
    QueuePauseState resumeQueue(String queueName);

    /**
     * 브로커 호출 없음. 없으면 paused=false 기본값.
     */
    QueuePauseState getQueuePauseState(String queueName);

    /**
     * pause 상태이면서 현재 연결에서 blocking consumer를 실제로 점유하고 있는지.
     */
    boolean isQueueEnforced(String queueName);

    List<QueuePauseState> getPausedQueues();

    BrokerConnectionStatus connectionStatus();

    void loadPauseStates(List<QueuePauseState> states);
}
