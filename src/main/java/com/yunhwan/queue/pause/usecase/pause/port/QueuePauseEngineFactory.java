package com.yunhwan.queue.pause.usecase.pause.port;

import com.yunhwan.queue.pause.domain.pause.BrokerEndpoint;
import com.yunhwan.queue.pause.usecase.pause.PauseStateRegistry;
import com.yunhwan.queue.pause.usecase.pause.QueuePauseEngine;

public interface QueuePauseEngineFactory {

    QueuePauseEngine create(BrokerEndpoint endpoint, PauseStateRegistry stateRegistry);
}
