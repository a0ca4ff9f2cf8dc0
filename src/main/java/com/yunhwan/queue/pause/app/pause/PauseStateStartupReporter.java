package com.yunhwan.queue.pause.app.pause;

import com.yunhwan.queue.pause.domain.pause.QueuePauseState;
import com.yunhwan.queue.pause.usecase.pause.QueuePauseEngine;
import com.yunhwan.queue.pause.usecase.pause.QueuePauseEngineRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 기동 시 저장된 pause 상태를 올리고, 재등록되지 않은(미검증) pause 큐를 알린다.
 * 재기동 후 consumer를 자동으로 다시 걸지는 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PauseStateStartupReporter implements ApplicationRunner {

    private final QueuePauseEngineRegistry engineRegistry;

    @Override
    public void run(ApplicationArguments args) {
        for (String brokerId : engineRegistry.brokerIds()) {
            try {
                QueuePauseEngine engine = engineRegistry.engine(brokerId);
                List<String> unenforced = engine.getPausedQueues().stream()
                        .map(QueuePauseState::queueName)
                        .filter(q -> !engine.isQueueEnforced(q))
                        .toList();
                if (unenforced.isEmpty()) {
                    log.info("[QueuePause] startup. brokerId={}, unenforcedPaused=0", brokerId);
                } else {
                    log.warn("[QueuePause] startup: paused queues not enforced until paused again. brokerId={}, count={}, queues={}",
                            brokerId, unenforced.size(), unenforced);
                }
            } catch (RuntimeException e) {
                log.warn("[QueuePause] startup load failed. brokerId={}, err={}", brokerId, e.toString());
            }
        }
    }
}
