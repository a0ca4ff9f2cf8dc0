package com.yunhwan.queue.pause.infra.scheduling.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class PauseStatePersistenceExecutorConfig {

    @Bean
    public ThreadPoolTaskExecutor pauseStatePersistenceExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1); // 스냅샷 저장 순서 보장
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("pause-persist-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
