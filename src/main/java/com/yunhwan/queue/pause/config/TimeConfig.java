package com.yunhwan.queue.pause.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class TimeConfig {
    // pausedAt/resumedAt 모두 이 Clock 기준(UTC)
    @Bean
    public Clock utcClock() {
        return Clock.systemUTC();
    }
}
