package com.yunhwan.queue.pause.infra.messaging.amqp;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "queue-pause")
public class QueuePauseProperties {

    /**
     * pause/resume 1회 상한 (lock 대기 + channel RPC)
     */
    private Duration operationTimeout = Duration.ofSeconds(15);

    /**
     * TCP 연결 + AMQP 핸드셰이크 상한
     */
    private Duration connectionTimeout = Duration.ofSeconds(10);

    private int heartbeatSeconds = 60;

    /**
     * blocking consumer의 x-priority. 0 이하이면 인자를 보내지 않는다.
     */
    private int consumerPriority = 255;

    private String consumerTagPrefix = "pause";

    /**
     * brokerId -> 접속 정보 (자격 증명은 복호화된 값으로 주입)
     */
    private Map<String, Broker> brokers = new LinkedHashMap<>();

    @Getter @Setter
    public static class Broker {
        private String host = "localhost";
        private int amqpPort = 5672;
        private String vhost = "/";
        private String username;
        private String password;
        private boolean tls = false;
    }
}
