package com.yunhwan.queue.pause.infra.messaging.amqp;

import com.rabbitmq.client.ConnectionFactory;
import com.yunhwan.queue.pause.domain.pause.BrokerEndpoint;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import javax.net.ssl.SSLContext;
import java.security.NoSuchAlgorithmException;

/**
 * 브로커별 amqp-client {@link ConnectionFactory} 구성.
 */
@Component
@RequiredArgsConstructor
public class AmqpConnectionFactoryBuilder {

    private final QueuePauseProperties props;

    public ConnectionFactory build(BrokerEndpoint endpoint) {
        ConnectionFactory factory = new ConnectionFactory();
        factory.setHost(endpoint.host());
        factory.setPort(endpoint.amqpPort());
        factory.setVirtualHost(endpoint.effectiveVhost());
        factory.setUsername(endpoint.username());
        factory.setPassword(endpoint.password());

        int connectTimeoutMs = toIntMillis(props.getConnectionTimeout().toMillis());
        factory.setConnectionTimeout(connectTimeoutMs);
        factory.setHandshakeTimeout(connectTimeoutMs);
        // 응답 없는 브로커가 요청을 무한정 붙잡지 않도록 RPC 상한
        factory.setChannelRpcTimeout(toIntMillis(props.getOperationTimeout().toMillis()));
        factory.setRequestedHeartbeat(props.getHeartbeatSeconds());

        // 재연결 시 blocking consumer가 몰래 재등록되면 안 됨 (재시도는 호출자 몫)
        factory.setAutomaticRecoveryEnabled(false);
        factory.setTopologyRecoveryEnabled(false);

        if (endpoint.tls()) {
            try {
                factory.useSslProtocol(SSLContext.getDefault());
                factory.enableHostnameVerification();
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException("default SSLContext unavailable. brokerId=" + endpoint.brokerId(), e);
            }
        }
        return factory;
    }

    private static int toIntMillis(long millis) {
        return (int) Math.min(Integer.MAX_VALUE, Math.max(0, millis));
    }
}
