package com.yunhwan.queue.pause.infra.messaging.amqp;

import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.yunhwan.queue.pause.common.exception.BrokerConnectionException;
import com.yunhwan.queue.pause.domain.pause.BrokerEndpoint;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * 브로커 하나에 대한 AMQP connection 1개 + control channel 1개.
 * <p>
 * 호출 직렬화는 엔진의 operation lock이 담당한다. 재시도하지 않고 상태만 정확히 보고한다.
 */
@Slf4j
public class AmqpConnectionManager {

    static final String CONNECTION_NAME_PREFIX = "queue-pause-";

    private final BrokerEndpoint endpoint;
    private final ConnectionFactory connectionFactory;

    private volatile Connection connection;
    private volatile Channel channel;

    public AmqpConnectionManager(BrokerEndpoint endpoint, ConnectionFactory connectionFactory) {
        this.endpoint = endpoint;
        this.connectionFactory = connectionFactory;
    }

    public boolean isConnected() {
        Connection c = connection;
        Channel ch = channel;
        return c != null && c.isOpen() && ch != null && ch.isOpen();
    }

    /**
     * 이미 연결돼 있으면 no-op.
     */
    public void connect() {
        if (isConnected()) {
            return;
        }
        // 반쯤 죽은 connection/channel 정리 후 새로 연다
        closeResources();

        log.info("[AmqpConnection] connecting. endpoint={}", endpoint);
        Connection newConnection = null;
        try {
            newConnection = connectionFactory.newConnection(CONNECTION_NAME_PREFIX + endpoint.brokerId());
            newConnection.addShutdownListener(cause -> {
                if (cause.isInitiatedByApplication()) {
                    log.info("[AmqpConnection] closed. brokerId={}", endpoint.brokerId());
                } else {
                    log.warn("[AmqpConnection] lost. brokerId={}, reason={}",
                            endpoint.brokerId(), AmqpExceptionTranslator.reason(cause));
                }
            });
            Channel newChannel = newConnection.createChannel();
            if (newChannel == null) {
                throw new IOException("no channel number available");
            }
            this.connection = newConnection;
            this.channel = newChannel;
        } catch (IOException | TimeoutException | RuntimeException e) {
            closeQuietly(newConnection);
            log.error("[AmqpConnection] connect failed. brokerId={}, host={}, port={}, vhost={}, err={}",
                    endpoint.brokerId(), endpoint.host(), endpoint.amqpPort(), endpoint.effectiveVhost(),
                    AmqpExceptionTranslator.reason(e));
            throw AmqpExceptionTranslator.connectFailed(endpoint.brokerId(), e);
        }
        log.info("[AmqpConnection] connected. brokerId={}, channel={}", endpoint.brokerId(), channel.getChannelNumber());
    }

    /**
     * channel이 닫혀 있으면 다시 연결한 뒤 control channel을 돌려준다.
     */
    public Channel ensureConnected() {
        if (!isConnected()) {
            connect();
        }
        Channel ch = channel;
        if (ch == null) {
            throw new BrokerConnectionException(endpoint.brokerId(),
                    "AMQP channel unavailable. brokerId=" + endpoint.brokerId(), null);
        }
        return ch;
    }

    /**
     * 현재 control channel (없으면 null).
     */
    public Channel currentChannel() {
        return channel;
    }

    /**
     * passive declare 전용 임시 channel.
     * 404 로 이 channel이 닫혀도 consumer를 붙잡고 있는 control channel은 영향받지 않는다.
     */
    public Channel openProbeChannel() throws IOException {
        ensureConnected();
        Channel probe = connection.createChannel();
        if (probe == null) {
            throw new IOException("no channel number available");
        }
        return probe;
    }

    /**
     * 이미 끊겨 있으면 no-op. 이 연결 위의 consumer는 브로커가 모두 정리한다.
     */
    public void disconnect() {
        if (connection == null && channel == null) {
            return;
        }
        closeResources();
        log.info("[AmqpConnection] disconnected. brokerId={}", endpoint.brokerId());
    }

    public void closeQuietly(Channel ch) {
        if (ch == null) return;
        try {
            if (ch.isOpen()) {
                ch.close();
            }
        } catch (IOException | TimeoutException | AlreadyClosedException e) {
            log.debug("[AmqpConnection] channel close ignored. brokerId={}, err={}", endpoint.brokerId(), e.toString());
        }
    }

    private void closeQuietly(Connection c) {
        if (c == null) return;
        try {
            if (c.isOpen()) {
                c.close();
            }
        } catch (IOException | AlreadyClosedException e) {
            log.debug("[AmqpConnection] connection close ignored. brokerId={}, err={}", endpoint.brokerId(), e.toString());
        }
    }

    private void closeResources() {
        Channel ch = channel;
        Connection c = connection;
        channel = null;
        connection = null;
        // channel 먼저, 그다음 connection
        closeQuietly(ch);
        closeQuietly(c);
    }
}
