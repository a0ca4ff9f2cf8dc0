package com.yunhwan.queue.pause.domain.pause;

/**
 * AMQP 접속 정보. password는 이미 복호화된 값으로 들어온다.
 */
public record BrokerEndpoint(
        String brokerId,
        String host,
        int amqpPort,
        String vhost,
        String username,
        String password,
        boolean tls
) {

    public static final int DEFAULT_AMQP_PORT = 5672;
    public static final String DEFAULT_VHOST = "/";

    public String effectiveVhost() {
        return vhost == null || vhost.isBlank() ? DEFAULT_VHOST : vhost;
    }

    // password 로그 노출 금지
    @Override
    public String toString() {
        return "BrokerEndpoint[brokerId=" + brokerId
                + ", host=" + host
                + ", amqpPort=" + amqpPort
                + ", vhost=" + effectiveVhost()
                + ", username=" + username
                + ", tls=" + tls + "]";
    }
}
