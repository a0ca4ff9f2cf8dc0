package com.yunhwan.queue.pause.infra.support;

import com.yunhwan.queue.pause.domain.pause.BrokerEndpoint;
import com.yunhwan.queue.pause.infra.messaging.amqp.QueuePauseProperties;
import com.yunhwan.queue.pause.usecase.pause.port.BrokerEndpointResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * application.yml 의 queue-pause.brokers 에서 접속 정보를 찾는다.
 */
@Component
@RequiredArgsConstructor
public class PropertiesBrokerEndpointResolver implements BrokerEndpointResolver {

    private final QueuePauseProperties props;

    @Override
    public Optional<BrokerEndpoint> resolve(String brokerId) {
        if (brokerId == null) {
            return Optional.empty();
        }
        QueuePauseProperties.Broker b = props.getBrokers().get(brokerId);
        if (b == null) {
            return Optional.empty();
        }
        return Optional.of(new BrokerEndpoint(
                brokerId,
                b.getHost(),
                b.getAmqpPort() > 0 ? b.getAmqpPort() : BrokerEndpoint.DEFAULT_AMQP_PORT,
                b.getVhost(),
                b.getUsername(),
                b.getPassword(),
                b.isTls()
        ));
    }

    @Override
    public Set<String> brokerIds() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(props.getBrokers().keySet()));
    }
}
