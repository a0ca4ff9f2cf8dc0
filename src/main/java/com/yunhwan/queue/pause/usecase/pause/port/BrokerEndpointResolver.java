package com.yunhwan.queue.pause.usecase.pause.port;

import com.yunhwan.queue.pause.domain.pause.BrokerEndpoint;

import java.util.Optional;
import java.util.Set;

public interface BrokerEndpointResolver {

    Optional<BrokerEndpoint> resolve(String brokerId);

    Set<String> brokerIds();
}
