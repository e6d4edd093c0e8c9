package in.nextopen.infrastructure.broker.common;

import java.io.IOException;

/**
 * Single HTTP exchange. Connection failures and timeouts surface as {@link IOException}.
 */
@FunctionalInterface
public interface BrokerTransport {

    BrokerHttpResponse send(BrokerHttpRequest request) throws IOException;
}
