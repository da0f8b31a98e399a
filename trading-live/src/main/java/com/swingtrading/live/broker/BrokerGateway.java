package com.swingtrading.live.broker;

import com.swingtrading.error.BrokerAuthenticationException;
import com.swingtrading.error.ExternalServiceException;

/**
 * Order routing seam. Implementations must not retry orders on their own.
 */
public interface BrokerGateway {

    /**
     * @return the broker's answer; a rejection is a normal result, not an exception
     * @throws BrokerAuthenticationException when credentials are refused
     * @throws ExternalServiceException      when the broker cannot be reached
     */
    OrderResult placeOrder(OrderRequest request);

    String name();
}
