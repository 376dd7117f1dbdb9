package com.platform.hacontroller.routing;

import com.platform.hacontroller.model.EndpointMapping;

/**
 * Receives every published endpoint mapping, in generation order.
 */
@FunctionalInterface
public interface EndpointMappingListener {

    void onEndpointMapping(EndpointMapping mapping);
}
