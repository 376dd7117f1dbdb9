package com.platform.hacontroller.routing;

import com.platform.hacontroller.model.EndpointMapping;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Pushes each published mapping to STOMP subscribers of {@code /topic/endpoints}.
 */
@Slf4j
@Component
public class WebSocketEndpointBroadcaster implements EndpointMappingListener {

    static final String ENDPOINTS_TOPIC = "/topic/endpoints";

    private final SimpMessagingTemplate messagingTemplate;

    public WebSocketEndpointBroadcaster(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    @Override
    public void onEndpointMapping(EndpointMapping mapping) {
        messagingTemplate.convertAndSend(ENDPOINTS_TOPIC, mapping);
        log.debug("Broadcast mapping generation {} to {}", mapping.generation(), ENDPOINTS_TOPIC);
    }
}
