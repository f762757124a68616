package com.elssolution.motormonitor.integration.push;

import com.corundumstudio.socketio.SocketIOServer;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Broadcasts to every connected dashboard. Payloads go through the application's
 * ObjectMapper first so clients see the same JSON shape as the REST API.
 */
@Slf4j
@Component
public class SocketIoEventPublisher implements EventPublisher {

    private final SocketIOServer server;
    private final ObjectMapper mapper;

    public SocketIoEventPublisher(SocketIOServer server, ObjectMapper mapper) {
        this.server = server;
        this.mapper = mapper;
    }

    @Override
    public void publish(MonitorEvent event, Object payload) {
        try {
            Object json = toJsonTree(payload);
            server.getBroadcastOperations().sendEvent(event.wireName(), json);
            if (log.isDebugEnabled()) log.debug("push event={}", event.wireName());
        } catch (RuntimeException e) {
            log.warn("push_failed event={} err={}", event.wireName(), e.toString());
        }
    }

    /** Plain maps/lists/scalars, which the socket server's own Jackson can write as-is. */
    Object toJsonTree(Object payload) {
        return payload == null ? null : mapper.convertValue(payload, Object.class);
    }
}
