package com.elssolution.motormonitor.integration.push;

import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.SocketIOServer;
import com.elssolution.motormonitor.service.MonitorState;
import com.elssolution.motormonitor.service.MonitorView;
import com.elssolution.motormonitor.service.SensorUpdate;
import com.elssolution.motormonitor.service.StatusUpdate;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Client side of the push channel: greets new dashboards with the current state and
 * answers {@code request_update} / {@code request_recommendations}. Owns server start/stop.
 */
@Slf4j
@Component
public class SocketIoClientHandler implements SmartLifecycle {

    static final String REQUEST_UPDATE = "request_update";
    static final String REQUEST_RECOMMENDATIONS = "request_recommendations";

    private final SocketIOServer server;
    private final MonitorState state;
    private final ObjectMapper mapper;
    private final boolean enabled;
    private final AtomicInteger clients = new AtomicInteger();
    private volatile boolean running = false;

    public SocketIoClientHandler(SocketIOServer server, MonitorState state, ObjectMapper mapper,
                                 @Value("${push.socketio.enabled:true}") boolean enabled) {
        this.server = server;
        this.state = state;
        this.mapper = mapper;
        this.enabled = enabled;
    }

    @Override
    public void start() {
        if (!enabled) {
            log.info("Socket.IO push disabled");
            running = true;
            return;
        }
        server.addConnectListener(client -> {
            int n = clients.incrementAndGet();
            log.info("dashboard_connected sid={} total={}", client.getSessionId(), n);
            sendCurrent(client);
        });
        server.addDisconnectListener(client -> {
            int n = clients.decrementAndGet();
            log.info("dashboard_disconnected sid={} total={}", client.getSessionId(), n);
        });
        server.addEventListener(REQUEST_UPDATE, Object.class, (client, data, ack) -> sendCurrent(client));
        server.addEventListener(REQUEST_RECOMMENDATIONS, Object.class, (client, data, ack) ->
                send(client, MonitorEvent.RECOMMENDATIONS_UPDATE, state.view().recommendations()));
        server.start();
        running = true;
        log.info("Socket.IO server started");
    }

    @Override
    public void stop() {
        running = false;
        if (!enabled) return;
        try {
            server.stop();
            log.info("Socket.IO server stopped");
        } catch (RuntimeException e) {
            log.warn("socketio_stop_failed: {}", e.toString());
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public int connectedClients() {
        return clients.get();
    }

    void sendCurrent(SocketIOClient client) {
        MonitorView v = state.view();
        send(client, MonitorEvent.STATUS_UPDATE, StatusUpdate.of(v));
        send(client, MonitorEvent.SENSOR_UPDATE, SensorUpdate.of(v));
        send(client, MonitorEvent.HEALTH_UPDATE, v.health());
    }

    private void send(SocketIOClient client, MonitorEvent event, Object payload) {
        try {
            client.sendEvent(event.wireName(), payload == null ? null : mapper.convertValue(payload, Object.class));
        } catch (RuntimeException e) {
            log.warn("push_failed event={} sid={} err={}", event.wireName(), client.getSessionId(), e.toString());
        }
    }
}
