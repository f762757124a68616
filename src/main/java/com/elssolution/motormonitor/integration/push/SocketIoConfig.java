package com.elssolution.motormonitor.integration.push;

import com.corundumstudio.socketio.Configuration;
import com.corundumstudio.socketio.SocketIOServer;
import com.corundumstudio.socketio.Transport;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;

/** Socket.IO endpoint for dashboards, on its own port next to the HTTP API. */
@org.springframework.context.annotation.Configuration
public class SocketIoConfig {

    @Value("${push.socketio.host:0.0.0.0}") private String host;
    @Value("${push.socketio.port:5001}")    private int port;
    @Value("${push.socketio.origin:*}")     private String origin;

    @Bean
    public SocketIOServer socketIOServer() {
        Configuration config = new Configuration();
        config.setHostname(host);
        config.setPort(port);
        config.setOrigin(origin);
        config.setTransports(Transport.WEBSOCKET, Transport.POLLING);
        config.setPingTimeout(60000);
        config.setPingInterval(25000);
        return new SocketIOServer(config);
    }
}
