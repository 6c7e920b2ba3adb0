package com.example.triangle.config;

import com.corundumstudio.socketio.Configuration;
import com.corundumstudio.socketio.SocketIOServer;
import com.corundumstudio.socketio.Transport;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

@org.springframework.context.annotation.Configuration
@ConditionalOnProperty(prefix = "chat.socketio", name = "enabled", havingValue = "true")
public class SocketIoConfig {

    @Bean(destroyMethod = "stop")
    public SocketIOServer socketIOServer(ChatProperties chatProperties, ObjectMapper objectMapper) {
        ChatProperties.SocketIo socketIo = chatProperties.getSocketio();
        Configuration configuration = new Configuration();
        configuration.setHostname(socketIo.getHost());
        configuration.setPort(socketIo.getPort());
        configuration.setOrigin("*");
        configuration.setTransports(Transport.WEBSOCKET, Transport.POLLING);
        configuration.setJsonSupport(new SocketIoJsonSupport(objectMapper));

        SocketIOServer server = new SocketIOServer(configuration);
        server.start();
        return server;
    }
}
