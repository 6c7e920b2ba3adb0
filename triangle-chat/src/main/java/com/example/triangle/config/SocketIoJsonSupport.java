package com.example.triangle.config;

import com.corundumstudio.socketio.protocol.JacksonJsonSupport;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Socket.IO codec that writes chat events exactly like the REST API does: ISO-8601 instants, the application's
 * property naming, and no null fields. Clients may send fields the server does not know.
 */
public class SocketIoJsonSupport extends JacksonJsonSupport {

    public SocketIoJsonSupport(ObjectMapper applicationMapper) {
        super(new JavaTimeModule());

        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        if (applicationMapper.getPropertyNamingStrategy() != null) {
            objectMapper.setPropertyNamingStrategy(applicationMapper.getPropertyNamingStrategy());
        }
        objectMapper.setTimeZone(applicationMapper.getSerializationConfig().getTimeZone());
    }
}
