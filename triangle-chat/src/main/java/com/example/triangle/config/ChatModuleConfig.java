package com.example.triangle.config;

import com.example.triangle.domain.ParticipantRoster;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Clock;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({ChatProperties.class, ChatSecurityProperties.class})
public class ChatModuleConfig {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer jacksonCustomizer() {
        return builder -> builder
                .modulesToInstall(JavaTimeModule.class)
                .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Bean
    public ParticipantRoster participantRoster(ChatProperties chatProperties) {
        return ParticipantRoster.of(chatProperties.getParticipants());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RateLimitingFilter rateLimitingFilter(
            ChatSecurityProperties securityProperties, ParticipantRoster participantRoster) {
        return new RateLimitingFilter(securityProperties, participantRoster);
    }
}
