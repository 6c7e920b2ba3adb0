package com.example.triangle.service;

import com.example.triangle.domain.Channel;
import com.example.triangle.service.exception.AlreadyExistsException;
import java.util.HashSet;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Creates the group channel and every direct channel the roster implies. Existing channels are left untouched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChannelSeeder implements ApplicationRunner {

    private final ChannelStore channelStore;
    private final ChannelNaming channelNaming;

    @Override
    public void run(ApplicationArguments args) {
        seed();
    }

    public int seed() {
        int created = 0;
        for (Channel definition : channelNaming.seedDefinitions()) {
            Optional<Channel> existing = channelStore.findChannel(definition.getName());
            if (existing.isPresent()) {
                warnOnDrift(existing.get(), definition);
                continue;
            }
            try {
                channelStore.createChannel(definition);
                created++;
                log.info("Seeded channel {} for {}", definition.getName(), definition.getParticipants());
            } catch (AlreadyExistsException ex) {
                log.debug("Channel {} was seeded concurrently", definition.getName());
            }
        }
        return created;
    }

    private void warnOnDrift(Channel existing, Channel definition) {
        if (!new HashSet<>(existing.getParticipants()).equals(new HashSet<>(definition.getParticipants()))) {
            log.warn("Channel {} has participants {} but the roster implies {}",
                    existing.getName(), existing.getParticipants(), definition.getParticipants());
        }
    }
}
