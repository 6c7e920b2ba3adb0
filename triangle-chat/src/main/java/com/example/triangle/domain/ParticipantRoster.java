package com.example.triangle.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * The closed set of participants allowed to take part in any channel. Identifiers are restricted to ASCII letters
 * and digits so they can never collide with the separators used in canonical channel names.
 */
public final class ParticipantRoster {

    /**
     * Reserved sender for system notices. Never a roster member.
     */
    public static final String SYSTEM_SENDER = "system";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9]+");

    private final Set<String> participants;

    private ParticipantRoster(Set<String> participants) {
        this.participants = Collections.unmodifiableSet(participants);
    }

    public static ParticipantRoster of(String... participants) {
        return of(List.of(participants));
    }

    public static ParticipantRoster of(Collection<String> participants) {
        if (participants == null || participants.size() < 2) {
            throw new IllegalArgumentException("A roster needs at least two participants");
        }
        TreeSet<String> sorted = new TreeSet<>();
        for (String participant : participants) {
            if (participant == null || !IDENTIFIER.matcher(participant).matches()) {
                throw new IllegalArgumentException("Invalid participant identifier: " + participant);
            }
            if (SYSTEM_SENDER.equals(participant)) {
                throw new IllegalArgumentException("'" + SYSTEM_SENDER + "' is reserved for system notices");
            }
            if (!sorted.add(participant)) {
                throw new IllegalArgumentException("Duplicate participant identifier: " + participant);
            }
        }
        return new ParticipantRoster(sorted);
    }

    public boolean contains(String participant) {
        return participant != null && participants.contains(participant);
    }

    /**
     * Participants in lexicographic order.
     */
    public List<String> participants() {
        return List.copyOf(participants);
    }

    /**
     * Every unordered pair of participants, each pair lexicographically ordered.
     */
    public List<List<String>> pairs() {
        List<String> ordered = participants();
        List<List<String>> pairs = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i++) {
            for (int j = i + 1; j < ordered.size(); j++) {
                pairs.add(List.of(ordered.get(i), ordered.get(j)));
            }
        }
        return pairs;
    }

    @Override
    public String toString() {
        return "ParticipantRoster" + participants;
    }
}
